package com.sandcastle.core.model;

/**
 * Thrown when an execution request cannot produce any result: the source does not
 * parse, or a worker vanished without reporting an outcome.
 *
 * <p>Per-test failures (wrong answer, runtime error, timeout) are never thrown; they are
 * reported inside {@link ExecutionResult}.
 */
public class CodeExecutionException extends RuntimeException {

    private final ErrorKind kind;

    public CodeExecutionException(String message, ErrorKind kind) {
        super(message);
        this.kind = kind;
    }

    public CodeExecutionException(String message, ErrorKind kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * @param message interpreter diagnostic in the form {@code "Line <n>: <message>"}
     */
    public static CodeExecutionException syntax(String message) {
        return new CodeExecutionException(message, ErrorKind.SYNTAX);
    }

    public static CodeExecutionException internal(String message) {
        return new CodeExecutionException(message, ErrorKind.RUNTIME);
    }

    public static CodeExecutionException internal(String message, Throwable cause) {
        return new CodeExecutionException(message, ErrorKind.RUNTIME, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }
}
