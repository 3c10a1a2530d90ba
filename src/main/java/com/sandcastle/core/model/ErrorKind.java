package com.sandcastle.core.model;

/**
 * Classification carried by {@link CodeExecutionException}.
 */
public enum ErrorKind {
    SYNTAX,
    RUNTIME
}
