package com.sandcastle.dispatch.api;

import com.sandcastle.core.engine.CodeExecutor;
import com.sandcastle.core.model.CodeExecutionException;
import com.sandcastle.core.model.ExecutionResult;
import com.sandcastle.core.model.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for running submissions against test cases.
 */
@RestController
@RequestMapping("/api/v1/executions")
public class ExecutionController {

    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);

    private final CodeExecutor codeExecutor;

    public ExecutionController(CodeExecutor codeExecutor) {
        this.codeExecutor = codeExecutor;
    }

    /**
     * POST /api/v1/executions: run code against test cases. Blocks until every case has
     * run or the first one fails. Syntax and internal errors are mapped by
     * {@link ApiExceptionHandler}.
     */
    @PostMapping
    public ResponseEntity<?> execute(@RequestBody ExecutionRequest request) {
        if (request.code() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "code is required"));
        }
        if (request.functionName() == null || request.functionName().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "function_name is required"));
        }
        if (request.timeoutSeconds() != null && request.timeoutSeconds() <= 0) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "timeout_seconds must be positive: " + request.timeoutSeconds()));
        }

        List<TestCase> testCases = request.testCases() == null ? List.of()
                : request.testCases().stream().map(TestCaseRequest::toTestCase).toList();
        log.info("Executing '{}' against {} test case(s)", request.functionName(), testCases.size());

        ExecutionResult result = request.timeoutSeconds() != null
                ? codeExecutor.execute(request.code(), testCases, request.functionName(), request.timeoutSeconds())
                : codeExecutor.execute(request.code(), testCases, request.functionName());
        return ResponseEntity.ok(ExecutionResponse.from(result, testCases.size()));
    }

    /**
     * POST /api/v1/executions/syntax: parse code without running it.
     */
    @PostMapping("/syntax")
    public ResponseEntity<Map<String, Object>> checkSyntax(@RequestBody SyntaxCheckRequest request) {
        try {
            codeExecutor.validateSyntax(request.code());
            return ResponseEntity.ok(Map.of("valid", true));
        } catch (CodeExecutionException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("valid", false);
            body.put("error", e.getMessage());
            body.put("kind", e.getKind().name());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
        }
    }
}
