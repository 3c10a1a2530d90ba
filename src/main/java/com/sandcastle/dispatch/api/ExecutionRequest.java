package com.sandcastle.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/executions.
 *
 * @param code           Python source defining the function under test
 * @param functionName   name of the function to call for every test case
 * @param timeoutSeconds per-test limit; nullable, defaults to the configured timeout
 * @param testCases      cases to run in order; nullable, treated as empty
 */
public record ExecutionRequest(
    String code,
    @JsonProperty("function_name") String functionName,
    @JsonProperty("timeout_seconds") Integer timeoutSeconds,
    @JsonProperty("test_cases") List<TestCaseRequest> testCases
) {}
