package com.sandcastle.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/executions/syntax.
 */
public record SyntaxCheckRequest(String code) {}
