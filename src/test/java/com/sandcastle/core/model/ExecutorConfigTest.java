package com.sandcastle.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorConfigTest {

    @Test
    void defaultsAreReasonable() {
        var config = ExecutorConfig.defaults();
        assertEquals(5, config.timeoutSeconds());
        assertEquals(256, config.memoryLimitMb());
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> new ExecutorConfig(0, 256));
        assertThrows(IllegalArgumentException.class, () -> new ExecutorConfig(5, -1));
    }

    @Test
    void syntaxExceptionKeepsInterpreterMessage() {
        var e = CodeExecutionException.syntax("Line 3: invalid syntax");
        assertEquals("Line 3: invalid syntax", e.getMessage());
        assertEquals(ErrorKind.SYNTAX, e.getKind());
        assertEquals(ErrorKind.RUNTIME, CodeExecutionException.internal("boom").getKind());
    }
}
