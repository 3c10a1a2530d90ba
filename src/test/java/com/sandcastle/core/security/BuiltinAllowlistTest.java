package com.sandcastle.core.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinAllowlistTest {

    @Nested
    @DisplayName("default table")
    class Defaults {

        private final BuiltinAllowlist allowlist = BuiltinAllowlist.defaults();

        @Test
        @DisplayName("allows pure functions, types and exceptions")
        void allowsPureNames() {
            for (String name : List.of("len", "sorted", "int", "dict", "isinstance", "hasattr",
                    "ValueError", "ZeroDivisionError", "None", "True", "False")) {
                assertTrue(allowlist.isAllowed(name), name);
            }
        }

        @Test
        @DisplayName("leaves out everything that reaches the host")
        void excludesHostCapabilities() {
            for (String name : BuiltinAllowlist.HOST_CAPABILITIES) {
                assertFalse(allowlist.isAllowed(name), name);
            }
        }

        @Test
        @DisplayName("names() keeps declaration order")
        void namesInOrder() {
            assertEquals(BuiltinAllowlist.DEFAULT_NAMES, allowlist.names());
        }
    }

    @Nested
    @DisplayName("configured table")
    class Configured {

        @Test
        @DisplayName("built from SecurityProperties")
        void fromProperties() {
            var props = new SecurityProperties();
            props.setAllowedBuiltins(List.of("len", " abs ", ""));
            var allowlist = new BuiltinAllowlist(props);

            assertEquals(List.of("len", "abs"), allowlist.names());
            assertFalse(allowlist.isAllowed("sorted"));
        }

        @Test
        @DisplayName("refuses to allow a host capability")
        void refusesOpen() {
            var e = assertThrows(IllegalStateException.class,
                    () -> new BuiltinAllowlist(List.of("len", "open")));
            assertTrue(e.getMessage().contains("'open'"));
        }

        @Test
        @DisplayName("properties default to the canonical table")
        void propertiesDefault() {
            assertEquals(BuiltinAllowlist.DEFAULT_NAMES, new SecurityProperties().getAllowedBuiltins());
        }
    }
}
