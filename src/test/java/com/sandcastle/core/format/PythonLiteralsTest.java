package com.sandcastle.core.format;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PythonLiteralsTest {

    @Test
    @DisplayName("scalars render like Python")
    void scalars() {
        assertEquals("None", PythonLiterals.str(null));
        assertEquals("True", PythonLiterals.str(true));
        assertEquals("10", PythonLiterals.str(10L));
        assertEquals("2.5", PythonLiterals.str(2.5));
        assertEquals("3.0", PythonLiterals.str(3.0));
    }

    @Test
    @DisplayName("top-level strings are unquoted, nested strings are quoted")
    void strings() {
        assertEquals("hello", PythonLiterals.str("hello"));
        assertEquals("'hello'", PythonLiterals.repr("hello"));
        assertEquals("['a', \"it's\"]", PythonLiterals.str(List.of("a", "it's")));
    }

    @Test
    @DisplayName("containers render with Python punctuation")
    void containers() {
        var map = new LinkedHashMap<String, Object>();
        map.put("a", 1L);
        map.put("b", Arrays.asList(null, false));
        assertEquals("{'a': 1, 'b': [None, False]}", PythonLiterals.str(map));
        assertEquals("[]", PythonLiterals.str(List.of()));
    }

    @Test
    @DisplayName("special floats")
    void specialFloats() {
        assertEquals("nan", PythonLiterals.formatFloat(Double.NaN));
        assertEquals("inf", PythonLiterals.formatFloat(Double.POSITIVE_INFINITY));
        assertEquals("-inf", PythonLiterals.formatFloat(Double.NEGATIVE_INFINITY));
        assertEquals("1.0e-10", PythonLiterals.formatFloat(1e-10));
    }
}
