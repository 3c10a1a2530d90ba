package com.sandcastle.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the JSON-shaped values that flow through test cases and worker outcomes:
 * {@code null}, {@link Boolean}, numbers, {@link String}, {@link List} and {@link Map}.
 */
public final class Values {

    private Values() {}

    /**
     * Returns a deep copy of {@code value}. Nested lists and maps are fully duplicated;
     * scalars are immutable and shared. Copies are unmodifiable.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopyMap(map);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Object[] array) {
            return deepCopy(Arrays.asList(array));
        }
        return value;
    }

    /**
     * Deep copy of a name-to-value mapping. Keys are stringified; insertion order is kept.
     */
    public static Map<String, Object> deepCopyMap(Map<?, ?> map) {
        var copy = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    public static boolean isFloating(Object value) {
        return value instanceof Double || value instanceof Float || value instanceof BigDecimal;
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    public static BigInteger toBigInteger(Object integral) {
        if (integral instanceof BigInteger big) {
            return big;
        }
        return BigInteger.valueOf(((Number) integral).longValue());
    }
}
