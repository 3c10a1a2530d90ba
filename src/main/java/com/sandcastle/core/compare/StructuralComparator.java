package com.sandcastle.core.compare;

import com.sandcastle.core.model.Values;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deep, type-aware equality between an actual return value and the expected value.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>two floating-point numbers are equal when they differ by less than {@link #FLOAT_TOLERANCE}</li>
 *   <li>two lists are equal when they have the same length and are equal element-wise</li>
 *   <li>two maps are equal when they have the same key set and equal values per key</li>
 *   <li>anything else uses plain equality; integral numbers compare by value regardless of
 *       their boxed type, an integral number equals a floating one of the same value, and a
 *       boolean compared with a number counts as 1 or 0</li>
 * </ol>
 * The rules apply recursively, so a list of floats tolerates per-element error.
 */
public final class StructuralComparator {

    /** Absolute tolerance; fixtures hold small integers and floats. */
    public static final double FLOAT_TOLERANCE = 1e-9;

    private StructuralComparator() {}

    public static boolean equivalent(Object actual, Object expected) {
        if (Values.isFloating(actual) && Values.isFloating(expected)) {
            double a = ((Number) actual).doubleValue();
            double e = ((Number) expected).doubleValue();
            return Math.abs(a - e) < FLOAT_TOLERANCE;
        }
        if (actual instanceof List<?> a && expected instanceof List<?> e) {
            return listsEquivalent(a, e);
        }
        if (actual instanceof Map<?, ?> a && expected instanceof Map<?, ?> e) {
            return mapsEquivalent(a, e);
        }
        return nativeEquals(actual, expected);
    }

    private static boolean listsEquivalent(List<?> actual, List<?> expected) {
        if (actual.size() != expected.size()) {
            return false;
        }
        Iterator<?> a = actual.iterator();
        Iterator<?> e = expected.iterator();
        while (a.hasNext()) {
            if (!equivalent(a.next(), e.next())) {
                return false;
            }
        }
        return true;
    }

    private static boolean mapsEquivalent(Map<?, ?> actual, Map<?, ?> expected) {
        if (!actual.keySet().equals(expected.keySet())) {
            return false;
        }
        for (var entry : actual.entrySet()) {
            if (!equivalent(entry.getValue(), expected.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean nativeEquals(Object actual, Object expected) {
        if (actual instanceof Boolean && isNumber(expected) || expected instanceof Boolean && isNumber(actual)) {
            return nativeEquals(asNumber(actual), asNumber(expected));
        }
        if (Values.isIntegral(actual) && Values.isIntegral(expected)) {
            return Values.toBigInteger(actual).equals(Values.toBigInteger(expected));
        }
        if (isNumber(actual) && isNumber(expected)) {
            // one integral, one floating
            double d = ((Number) (Values.isFloating(actual) ? actual : expected)).doubleValue();
            Object integral = Values.isIntegral(actual) ? actual : expected;
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return false;
            }
            return new BigDecimal(d).compareTo(new BigDecimal(Values.toBigInteger(integral))) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private static Object asNumber(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        return value;
    }

    private static boolean isNumber(Object value) {
        return Values.isIntegral(value) || Values.isFloating(value);
    }
}
