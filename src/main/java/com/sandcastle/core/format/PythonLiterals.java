package com.sandcastle.core.format;

import com.sandcastle.core.model.Values;

import java.util.List;
import java.util.Map;

/**
 * Renders JSON-shaped values the way the submitted language prints them, so messages
 * such as {@code Expected [1, 2], got [2, 1]} read naturally to the author of the code.
 */
public final class PythonLiterals {

    private PythonLiterals() {}

    /**
     * {@code str()} rendering: top-level strings appear without quotes.
     */
    public static String str(Object value) {
        if (value instanceof String s) {
            return s;
        }
        return repr(value);
    }

    /**
     * {@code repr()} rendering.
     */
    public static String repr(Object value) {
        var sb = new StringBuilder();
        append(sb, value);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("None");
        } else if (value instanceof Boolean b) {
            sb.append(b ? "True" : "False");
        } else if (value instanceof String s) {
            appendQuoted(sb, s);
        } else if (Values.isFloating(value)) {
            sb.append(formatFloat(((Number) value).doubleValue()));
        } else if (value instanceof Number n) {
            sb.append(n);
        } else if (value instanceof List<?> list) {
            sb.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(", ");
                append(sb, list.get(i));
            }
            sb.append(']');
        } else if (value instanceof Map<?, ?> map) {
            sb.append('{');
            boolean first = true;
            for (var entry : map.entrySet()) {
                if (!first) sb.append(", ");
                first = false;
                append(sb, entry.getKey());
                sb.append(": ");
                append(sb, entry.getValue());
            }
            sb.append('}');
        } else {
            sb.append(value);
        }
    }

    static String formatFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e16) {
            return (long) d + ".0";
        }
        return Double.toString(d).replace("E", "e");
    }

    private static void appendQuoted(StringBuilder sb, String s) {
        char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        sb.append(quote);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == quote) sb.append('\\');
                    sb.append(c);
                }
            }
        }
        sb.append(quote);
    }
}
