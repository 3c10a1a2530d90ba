package com.sandcastle.core.model;

import java.util.Map;

/**
 * A single input/expected-output pair supplied by the problem source.
 *
 * <p>The input map is deep-copied on construction, so later changes to the caller's
 * collections are not observed.
 *
 * @param input       named arguments for the candidate function
 * @param expected    expected return value
 * @param description optional human-readable label
 * @param hidden      whether presenters should withhold the input and expected value
 */
public record TestCase(
    Map<String, Object> input,
    Object expected,
    String description,
    boolean hidden
) {

    public TestCase {
        input = input == null ? Map.of() : Values.deepCopyMap(input);
        expected = Values.deepCopy(expected);
    }

    public TestCase(Map<String, Object> input, Object expected) {
        this(input, expected, null, false);
    }
}
