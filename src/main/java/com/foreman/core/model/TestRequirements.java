package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Test expectations attached to a task by the breakdown step.
 *
 * @param unit unit-test requirement, may be null
 * @param e2e  end-to-end test requirement, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestRequirements(Requirement unit, Requirement e2e) {

    /**
     * @param required whether tests of this kind must exist before the task is done
     * @param pattern  glob the test files are expected to match
     */
    public record Requirement(boolean required, String pattern) {
    }

    public static TestRequirements unitTests(String pattern) {
        return new TestRequirements(new Requirement(true, pattern), null);
    }
}
