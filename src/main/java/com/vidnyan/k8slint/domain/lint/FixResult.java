package com.vidnyan.k8slint.domain.lint;

/**
 * Outcome of one applied or attempted fix.
 *
 * @param error failure message when {@code fixed} is false, else {@code null}
 */
public record FixResult(String file, String ruleId, boolean fixed, String description, String error) {

    public static FixResult applied(String file, String ruleId, String description) {
        return new FixResult(file, ruleId, true, description, null);
    }

    public static FixResult failed(String file, String ruleId, String error) {
        return new FixResult(file, ruleId, false, null, error);
    }

    /**
     * This change, marked as not persisted.
     */
    public FixResult asFailed(String error) {
        return new FixResult(file, ruleId, false, description, error);
    }
}
