package com.vidnyan.k8slint.domain.lint;

import java.util.Locale;

/**
 * Issue severity, most severe first. A threshold admits its own level and everything
 * more severe, so {@code INFO} admits all issues and {@code ERROR} only errors.
 */
public enum Severity {
    ERROR("error", "error"),
    WARNING("warning", "warning"),
    INFO("info", "notice");

    private final String label;
    private final String annotationLevel;

    Severity(String label, String annotationLevel) {
        this.label = label;
        this.annotationLevel = annotationLevel;
    }

    public String label() {
        return label;
    }

    /**
     * Level used by GitHub Actions workflow commands.
     */
    public String annotationLevel() {
        return annotationLevel;
    }

    public boolean isWithin(Severity threshold) {
        return ordinal() <= threshold.ordinal();
    }

    public static Severity fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "error" -> ERROR;
            case "warning", "warn" -> WARNING;
            case "info" -> INFO;
            default -> throw new IllegalArgumentException(
                    "Invalid severity '" + value + "': must be 'error', 'warning' or 'info'");
        };
    }
}
