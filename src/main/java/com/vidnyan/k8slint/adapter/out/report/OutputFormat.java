package com.vidnyan.k8slint.adapter.out.report;

import java.util.Locale;

public enum OutputFormat {
    TEXT("text"),
    JSON("json"),
    GITHUB("github");

    private final String label;

    OutputFormat(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static OutputFormat fromLabel(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (OutputFormat format : values()) {
                if (format.label.equals(normalized)) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException(
                "Invalid format '" + value + "': must be 'text', 'json' or 'github'");
    }
}
