package com.vidnyan.k8slint.domain.lint;

import java.util.Comparator;

/**
 * A single finding. Immutable.
 *
 * @param column 1-based byte column
 */
public record Issue(
    String ruleId,
    String message,
    String file,
    int line,
    int column,
    Severity severity
) {

    /** File, then line, then column. */
    public static final Comparator<Issue> BY_POSITION = Comparator.comparing(Issue::file)
            .thenComparingInt(Issue::line)
            .thenComparingInt(Issue::column);

    public String location() {
        return file + ":" + line + ":" + column;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleId;
        private String message;
        private String file;
        private int line = 1;
        private int column = 1;
        private Severity severity = Severity.ERROR;

        public Builder ruleId(String ruleId) { this.ruleId = ruleId; return this; }
        public Builder message(String message) { this.message = message; return this; }
        public Builder file(String file) { this.file = file; return this; }
        public Builder line(int line) { this.line = line; return this; }
        public Builder column(int column) { this.column = column; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }

        public Issue build() {
            return new Issue(ruleId, message, file, line, column, severity);
        }
    }
}
