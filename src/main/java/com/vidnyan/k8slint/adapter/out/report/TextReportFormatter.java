package com.vidnyan.k8slint.adapter.out.report;

import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.LintResult;
import org.springframework.stereotype.Component;

/**
 * {@code file:line:col: severity [RULE] message} per issue, followed by a summary.
 */
@Component
public class TextReportFormatter implements ReportFormatter {

    static final String NO_ISSUES = "No issues found.\n";

    @Override
    public OutputFormat format() {
        return OutputFormat.TEXT;
    }

    @Override
    public String render(LintResult result) {
        if (result.issues().isEmpty()) {
            return NO_ISSUES;
        }
        StringBuilder out = new StringBuilder();
        for (Issue issue : result.sortedIssues()) {
            out.append(String.format("%s: %s [%s] %s%n",
                    issue.location(), issue.severity().label(), issue.ruleId(), issue.message()));
        }
        out.append(System.lineSeparator());
        out.append(String.format("Found %d issue(s) in %d file(s):%n", result.issues().size(), result.filesWithIssues()));
        out.append(String.format("  - %d error(s)%n", result.errorCount()));
        out.append(String.format("  - %d warning(s)%n", result.warningCount()));
        out.append(String.format("  - %d info%n", result.infoCount()));
        return out.toString();
    }
}
