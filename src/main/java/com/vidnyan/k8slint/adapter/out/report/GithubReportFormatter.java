package com.vidnyan.k8slint.adapter.out.report;

import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.LintResult;
import org.springframework.stereotype.Component;

/**
 * GitHub Actions workflow commands, one annotation per issue.
 */
@Component
public class GithubReportFormatter implements ReportFormatter {

    @Override
    public OutputFormat format() {
        return OutputFormat.GITHUB;
    }

    @Override
    public String render(LintResult result) {
        if (result.issues().isEmpty()) {
            return TextReportFormatter.NO_ISSUES;
        }
        StringBuilder out = new StringBuilder();
        for (Issue issue : result.sortedIssues()) {
            out.append(String.format("::%s file=%s,line=%d,col=%d,title=%s::%s%n",
                    issue.severity().annotationLevel(),
                    escapeProperty(issue.file()),
                    issue.line(),
                    issue.column(),
                    escapeProperty(issue.ruleId()),
                    escapeData(issue.message())));
        }
        out.append(System.lineSeparator());
        out.append(String.format("Found %d issue(s) in %d file(s)%n", result.issues().size(), result.filesWithIssues()));
        return out.toString();
    }

    static String escapeData(String value) {
        return value.replace("%", "%25").replace("\r", "%0D").replace("\n", "%0A");
    }

    static String escapeProperty(String value) {
        return escapeData(value).replace(":", "%3A").replace(",", "%2C");
    }
}
