package com.vidnyan.k8slint.domain.lint;

import java.util.List;

/**
 * Aggregate of one run over a file or directory.
 */
public record LintResult(
    List<Issue> issues,
    int totalFiles,
    int filesWithIssues,
    int errorCount,
    int warningCount,
    int infoCount
) {

    public LintResult {
        issues = List.copyOf(issues);
    }

    public static LintResult of(List<Issue> issues, int totalFiles) {
        int errors = 0;
        int warnings = 0;
        int infos = 0;
        for (Issue issue : issues) {
            switch (issue.severity()) {
                case ERROR -> errors++;
                case WARNING -> warnings++;
                case INFO -> infos++;
            }
        }
        int files = (int) issues.stream().map(Issue::file).distinct().count();
        return new LintResult(issues, totalFiles, files, errors, warnings, infos);
    }

    public static LintResult empty() {
        return of(List.of(), 0);
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    public List<Issue> sortedIssues() {
        return issues.stream().sorted(Issue.BY_POSITION).toList();
    }
}
