package com.vidnyan.k8slint.domain.lint;

import com.vidnyan.k8slint.domain.ast.SourceFile;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Analysis engine: runs the enabled rules over one parsed file and keeps the issues
 * that pass the severity threshold. Never modifies the file; safe to share across threads.
 */
@Slf4j
public class Linter {

    private final List<Rule> rules;
    private final LintConfig config;

    public Linter(RuleRegistry registry, LintConfig config) {
        this.rules = registry.enabled(config);
        this.config = config;
    }

    public List<Issue> check(SourceFile file) {
        List<Issue> issues = new ArrayList<>();
        for (Rule rule : rules) {
            List<Issue> found;
            try {
                found = rule.check(file);
            } catch (RuntimeException e) {
                log.error("Rule {} failed on {}: {}", rule.id(), file.path(), e.getMessage(), e);
                continue;
            }
            for (Issue issue : found) {
                if (config.admits(issue.severity())) {
                    issues.add(issue);
                }
            }
        }
        return issues;
    }

    public List<Rule> rules() {
        return rules;
    }
}
