package com.vidnyan.k8slint.adapter.out.rule;

import com.vidnyan.k8slint.domain.ast.Node;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.ast.Span;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Rule;
import com.vidnyan.k8slint.domain.lint.Severity;

/**
 * Identity and issue construction shared by the built-in rules.
 */
public abstract class AbstractRule implements Rule {

    private final String id;
    private final String name;
    private final String description;
    private final Severity severity;

    protected AbstractRule(String id, String name, String description, Severity severity) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.severity = severity;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public Severity severity() {
        return severity;
    }

    protected Issue issue(SourceFile file, Node at, String message) {
        Span span = at.span();
        return span == null ? issue(file, 1, 1, message) : issue(file, span.line(), span.column(), message);
    }

    protected Issue issue(SourceFile file, int line, int column, String message) {
        return Issue.builder()
                .ruleId(id)
                .message(message)
                .file(file.path())
                .line(line)
                .column(column)
                .severity(severity)
                .build();
    }

    @Override
    public String toString() {
        return id + " (" + name + ")";
    }
}
