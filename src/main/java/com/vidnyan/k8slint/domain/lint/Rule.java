package com.vidnyan.k8slint.domain.lint;

import com.vidnyan.k8slint.domain.ast.SourceFile;

import java.util.List;
import java.util.Optional;

/**
 * A stateless check identified by a stable ID such as {@code WK8105}.
 * <p>
 * {@link #check} must not modify the file and must return the same issues every time it
 * is called on the same tree. Node shapes a rule does not understand simply do not match.
 */
public interface Rule {

    String id();

    String name();

    String description();

    /**
     * Severity of every issue this rule reports.
     */
    Severity severity();

    List<Issue> check(SourceFile file);

    /**
     * Mechanical correction for this rule's findings, when there is one.
     */
    default Optional<RuleFix> fix() {
        return Optional.empty();
    }
}
