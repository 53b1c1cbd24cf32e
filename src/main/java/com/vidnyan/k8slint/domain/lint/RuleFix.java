package com.vidnyan.k8slint.domain.lint;

import com.vidnyan.k8slint.domain.ast.SourceFile;

import java.util.List;

/**
 * Rewrites a tree in place. Returns one result per applied change and an empty list
 * when there is nothing to fix; applying a fix to its own output must change nothing.
 */
@FunctionalInterface
public interface RuleFix {

    List<FixResult> apply(SourceFile file);
}
