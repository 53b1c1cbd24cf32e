package com.vidnyan.k8slint.application.port.in;

import com.vidnyan.k8slint.application.port.in.LintUseCase.LintRequest;
import com.vidnyan.k8slint.domain.lint.FixResult;

import java.util.List;

/**
 * Rewrites files in place with the fixes of the enabled fixable rules.
 */
public interface FixUseCase {

    /**
     * Only files with at least one issue from an enabled fixable rule are touched, and a
     * file is written only when its content changed. The severity threshold of the
     * request does not apply here.
     */
    FixReport fix(LintRequest request);

    /**
     * IDs of the rules that can fix their findings, enabled or not.
     */
    List<String> fixableRules();

    record FixReport(List<FixResult> results) {

        public FixReport {
            results = List.copyOf(results);
        }

        public List<FixResult> applied() {
            return results.stream().filter(FixResult::fixed).toList();
        }

        public List<FixResult> failed() {
            return results.stream().filter(result -> !result.fixed()).toList();
        }

        public int filesChanged() {
            return (int) applied().stream().map(FixResult::file).distinct().count();
        }

        public boolean isEmpty() {
            return results.isEmpty();
        }
    }
}
