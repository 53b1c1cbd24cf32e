package com.vidnyan.k8slint.application.port.in;

import com.vidnyan.k8slint.domain.lint.LintConfig;
import com.vidnyan.k8slint.domain.lint.LintResult;
import com.vidnyan.k8slint.domain.lint.Rule;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: lint a Go file or a directory of Go files.
 */
public interface LintUseCase {

    /**
     * Files that cannot be parsed are skipped but still counted.
     *
     * @throws java.io.UncheckedIOException when the path cannot be searched
     */
    LintResult lint(LintRequest request);

    /**
     * Every registered rule, in catalogue order.
     */
    List<Rule> allRules();

    /**
     * Lint or fix request parameters.
     */
    record LintRequest(Path path, LintConfig config) {

        public LintRequest {
            config = config == null ? LintConfig.defaults() : config;
        }

        public static LintRequest forPath(Path path) {
            return new LintRequest(path, LintConfig.defaults());
        }
    }
}
