package com.vidnyan.k8slint.adapter.out.report;

import com.vidnyan.k8slint.domain.lint.LintResult;

/**
 * Renders a lint result for one output format.
 */
public interface ReportFormatter {

    OutputFormat format();

    /**
     * @return the complete report, ending with a newline
     */
    String render(LintResult result);

    default boolean supports(OutputFormat format) {
        return format() == format;
    }
}
