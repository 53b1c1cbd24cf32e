package com.vidnyan.k8slint.adapter.out.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.LintResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.List;

@Component
@RequiredArgsConstructor
public class JsonReportFormatter implements ReportFormatter {

    private final ObjectMapper objectMapper;

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public String render(LintResult result) {
        JsonReport report = new JsonReport(
                result.sortedIssues().stream().map(JsonIssue::of).toList(),
                result.totalFiles(),
                result.filesWithIssues(),
                result.errorCount(),
                result.warningCount(),
                result.infoCount());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize lint result", e);
        }
    }

    record JsonReport(
        @JsonProperty("issues") List<JsonIssue> issues,
        @JsonProperty("total_files") int totalFiles,
        @JsonProperty("files_with_issues") int filesWithIssues,
        @JsonProperty("error_count") int errorCount,
        @JsonProperty("warning_count") int warningCount,
        @JsonProperty("info_count") int infoCount
    ) {}

    record JsonIssue(
        @JsonProperty("rule") String rule,
        @JsonProperty("message") String message,
        @JsonProperty("file") String file,
        @JsonProperty("line") int line,
        @JsonProperty("column") int column,
        @JsonProperty("severity") String severity
    ) {
        static JsonIssue of(Issue issue) {
            return new JsonIssue(issue.ruleId(), issue.message(), issue.file(),
                    issue.line(), issue.column(), issue.severity().label());
        }
    }
}
