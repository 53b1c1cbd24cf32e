package com.vidnyan.k8slint.adapter.in.cli;

import com.vidnyan.k8slint.adapter.out.report.OutputFormat;
import com.vidnyan.k8slint.adapter.out.report.ReportFormatter;
import com.vidnyan.k8slint.application.port.in.FixUseCase;
import com.vidnyan.k8slint.application.port.in.FixUseCase.FixReport;
import com.vidnyan.k8slint.application.port.in.LintUseCase;
import com.vidnyan.k8slint.application.port.in.LintUseCase.LintRequest;
import com.vidnyan.k8slint.config.LintProperties;
import com.vidnyan.k8slint.domain.lint.FixResult;
import com.vidnyan.k8slint.domain.lint.LintConfig;
import com.vidnyan.k8slint.domain.lint.LintResult;
import com.vidnyan.k8slint.domain.lint.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;

/**
 * CLI runner. Lints (or fixes) {@code k8slint.lint.path} and writes the report to
 * standard output; logs go to standard error.
 * <p>
 * Exit codes: 0 clean, 1 error-severity issues or failed fixes, 2 invalid configuration.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LintCliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_ISSUES = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    // Inserted fields are not column-aligned with their neighbours.
    static final String GOFMT_NOTE = "Run gofmt on the %d rewritten file(s) to realign struct fields.";

    private final LintUseCase lintUseCase;
    private final FixUseCase fixUseCase;
    private final List<ReportFormatter> formatters;
    private final LintProperties properties;

    private int exitCode = EXIT_OK;

    @Override
    public void run(String... args) throws Exception {
        if (properties.getPath() == null || properties.getPath().isBlank()) {
            log.info("No path specified. Set k8slint.lint.path to a Go file or directory.");
            return;
        }
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        exitCode = execute(properties, out);
        out.flush();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Runs one lint or fix pass and writes the report.
     *
     * @return the process exit code
     */
    public int execute(LintProperties settings, Writer out) {
        LintConfig config;
        OutputFormat format;
        try {
            config = new LintConfig(
                    settings.getDisabledRules() == null ? null : new HashSet<>(settings.getDisabledRules()),
                    Severity.fromLabel(settings.getMinSeverity()));
            format = OutputFormat.fromLabel(settings.getFormat());
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        LintRequest request = new LintRequest(Path.of(settings.getPath()), config);
        try {
            if (settings.isFix()) {
                return printFixReport(fixUseCase.fix(request), out);
            }
            LintResult result = lintUseCase.lint(request);
            out.write(formatterFor(format).render(result));
            out.flush();
            return result.hasErrors() ? EXIT_ISSUES : EXIT_OK;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write report", e);
        }
    }

    private int printFixReport(FixReport report, Writer out) throws IOException {
        if (report.isEmpty()) {
            out.write("No fixable issues found. Fixable rules: "
                    + String.join(", ", fixUseCase.fixableRules()) + System.lineSeparator());
            out.flush();
            return EXIT_OK;
        }
        for (FixResult result : report.results()) {
            if (result.fixed()) {
                out.write(String.format("Fixed: [%s] %s%n", result.ruleId(), result.description()));
            } else {
                out.write(String.format("Error: %s: %s%n", result.file(), result.error()));
            }
        }
        out.write(String.format("%nFixed %d issue(s). Re-run lint to verify.%n", report.applied().size()));
        if (report.filesChanged() > 0) {
            out.write(String.format(GOFMT_NOTE + "%n", report.filesChanged()));
        }
        out.flush();
        return report.failed().isEmpty() ? EXIT_OK : EXIT_ISSUES;
    }

    private ReportFormatter formatterFor(OutputFormat format) {
        return formatters.stream()
                .filter(formatter -> formatter.supports(format))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No formatter for " + format.label()));
    }
}
