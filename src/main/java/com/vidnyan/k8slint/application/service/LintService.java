package com.vidnyan.k8slint.application.service;

import com.vidnyan.k8slint.application.port.in.FixUseCase;
import com.vidnyan.k8slint.application.port.in.LintUseCase;
import com.vidnyan.k8slint.application.port.out.SourceFileLocator;
import com.vidnyan.k8slint.application.port.out.SourceParseException;
import com.vidnyan.k8slint.application.port.out.SourceParser;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.FixResult;
import com.vidnyan.k8slint.domain.lint.Fixer;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.LintResult;
import com.vidnyan.k8slint.domain.lint.Linter;
import com.vidnyan.k8slint.domain.lint.Rule;
import com.vidnyan.k8slint.domain.lint.RuleRegistry;
import com.vidnyan.k8slint.domain.lint.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Orchestrates lint and fix runs over a file or directory.
 * <p>
 * Files are independent: each one is parsed into its own tree and analysed or fixed on
 * a bounded pool. Results are collected in file order.
 */
@Slf4j
@Service
public class LintService implements LintUseCase, FixUseCase {

    private final SourceParser sourceParser;
    private final SourceFileLocator sourceFileLocator;
    private final RuleRegistry ruleRegistry;
    private final int parallelism;

    public LintService(SourceParser sourceParser,
                       SourceFileLocator sourceFileLocator,
                       RuleRegistry ruleRegistry,
                       @Value("${k8slint.lint.parallelism:0}") int parallelism) {
        this.sourceParser = sourceParser;
        this.sourceFileLocator = sourceFileLocator;
        this.ruleRegistry = ruleRegistry;
        this.parallelism = parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }

    @Override
    public LintResult lint(LintRequest request) {
        Instant startTime = Instant.now();
        List<Path> files = locate(request.path());
        log.info("Linting {} file(s) under {}", files.size(), request.path());

        Linter linter = new Linter(ruleRegistry, request.config());
        log.debug("Enabled rules: {}", linter.rules().size());
        List<Issue> issues = new ArrayList<>();
        forEachFile(files, file -> analyze(linter, file)).forEach(issues::addAll);

        LintResult result = LintResult.of(issues, files.size());
        log.info("Lint complete: {} issue(s) ({} error, {} warning, {} info) in {}ms",
                issues.size(), result.errorCount(), result.warningCount(), result.infoCount(),
                Duration.between(startTime, Instant.now()).toMillis());
        return result;
    }

    @Override
    public FixReport fix(LintRequest request) {
        Instant startTime = Instant.now();
        Fixer fixer = new Fixer(ruleRegistry, request.config());
        Set<String> fixable = Set.copyOf(fixer.ruleIds());
        if (fixable.isEmpty()) {
            log.info("No fixable rule is enabled");
            return new FixReport(List.of());
        }

        List<Path> files = locate(request.path());
        Linter linter = new Linter(ruleRegistry, request.config().withMinSeverity(Severity.INFO));
        List<List<Issue>> perFile = forEachFile(files, file -> analyze(linter, file));
        List<Path> candidates = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            if (perFile.get(i).stream().anyMatch(issue -> fixable.contains(issue.ruleId()))) {
                candidates.add(files.get(i));
            }
        }
        log.info("Fixing {} of {} file(s) under {}", candidates.size(), files.size(), request.path());

        List<FixResult> results = new ArrayList<>();
        forEachFile(candidates, file -> fixFile(fixer, file)).forEach(results::addAll);
        FixReport report = new FixReport(results);
        log.info("Fix complete: {} applied, {} failed, {} file(s) rewritten in {}ms",
                report.applied().size(), report.failed().size(), report.filesChanged(),
                Duration.between(startTime, Instant.now()).toMillis());
        return report;
    }

    @Override
    public List<Rule> allRules() {
        return ruleRegistry.allRules();
    }

    @Override
    public List<String> fixableRules() {
        return ruleRegistry.fixableRuleIds();
    }

    /**
     * Issues of one file. A file that cannot be parsed contributes none.
     */
    List<Issue> analyze(Linter linter, Path file) {
        try {
            SourceFile source = sourceParser.parse(file);
            return linter.check(source);
        } catch (SourceParseException e) {
            log.warn("Skipping {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    // Parse, fix, print and write as one unit; the tree never leaves this call.
    private List<FixResult> fixFile(Fixer fixer, Path file) {
        SourceFile source;
        try {
            source = sourceParser.parse(file);
        } catch (SourceParseException e) {
            log.warn("Cannot fix {}: {}", file, e.getMessage());
            return List.of(FixResult.failed(file.toString(), null, e.getMessage()));
        }

        Fixer.FixOutcome outcome = fixer.fix(source);
        if (!outcome.changed()) {
            return outcome.results();
        }
        try {
            Files.writeString(file, outcome.rewrittenSource(), StandardCharsets.UTF_8);
            log.debug("Rewrote {}", file);
            return outcome.results();
        } catch (IOException e) {
            log.error("Cannot write {}: {}", file, e.getMessage());
            String error = "cannot write file: " + e.getMessage();
            return outcome.results().stream()
                    .map(result -> result.fixed() ? result.asFailed(error) : result)
                    .toList();
        }
    }

    private List<Path> locate(Path path) {
        try {
            return sourceFileLocator.locate(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list Go files under " + path, e);
        }
    }

    private <T> List<T> forEachFile(List<Path> files, Function<Path, T> task) {
        if (files.isEmpty()) {
            return List.of();
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, files.size()));
        try {
            List<CompletableFuture<T>> futures = files.stream()
                    .map(file -> CompletableFuture.supplyAsync(() -> task.apply(file), executor))
                    .toList();
            return futures.stream().map(CompletableFuture::join).toList();
        } finally {
            executor.shutdown();
        }
    }
}
