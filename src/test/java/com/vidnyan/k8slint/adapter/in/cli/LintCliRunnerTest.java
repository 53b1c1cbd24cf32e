package com.vidnyan.k8slint.adapter.in.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.k8slint.adapter.out.parser.TreeSitterGoParser;
import com.vidnyan.k8slint.adapter.out.report.GithubReportFormatter;
import com.vidnyan.k8slint.adapter.out.report.JsonReportFormatter;
import com.vidnyan.k8slint.adapter.out.report.TextReportFormatter;
import com.vidnyan.k8slint.adapter.out.rule.BuiltInRules;
import com.vidnyan.k8slint.adapter.out.scanner.GoSourceScanner;
import com.vidnyan.k8slint.application.service.LintService;
import com.vidnyan.k8slint.config.LintProperties;
import com.vidnyan.k8slint.testsupport.GoSources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LintCliRunnerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private LintCliRunner runner;
    private LintProperties settings;
    private StringWriter out;

    @BeforeEach
    void setUp() {
        LintService service = new LintService(new TreeSitterGoParser(), new GoSourceScanner(),
                BuiltInRules.registry(), 1);
        settings = new LintProperties();
        runner = new LintCliRunner(service, service,
                List.of(new TextReportFormatter(), new JsonReportFormatter(objectMapper), new GithubReportFormatter()),
                settings);
        out = new StringWriter();
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void execute_ShouldExitZeroForACleanFile() throws IOException {
        settings.setPath(write("clean.go", GoSources.fixture("clean_deployment.go")).toString());

        int exitCode = runner.execute(settings, out);

        assertEquals(LintCliRunner.EXIT_OK, exitCode);
        assertEquals("No issues found.\n", out.toString());
    }

    @Test
    void execute_ShouldExitOneWhenErrorsAreFound() throws IOException {
        settings.setPath(write("latest.go", """
                package manifests

                var Web = corev1.Container{Name: "web", Image: "nginx:latest", ImagePullPolicy: "Always"}
                """).toString());

        int exitCode = runner.execute(settings, out);

        assertEquals(LintCliRunner.EXIT_ISSUES, exitCode);
        assertTrue(out.toString().contains("error [WK8006]"), out.toString());
    }

    @Test
    void execute_ShouldExitZeroWhenOnlyWarningsAreFound() throws IOException {
        settings.setPath(write("svc.go", "package manifests\n\nvar Svc = corev1.Service{}\n").toString());

        int exitCode = runner.execute(settings, out);

        assertEquals(LintCliRunner.EXIT_OK, exitCode);
        assertTrue(out.toString().contains("warning [WK8102]"), out.toString());
    }

    @Test
    void execute_ShouldRejectAnInvalidFormatOrSeverity() {
        settings.setPath(tempDir.toString());
        settings.setFormat("xml");

        assertEquals(LintCliRunner.EXIT_CONFIG_ERROR, runner.execute(settings, out));

        settings.setFormat("text");
        settings.setMinSeverity("fatal");

        assertEquals(LintCliRunner.EXIT_CONFIG_ERROR, runner.execute(settings, out));
        assertEquals("", out.toString());
    }

    @Test
    void execute_ShouldWriteJsonWhenAsked() throws Exception {
        // Arrange
        settings.setPath(write("svc.go", "package manifests\n\nvar Svc = corev1.Service{}\n").toString());
        settings.setFormat("json");
        settings.setDisabledRules(List.of("WK8001"));

        // Act
        runner.execute(settings, out);

        // Assert
        JsonNode root = objectMapper.readTree(out.toString());
        assertEquals(1, root.get("total_files").asInt());
        assertEquals("WK8102", root.get("issues").get(0).get("rule").asText());
        assertEquals("warning", root.get("issues").get(0).get("severity").asText());
    }

    @Test
    void execute_ShouldReportAppliedFixes() throws IOException {
        settings.setPath(write("deep.go", GoSources.fixture("deep_nesting.go")).toString());
        settings.setFix(true);

        int exitCode = runner.execute(settings, out);

        assertEquals(LintCliRunner.EXIT_OK, exitCode);
        String report = out.toString();
        assertTrue(report.contains("Fixed: [WK8002] Extracted 2 nested structure(s) from Web at line 10"), report);
        assertTrue(report.contains("Fixed: [WK8105] Added ImagePullPolicy: \"IfNotPresent\" for image \"nginx:1.21\""),
                report);
        assertTrue(report.endsWith(String.format("%nFixed 2 issue(s). Re-run lint to verify.%n"
                + "Run gofmt on the 1 rewritten file(s) to realign struct fields.%n")), report);
    }

    @Test
    void execute_ShouldListFixableRulesWhenNothingNeedsFixing() throws IOException {
        settings.setPath(write("clean.go", GoSources.fixture("clean_deployment.go")).toString());
        settings.setFix(true);

        int exitCode = runner.execute(settings, out);

        assertEquals(LintCliRunner.EXIT_OK, exitCode);
        assertEquals("No fixable issues found. Fixable rules: WK8002, WK8105" + System.lineSeparator(), out.toString());
    }

    @Test
    void run_ShouldDoNothingWithoutAPath() throws Exception {
        runner.run();

        assertEquals(LintCliRunner.EXIT_OK, runner.getExitCode());
    }
}
