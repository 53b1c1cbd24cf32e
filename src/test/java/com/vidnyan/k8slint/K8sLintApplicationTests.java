package com.vidnyan.k8slint;

import com.vidnyan.k8slint.adapter.in.cli.LintCliRunner;
import com.vidnyan.k8slint.adapter.out.report.ReportFormatter;
import com.vidnyan.k8slint.domain.lint.RuleRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class K8sLintApplicationTests {

    @Autowired
    private RuleRegistry ruleRegistry;

    @Autowired
    private List<ReportFormatter> formatters;

    @Autowired
    private LintCliRunner cliRunner;

    @Test
    void contextLoads() {
        assertEquals(26, ruleRegistry.size());
        assertEquals(3, formatters.size());
        assertEquals(0, cliRunner.getExitCode());
    }
}
