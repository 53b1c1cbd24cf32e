package com.vidnyan.k8slint.domain.lint;

import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.ast.SourcePrinter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Auto-fix engine: applies the fixes of the enabled fixable rules to a tree it is given
 * exclusively, then prints the tree. The tree must not be used afterwards.
 */
@Slf4j
public class Fixer {

    private final Map<String, RuleFix> fixes;
    private final SourcePrinter printer = new SourcePrinter();

    public Fixer(RuleRegistry registry, LintConfig config) {
        Map<String, RuleFix> enabled = new LinkedHashMap<>();
        for (Rule rule : registry.enabled(config)) {
            rule.fix().ifPresent(fix -> enabled.put(rule.id(), fix));
        }
        this.fixes = enabled;
    }

    /**
     * @return results of every attempted fix, plus the new source when at least one applied
     */
    public FixOutcome fix(SourceFile file) {
        List<FixResult> results = new ArrayList<>();
        for (Map.Entry<String, RuleFix> entry : fixes.entrySet()) {
            try {
                results.addAll(entry.getValue().apply(file));
            } catch (RuntimeException e) {
                log.error("Fix for {} failed on {}: {}", entry.getKey(), file.path(), e.getMessage(), e);
                results.add(FixResult.failed(file.path(), entry.getKey(), e.getMessage()));
            }
        }
        if (results.stream().noneMatch(FixResult::fixed)) {
            return new FixOutcome(results, null);
        }
        try {
            return new FixOutcome(results, printer.print(file));
        } catch (RuntimeException e) {
            log.error("Could not print fixed {}: {}", file.path(), e.getMessage(), e);
            return new FixOutcome(results.stream().map(r -> r.fixed() ? r.asFailed(e.getMessage()) : r).toList(), null);
        }
    }

    public List<String> ruleIds() {
        return List.copyOf(fixes.keySet());
    }

    /**
     * @param rewrittenSource new file content, {@code null} when nothing changed
     */
    public record FixOutcome(List<FixResult> results, String rewrittenSource) {

        public boolean changed() {
            return rewrittenSource != null;
        }
    }
}
