package com.vidnyan.k8slint.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.k8slint.adapter.out.rule.BuiltInRules;
import com.vidnyan.k8slint.domain.lint.RuleRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the rule registry and shared infrastructure.
 */
@Slf4j
@Configuration
public class LintConfiguration {

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public RuleRegistry ruleRegistry() {
        return BuiltInRules.registry();
    }

    /**
     * Log available rules on startup.
     */
    @Bean
    public String logRules(RuleRegistry ruleRegistry) {
        log.info("Registered {} rules ({} fixable: {})", ruleRegistry.size(),
                ruleRegistry.fixableRuleIds().size(), String.join(", ", ruleRegistry.fixableRuleIds()));
        ruleRegistry.allRules().forEach(rule -> log.debug("  - {} [{}] {}",
                rule.id(), rule.severity().label(), rule.description()));
        return "rules-logged";
    }
}
