package com.vidnyan.k8slint.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Run settings, bound from {@code application.yml} or {@code --k8slint.lint.*} arguments.
 */
@Data
@Component
@ConfigurationProperties(prefix = "k8slint.lint")
public class LintProperties {

    /**
     * Go file or directory to lint. Nothing runs when blank.
     */
    private String path;

    /**
     * text, json or github.
     */
    private String format = "text";

    /**
     * Least severe level reported: error, warning or info.
     */
    private String minSeverity = "info";

    private List<String> disabledRules = new ArrayList<>();

    /**
     * Rewrite files with the available fixes instead of reporting.
     */
    private boolean fix;

    /**
     * Files processed concurrently; 0 means one per available processor.
     */
    private int parallelism;
}
