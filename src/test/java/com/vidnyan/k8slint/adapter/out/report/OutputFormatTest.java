package com.vidnyan.k8slint.adapter.out.report;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutputFormatTest {

    @Test
    void fromLabel_ShouldParseKnownFormats() {
        assertEquals(OutputFormat.TEXT, OutputFormat.fromLabel("text"));
        assertEquals(OutputFormat.JSON, OutputFormat.fromLabel("JSON"));
        assertEquals(OutputFormat.GITHUB, OutputFormat.fromLabel(" github "));
    }

    @Test
    void fromLabel_ShouldRejectUnknownFormats() {
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.fromLabel("xml"));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.fromLabel(null));
    }
}
