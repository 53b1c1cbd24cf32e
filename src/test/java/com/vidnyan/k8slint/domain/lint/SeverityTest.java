package com.vidnyan.k8slint.domain.lint;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeverityTest {

    @Test
    void isWithin_ShouldAdmitTheThresholdAndEverythingMoreSevere() {
        assertTrue(Severity.ERROR.isWithin(Severity.INFO));
        assertTrue(Severity.WARNING.isWithin(Severity.WARNING));
        assertFalse(Severity.INFO.isWithin(Severity.WARNING));
        assertFalse(Severity.WARNING.isWithin(Severity.ERROR));
    }

    @Test
    void fromLabel_ShouldAcceptLabelsInAnyCase() {
        assertEquals(Severity.ERROR, Severity.fromLabel("ERROR"));
        assertEquals(Severity.WARNING, Severity.fromLabel(" warn "));
        assertEquals(Severity.INFO, Severity.fromLabel("info"));
    }

    @Test
    void fromLabel_ShouldRejectUnknownLabels() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> Severity.fromLabel("fatal"));

        assertTrue(error.getMessage().contains("fatal"));
        assertThrows(IllegalArgumentException.class, () -> Severity.fromLabel(null));
    }

    @Test
    void annotationLevel_ShouldUseNoticeForInfo() {
        assertEquals("notice", Severity.INFO.annotationLevel());
        assertEquals("warning", Severity.WARNING.annotationLevel());
        assertEquals("error", Severity.ERROR.annotationLevel());
    }
}
