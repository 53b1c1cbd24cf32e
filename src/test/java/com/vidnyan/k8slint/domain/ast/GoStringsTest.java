package com.vidnyan.k8slint.domain.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GoStringsTest {

    @Test
    void unquote_ShouldResolveEscapesInInterpretedStrings() {
        assertEquals("a\"b\\c\nd\te", GoStrings.unquote("\"a\\\"b\\\\c\\nd\\te\""));
        assertEquals("é", GoStrings.unquote("\"\\u00e9\""));
        assertEquals("A", GoStrings.unquote("\"\\101\""));
        assertEquals("A", GoStrings.unquote("\"\\x41\""));
    }

    @Test
    void unquote_ShouldKeepRawStringsVerbatim() {
        assertEquals("-----BEGIN\\n", GoStrings.unquote("`-----BEGIN\\n`"));
        assertEquals("line1\nline2", GoStrings.unquote("`line1\r\nline2`"));
    }

    @Test
    void unquote_ShouldKeepMalformedEscapes() {
        assertEquals("\\q", GoStrings.unquote("\"\\q\""));
        assertEquals("\\u12", GoStrings.unquote("\"\\u12\""));
    }

    @Test
    void quote_ShouldProduceAGoLiteralThatUnquotesBack() {
        String text = "say \"hi\"\\\n";

        String quoted = GoStrings.quote(text);

        assertEquals("\"say \\\"hi\\\"\\\\\\n\"", quoted);
        assertEquals(text, GoStrings.unquote(quoted));
    }
}
