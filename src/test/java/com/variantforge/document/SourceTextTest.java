package com.variantforge.document;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceTextTest {

    @Test
    void carriageReturnsStayOnTheirLines() {
        SourceText source = new SourceText("a {\r\n  b: u8 = 1\r\n}");
        assertEquals(3, source.lineCount());
        assertEquals("a {\r", source.line(0));
        assertEquals("a {\r\n  b: u8 = 1\r\n}", source.slice(0, 2));
    }

    @Test
    void trailingNewlineYieldsEmptyLastLine() {
        SourceText source = new SourceText("x\n");
        assertEquals(2, source.lineCount());
        assertEquals("", source.line(1));
        assertEquals(2, source.lineStart(1));
    }

    @Test
    void lineOffsets() {
        SourceText source = new SourceText("ab\ncde\nf");
        assertEquals(3, source.lineStart(1));
        assertEquals(6, source.lineEnd(1));
        assertEquals("cde\nf", source.slice(1, 2));
    }

    @Test
    void nullIsEmptyText() {
        SourceText source = new SourceText(null);
        assertEquals(1, source.lineCount());
        assertEquals("", source.text());
    }

    @Test
    void indentOfMixedWhitespace() {
        assertEquals(" \t ", SourceText.indentOf(" \t x"));
        assertEquals("", SourceText.indentOf(null));
    }
}
