package com.variantforge.document;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockScannerTest {

    @Test
    void bracesInsideStringsAreIgnored() {
        BlockScanner.DelimiterCount count = BlockScanner.countDelimiters("name: string = \"a{b}c{\" {");
        assertEquals(1, count.opens());
        assertEquals(0, count.closes());
    }

    @Test
    void escapedQuotesDoNotEndTheLiteral() {
        BlockScanner.DelimiterCount count = BlockScanner.countDelimiters("x: string = \"say \\\"{\\\"\" }");
        assertEquals(0, count.opens());
        assertEquals(1, count.closes());
    }

    @Test
    void singleQuotedLiteralsAreIgnoredToo() {
        BlockScanner.DelimiterCount count = BlockScanner.countDelimiters("x: string = '}}' {");
        assertEquals(1, count.opens());
        assertEquals(0, count.closes());
    }

    @Test
    void indexOfDelimiterSkipsQuotedBraces() {
        assertEquals(6, BlockScanner.indexOfDelimiter("a \"{\" {", '{'));
        assertEquals(-1, BlockScanner.indexOfDelimiter("\"{\"", '{'));
        assertEquals(10, BlockScanner.lastIndexOfDelimiter("A { b { } }", '}'));
    }

    @Test
    void matchingDelimiterPairsBracesOnOneLine() {
        String line = "A { b: string = \"}\" C { d } } tail";
        assertEquals(28, BlockScanner.matchingDelimiter(line, 2));
        assertEquals(26, BlockScanner.matchingDelimiter(line, line.indexOf("{ d")));
        assertEquals(-1, BlockScanner.matchingDelimiter("A { open", 2));
        assertEquals(-1, BlockScanner.matchingDelimiter(line, 0));
    }

    @Test
    void findsEndOfNestedBlock() {
        List<String> lines = List.of("A {", "  b {", "    c: u8 = 1", "  }", "}", "tail {");
        BlockScanner.BlockEnd end = BlockScanner.findBlockEnd(lines, 0);
        assertEquals(4, end.line());
        assertFalse(end.degraded());
    }

    @Test
    void singleLineBlockEndsOnItsOwnLine() {
        BlockScanner.BlockEnd end = BlockScanner.findBlockEnd(List.of("A { x: u8 = 1 }", "next"), 0);
        assertEquals(0, end.line());
        assertFalse(end.degraded());
    }

    @Test
    void openingBraceOnFollowingLineIsFound() {
        BlockScanner.BlockEnd end = BlockScanner.findBlockEnd(List.of("A =", "{", "}", "after"), 0);
        assertEquals(2, end.line());
        assertFalse(end.degraded());
    }

    @Test
    void unclosedBlockIsDegradedAtLastLine() {
        BlockScanner.BlockEnd end = BlockScanner.findBlockEnd(List.of("A {", "  b: u8 = 1", "  C {"), 0);
        assertEquals(2, end.line());
        assertTrue(end.degraded());
    }

    @Test
    void outOfRangeStartIsDegraded() {
        assertTrue(BlockScanner.findBlockEnd(List.of("A {"), 3).degraded());
        assertTrue(BlockScanner.findBlockEnd(null, 0).degraded());
    }
}
