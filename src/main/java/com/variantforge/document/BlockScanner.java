package com.variantforge.document;

import com.variantforge.AppLogger;

import java.util.List;

/**
 * Finds matching closing braces in line-oriented property-list text.
 * Braces inside double- or single-quoted string literals never count.
 */
public final class BlockScanner {

    public static final int MAX_BLOCK_LINES = 10_000;

    private BlockScanner() {
    }

    /**
     * Counts the opening and closing braces on a line that sit outside string literals.
     */
    public static DelimiterCount countDelimiters(String line) {
        if (line == null || line.isEmpty()) {
            return DelimiterCount.NONE;
        }
        int opens = 0;
        int closes = 0;
        char quote = 0;
        boolean escaped = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{') {
                opens++;
            } else if (c == '}') {
                closes++;
            }
        }
        return new DelimiterCount(opens, closes);
    }

    /**
     * Returns the character index of the first unquoted occurrence of {@code delimiter}, or -1.
     */
    public static int indexOfDelimiter(String line, char delimiter) {
        return scanDelimiter(line, delimiter, true);
    }

    /**
     * Returns the character index of the last unquoted occurrence of {@code delimiter}, or -1.
     */
    public static int lastIndexOfDelimiter(String line, char delimiter) {
        return scanDelimiter(line, delimiter, false);
    }

    /**
     * Returns the index of the brace that closes the one at {@code openIndex} on the same line, or -1.
     */
    public static int matchingDelimiter(String line, int openIndex) {
        if (line == null || openIndex < 0 || openIndex >= line.length() || line.charAt(openIndex) != '{') {
            return -1;
        }
        int depth = 0;
        char quote = 0;
        boolean escaped = false;
        for (int i = openIndex; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Finds the line that closes the block opened on {@code startLine}.
     * The block closes the first time the running depth returns to zero after having gone positive.
     * Input that never closes, or runs past {@link #MAX_BLOCK_LINES}, yields a degraded result.
     */
    public static BlockEnd findBlockEnd(List<String> lines, int startLine) {
        if (lines == null || startLine < 0 || startLine >= lines.size()) {
            return new BlockEnd(startLine, true);
        }
        int depth = 0;
        boolean opened = false;
        for (int i = startLine; i < lines.size(); i++) {
            DelimiterCount count = countDelimiters(lines.get(i));
            depth += count.opens() - count.closes();
            if (count.opens() > 0) {
                opened = true;
            }
            if (opened && depth <= 0) {
                return new BlockEnd(i, false);
            }
            if (i - startLine >= MAX_BLOCK_LINES) {
                log("Block starting at line " + (startLine + 1) + " exceeded " + MAX_BLOCK_LINES + " lines");
                return new BlockEnd(i, true);
            }
        }
        log("Block starting at line " + (startLine + 1) + " never closed");
        return new BlockEnd(lines.size() - 1, true);
    }

    private static int scanDelimiter(String line, char delimiter, boolean first) {
        if (line == null) {
            return -1;
        }
        int found = -1;
        char quote = 0;
        boolean escaped = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == delimiter) {
                if (first) {
                    return i;
                }
                found = i;
            }
        }
        return found;
    }

    private static void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[BlockScanner] " + message);
        }
    }

    public record DelimiterCount(int opens, int closes) {
        static final DelimiterCount NONE = new DelimiterCount(0, 0);
    }

    /**
     * Closing line of a block. {@code degraded} marks a best-effort boundary from malformed input.
     */
    public record BlockEnd(int line, boolean degraded) {
    }
}
