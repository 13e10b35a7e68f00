package com.variantforge.transform;

import com.variantforge.document.BlockScanner;
import com.variantforge.document.FormatProfile;
import com.variantforge.document.PropertyBag;
import com.variantforge.document.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Line-level edits on one isolated block of text. Every helper returns new text and leaves
 * lines it does not target exactly as they were.
 */
final class BlockEditor {

    static final String INDENT_STEP = "    ";

    private BlockEditor() {
    }

    /**
     * Splits <code>Type { a: u8 = 1 }</code> into header, body and closing lines so properties can be
     * inserted. Multi-line blocks are returned unchanged.
     */
    static String expandSingleLine(String block) {
        if (block == null || block.indexOf('\n') >= 0) {
            return block;
        }
        int open = BlockScanner.indexOfDelimiter(block, '{');
        int close = BlockScanner.lastIndexOfDelimiter(block, '}');
        if (open < 0 || close <= open) {
            return block;
        }
        String indent = SourceText.indentOf(block);
        String head = stripTrailing(block.substring(0, open + 1));
        String body = block.substring(open + 1, close).trim();
        String tail = block.substring(close);
        StringBuilder sb = new StringBuilder(head);
        if (!body.isEmpty()) {
            sb.append('\n').append(indent).append(INDENT_STEP).append(body);
        }
        sb.append('\n').append(indent).append(tail);
        return sb.toString();
    }

    /**
     * Splits blocks that open and close on one line wherever SubEntries are involved: a block that
     * holds a SubEntry header, or a SubEntry's own block. Other one-line values such as
     * <code>{ 0, 0, 0 }</code> stay as written. Returns {@code text} itself when nothing needed splitting.
     */
    static String expandNestedBlocks(String text, FormatProfile profile) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        List<String> out = new ArrayList<>();
        boolean changed = false;
        for (String line : new SourceText(text).lines()) {
            List<String> expanded = expandLine(line, profile);
            changed |= expanded.size() > 1;
            out.addAll(expanded);
        }
        return changed ? String.join("\n", out) : text;
    }

    private static List<String> expandLine(String line, FormatProfile profile) {
        List<String> result = new ArrayList<>();
        int open = BlockScanner.indexOfDelimiter(line, '{');
        int close = open < 0 ? -1 : BlockScanner.matchingDelimiter(line, open);
        String body = close < 0 ? "" : line.substring(open + 1, close).trim();
        if (body.isEmpty()
            || (profile.matchSubEntryHeader(line).isEmpty() && !profile.containsSubEntryHeader(body))) {
            result.add(line);
            return result;
        }
        String indent = SourceText.indentOf(line);
        result.add(stripTrailing(line.substring(0, open + 1)));
        result.addAll(expandLine(indent + INDENT_STEP + body, profile));
        String rest = line.substring(close + 1);
        if (BlockScanner.indexOfDelimiter(rest, '{') >= 0) {
            result.add(indent + "}");
            result.addAll(expandLine(indent + rest.trim(), profile));
        } else {
            result.add(indent + line.substring(close));
        }
        return result;
    }

    /** Inserts lines right after the header line, one indent step deeper than the header. */
    static String insertAfterHeader(String block, List<String> propertyLines) {
        String expanded = expandSingleLine(block);
        int newline = expanded.indexOf('\n');
        if (newline < 0) {
            return expanded;
        }
        String header = expanded.substring(0, newline);
        String indent = SourceText.indentOf(header) + INDENT_STEP;
        StringBuilder sb = new StringBuilder(header);
        for (String line : propertyLines) {
            sb.append('\n').append(indent).append(line);
        }
        sb.append(expanded.substring(newline));
        return sb.toString();
    }

    /**
     * Assignments that sit directly inside the block, not inside one of its nested blocks.
     * Line numbers are relative to the block.
     */
    static List<PropertyBag.Property> ownProperties(String block) {
        List<PropertyBag.Property> result = new ArrayList<>();
        List<String> lines = new SourceText(block).lines();
        int depth = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (i > 0 && depth == 1) {
                PropertyBag.Property property = PropertyBag.parseLine(line, i);
                if (property != null) {
                    result.add(property);
                }
            }
            BlockScanner.DelimiterCount count = BlockScanner.countDelimiters(line);
            depth += count.opens() - count.closes();
        }
        return result;
    }

    /** First assignment of {@code name} anywhere in the block, matching how names are read. */
    static PropertyBag.Property firstProperty(String block, String name) {
        List<String> lines = new SourceText(block).lines();
        for (int i = 0; i < lines.size(); i++) {
            PropertyBag.Property property = PropertyBag.parseLine(lines.get(i), i);
            if (property != null && property.name().equalsIgnoreCase(name)) {
                return property;
            }
        }
        return null;
    }

    /** Rewrites the value of the assignment on {@code lineIndex}, keeping name, type and line ending. */
    static String setValue(String block, int lineIndex, String newValue) {
        SourceText source = new SourceText(block);
        String line = source.line(lineIndex);
        int colon = line.indexOf(':');
        int eq = colon < 0 ? -1 : line.indexOf('=', colon);
        if (eq < 0) {
            return block;
        }
        String trailing = line.endsWith("\r") ? "\r" : "";
        String rewritten = line.substring(0, eq + 1) + " " + newValue + trailing;
        return block.substring(0, source.lineStart(lineIndex)) + rewritten
            + block.substring(source.lineEnd(lineIndex));
    }

    static String removeLines(String block, Set<Integer> lineIndexes) {
        if (lineIndexes.isEmpty()) {
            return block;
        }
        List<String> lines = new SourceText(block).lines();
        List<String> kept = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (!lineIndexes.contains(i)) {
                kept.add(lines.get(i));
            }
        }
        return String.join("\n", kept);
    }

    /** Replaces the identifier token on the header line only. */
    static String renameHeaderIdentifier(String block, String oldToken, String newToken) {
        int newline = block.indexOf('\n');
        String header = newline < 0 ? block : block.substring(0, newline);
        int at = header.indexOf(oldToken);
        if (at < 0) {
            return block;
        }
        String renamed = header.substring(0, at) + newToken + header.substring(at + oldToken.length());
        return newline < 0 ? renamed : renamed + block.substring(newline);
    }

    /** Replaces every quoted occurrence of {@code from} with a quoted {@code to}. */
    static String replaceQuoted(String text, String from, String to) {
        return text.replace("\"" + from + "\"", "\"" + to + "\"");
    }

    private static String stripTrailing(String value) {
        int end = value.length();
        while (end > 0 && Character.isWhitespace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }
}
