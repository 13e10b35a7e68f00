package com.variantforge.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line-addressed view over raw text. Lines are split on '\n' only, so any '\r'
 * stays part of its line and slices reproduce the input exactly.
 */
public final class SourceText {

    private final String text;
    private final List<String> lines;
    private final int[] lineStarts;

    public SourceText(String text) {
        this.text = text != null ? text : "";
        List<String> split = new ArrayList<>();
        List<Integer> starts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < this.text.length(); i++) {
            if (this.text.charAt(i) == '\n') {
                split.add(this.text.substring(start, i));
                starts.add(start);
                start = i + 1;
            }
        }
        split.add(this.text.substring(start));
        starts.add(start);
        this.lines = Collections.unmodifiableList(split);
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public String text() {
        return text;
    }

    public List<String> lines() {
        return lines;
    }

    public int lineCount() {
        return lines.size();
    }

    public String line(int index) {
        return lines.get(index);
    }

    /** Offset of the first character of the line. */
    public int lineStart(int index) {
        return lineStarts[index];
    }

    /** Offset just past the last character of the line, excluding its '\n'. */
    public int lineEnd(int index) {
        return lineStarts[index] + lines.get(index).length();
    }

    /** Raw text from the start of {@code startLine} to the end of {@code endLine}, inclusive. */
    public String slice(int startLine, int endLine) {
        return text.substring(lineStart(startLine), lineEnd(endLine));
    }

    public static String indentOf(String line) {
        if (line == null) {
            return "";
        }
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }
}
