package com.variantforge.xref;

import java.util.List;

/**
 * Result of one cross-reference edit. When {@code sectionFound} is false the text is returned as given.
 */
public class XrefEdit {

    private final String text;
    private final boolean sectionFound;
    private final List<String> applied;
    private final List<String> skipped;

    private XrefEdit(String text, boolean sectionFound, List<String> applied, List<String> skipped) {
        this.text = text;
        this.sectionFound = sectionFound;
        this.applied = List.copyOf(applied);
        this.skipped = List.copyOf(skipped);
    }

    public static XrefEdit missingSection(String text, List<String> requested) {
        return new XrefEdit(text, false, List.of(), requested);
    }

    public static XrefEdit of(String text, List<String> applied, List<String> skipped) {
        return new XrefEdit(text, true, applied, skipped);
    }

    public String getText() {
        return text;
    }

    public boolean isSectionFound() {
        return sectionFound;
    }

    /** Keys or paths actually inserted or removed. */
    public List<String> getApplied() {
        return applied;
    }

    /** Keys or paths left alone: already present on insert, absent on remove. */
    public List<String> getSkipped() {
        return skipped;
    }

    public boolean isChanged() {
        return !applied.isEmpty();
    }
}
