package com.variantforge.document;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * A top-level named block. {@code prefix} holds the raw text between the previous Entry
 * and this one, so reassembly reproduces the source exactly.
 */
public class Entry {

    private final String identifierToken;
    private final String typeTag;
    private final int startLine;
    private final int endLine;
    private final String text;
    private final String prefix;
    private final String displayName;
    private final List<SubEntry> subEntries;
    private final VariantState variantState;
    private final boolean degraded;

    public Entry(String identifierToken, String typeTag, int startLine, int endLine, String text, String prefix,
                 String displayName, List<SubEntry> subEntries, VariantState variantState, boolean degraded) {
        this.identifierToken = identifierToken;
        this.typeTag = typeTag;
        this.startLine = startLine;
        this.endLine = endLine;
        this.text = text;
        this.prefix = prefix != null ? prefix : "";
        this.displayName = displayName;
        this.subEntries = subEntries != null ? List.copyOf(subEntries) : List.of();
        this.variantState = variantState != null ? variantState : VariantState.NONE;
        this.degraded = degraded;
    }

    public String getIdentifier() {
        return FormatProfile.unquote(identifierToken);
    }

    @JsonIgnore
    public String getIdentifierToken() {
        return identifierToken;
    }

    public boolean isHexIdentifier() {
        return identifierToken != null && !identifierToken.startsWith("\"");
    }

    public String getTypeTag() {
        return typeTag;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    @JsonIgnore
    public String getText() {
        return text;
    }

    @JsonIgnore
    public String getPrefix() {
        return prefix;
    }

    /** True when non-blank, non-Entry text sits between this Entry and the previous one. */
    public boolean isHasUnrelatedPrefix() {
        return !prefix.isBlank();
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<SubEntry> getSubEntries() {
        return subEntries;
    }

    public VariantState getVariantState() {
        return variantState;
    }

    public boolean isDegraded() {
        return degraded;
    }
}
