package com.variantforge.document;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.Map;

/**
 * A nested named block inside an Entry. Line numbers are relative to the parent Entry's text.
 */
public class SubEntry {

    private final String name;
    private final boolean nameDeclared;
    private final String identifierToken;
    private final String typeTag;
    private final String indent;
    private final int startLine;
    private final int endLine;
    private final String text;
    private final boolean hasDiscriminator;
    private final boolean hasExclusionFlag;
    private final boolean hasOverride;
    private final Map<String, Long> numericAttributes;
    private final boolean degraded;

    public SubEntry(String name, boolean nameDeclared, String identifierToken, String typeTag, String indent,
                    int startLine, int endLine, String text,
                    boolean hasDiscriminator, boolean hasExclusionFlag, boolean hasOverride,
                    Map<String, Long> numericAttributes, boolean degraded) {
        this.name = name;
        this.nameDeclared = nameDeclared;
        this.identifierToken = identifierToken;
        this.typeTag = typeTag;
        this.indent = indent;
        this.startLine = startLine;
        this.endLine = endLine;
        this.text = text;
        this.hasDiscriminator = hasDiscriminator;
        this.hasExclusionFlag = hasExclusionFlag;
        this.hasOverride = hasOverride;
        this.numericAttributes = numericAttributes != null ? Collections.unmodifiableMap(numericAttributes) : Map.of();
        this.degraded = degraded;
    }

    /** Display name: the embedded name property, else the identifier, else a positional fallback. */
    public String getName() {
        return name;
    }

    /** True when the name came from an embedded name property. */
    public boolean isNameDeclared() {
        return nameDeclared;
    }

    public String getIdentifier() {
        return FormatProfile.unquote(identifierToken);
    }

    @JsonIgnore
    public String getIdentifierToken() {
        return identifierToken;
    }

    public String getTypeTag() {
        return typeTag;
    }

    @JsonIgnore
    public String getIndent() {
        return indent;
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

    public boolean isHasDiscriminator() {
        return hasDiscriminator;
    }

    public boolean isHasExclusionFlag() {
        return hasExclusionFlag;
    }

    public boolean isHasOverride() {
        return hasOverride;
    }

    public Map<String, Long> getNumericAttributes() {
        return numericAttributes;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public boolean isSingleLine() {
        return startLine == endLine;
    }
}
