package com.variantforge.document;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Names and patterns that tie the generic reader to one flavour of the property-list format:
 * which nested blocks count as SubEntries, which properties carry display names,
 * and which file extensions mark asset references.
 */
public class FormatProfile {

    public static final String IDENTIFIER_TOKEN = "\"(?:[^\"\\\\]|\\\\.)*\"|0x[0-9a-fA-F]+";

    public static final String DEFAULT_SUB_ENTRY_TYPE = "\\w*Emitter\\w*";
    public static final String DEFAULT_ENTRY_NAME_PROPERTY = "particleName";
    public static final String DEFAULT_SUB_ENTRY_NAME_PROPERTY = "emitterName";
    public static final List<String> DEFAULT_ASSET_EXTENSIONS =
        List.of("dds", "tex", "png", "jpg", "jpeg", "tga", "scb", "sco", "skn", "skl", "anm");

    private static final Pattern ENTRY_HEADER = Pattern.compile(
        "^(\\s*)(" + IDENTIFIER_TOKEN + ")\\s*=\\s*([A-Za-z_]\\w*)\\s*\\{");

    private final String subEntryTypePattern;
    private final String entryNameProperty;
    private final String subEntryNameProperty;
    private final List<String> assetExtensions;
    private final Pattern subEntryHeader;
    private final Pattern embeddedSubEntryHeader;
    private final Pattern assetReference;

    public FormatProfile(String subEntryTypePattern, String entryNameProperty,
                         String subEntryNameProperty, List<String> assetExtensions) {
        this.subEntryTypePattern = blankToDefault(subEntryTypePattern, DEFAULT_SUB_ENTRY_TYPE);
        this.entryNameProperty = blankToDefault(entryNameProperty, DEFAULT_ENTRY_NAME_PROPERTY);
        this.subEntryNameProperty = blankToDefault(subEntryNameProperty, DEFAULT_SUB_ENTRY_NAME_PROPERTY);
        this.assetExtensions = assetExtensions == null || assetExtensions.isEmpty()
            ? DEFAULT_ASSET_EXTENSIONS
            : List.copyOf(assetExtensions);
        this.subEntryHeader = Pattern.compile(
            "^(\\s*)(?:(" + IDENTIFIER_TOKEN + ")\\s*=\\s*)?(" + this.subEntryTypePattern + ")\\s*\\{");
        this.embeddedSubEntryHeader = Pattern.compile("(?<![\\w\"])(?:" + this.subEntryTypePattern + ")\\s*\\{");
        String extensions = this.assetExtensions.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        this.assetReference = Pattern.compile("\"([^\"]+\\.(?:" + extensions + "))\"", Pattern.CASE_INSENSITIVE);
    }

    public static FormatProfile defaults() {
        return new FormatProfile(null, null, null, null);
    }

    public String getSubEntryTypePattern() {
        return subEntryTypePattern;
    }

    public String getEntryNameProperty() {
        return entryNameProperty;
    }

    public String getSubEntryNameProperty() {
        return subEntryNameProperty;
    }

    public List<String> getAssetExtensions() {
        return assetExtensions;
    }

    Pattern assetReferencePattern() {
        return assetReference;
    }

    /**
     * Matches <code>identifier = TypeTag {</code> with a quoted or hexadecimal identifier.
     */
    public Optional<Header> matchEntryHeader(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher m = ENTRY_HEADER.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new Header(m.group(1), m.group(2), m.group(3)));
    }

    /**
     * Matches a SubEntry header: either <code>identifier = TypeTag {</code> or a bare <code>TypeTag {</code>
     * whose type tag satisfies the profile's SubEntry pattern.
     */
    public Optional<Header> matchSubEntryHeader(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher m = subEntryHeader.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new Header(m.group(1), m.group(2), m.group(3)));
    }

    /** True when a SubEntry header appears anywhere in {@code text}, e.g. inside a one-line block. */
    public boolean containsSubEntryHeader(String text) {
        return text != null && embeddedSubEntryHeader.matcher(text).find();
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    /**
     * A matched block header. {@code identifierToken} is the raw token as written
     * (quotes included), or null for anonymous SubEntries.
     */
    public record Header(String indent, String identifierToken, String typeTag) {

        public String identifier() {
            return unquote(identifierToken);
        }

        public boolean isQuoted() {
            return identifierToken != null && identifierToken.startsWith("\"");
        }
    }

    public static String unquote(String token) {
        if (token == null) {
            return null;
        }
        if (token.length() >= 2 && token.startsWith("\"") && token.endsWith("\"")) {
            return token.substring(1, token.length() - 1);
        }
        return token;
    }

    public static String quote(String value) {
        return "\"" + value + "\"";
    }
}
