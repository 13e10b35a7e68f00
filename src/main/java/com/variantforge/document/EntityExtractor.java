package com.variantforge.document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Finds SubEntries inside one Entry's text and derives their attributes.
 * Every lookup is bounded to the SubEntry's own span, so siblings never leak into each other.
 */
public class EntityExtractor {

    private final FormatProfile profile;
    private final CapabilityRules rules;
    private final VariantMarkers markers;

    public EntityExtractor() {
        this(FormatProfile.defaults(), CapabilityRules.defaults(), VariantMarkers.defaults());
    }

    public EntityExtractor(FormatProfile profile, CapabilityRules rules, VariantMarkers markers) {
        this.profile = profile != null ? profile : FormatProfile.defaults();
        this.rules = rules != null ? rules : CapabilityRules.defaults();
        this.markers = markers != null ? markers : VariantMarkers.defaults();
    }

    /** Same profile and rules, different variant naming. */
    public EntityExtractor withMarkers(VariantMarkers variantMarkers) {
        return new EntityExtractor(profile, rules, variantMarkers);
    }

    public FormatProfile getProfile() {
        return profile;
    }

    public CapabilityRules getRules() {
        return rules;
    }

    public VariantMarkers getMarkers() {
        return markers;
    }

    /**
     * SubEntries of an Entry, in source order. The Entry's own header line is never a candidate.
     */
    public List<SubEntry> extractSubEntries(String entryText) {
        List<SubEntry> result = new ArrayList<>();
        if (entryText == null || entryText.isEmpty()) {
            return result;
        }
        SourceText source = new SourceText(entryText);
        List<String> lines = source.lines();
        for (int i = 1; i < lines.size(); i++) {
            Optional<FormatProfile.Header> header = profile.matchSubEntryHeader(lines.get(i));
            if (header.isEmpty()) {
                continue;
            }
            BlockScanner.BlockEnd end = BlockScanner.findBlockEnd(lines, i);
            String text = source.slice(i, end.line());
            result.add(describe(header.get(), i, end.line(), text, end.degraded(), result.size()));
            i = end.line();
        }
        return result;
    }

    /**
     * Entry display name: the embedded name property if present, else the identifier.
     */
    public String displayName(String entryText, String identifier) {
        return PropertyBag.of(entryText)
            .getString(profile.getEntryNameProperty())
            .filter(s -> !s.isBlank())
            .orElse(identifier);
    }

    /**
     * Distinct quoted asset paths in order of first appearance.
     */
    public List<AssetReference> findAssetReferences(String text) {
        List<AssetReference> refs = new ArrayList<>();
        if (text == null) {
            return refs;
        }
        Set<String> seen = new LinkedHashSet<>();
        Matcher m = profile.assetReferencePattern().matcher(text);
        while (m.find()) {
            String path = m.group(1).trim();
            if (!path.isEmpty() && seen.add(path)) {
                refs.add(AssetReference.found(path));
            }
        }
        return refs;
    }

    /**
     * Variant status derived from the Entry's SubEntries. A child set with at least one dispatch
     * element is still a dispatcher, so a half-removed detached pair is never converted again.
     */
    public VariantState variantState(String entryText, List<SubEntry> subEntries) {
        boolean dispatchA = false;
        boolean dispatchB = false;
        boolean inlineA = false;
        boolean inlineB = false;
        for (SubEntry sub : subEntries) {
            String name = sub.getName();
            if (markers.getDispatchNameA().equalsIgnoreCase(name)) {
                dispatchA = true;
            } else if (markers.getDispatchNameB().equalsIgnoreCase(name)) {
                dispatchB = true;
            } else if (markers.isVariantB(name)) {
                inlineB = true;
            } else if (markers.isVariantA(name)) {
                inlineA = true;
            }
        }
        boolean childSet = entryText != null && PropertyBag.of(entryText).has(markers.getChildSetProperty());
        if ((dispatchA || dispatchB) && childSet) {
            return VariantState.DISPATCHER;
        }
        if (inlineA && inlineB) {
            return VariantState.INLINE_PAIR;
        }
        if (inlineA) {
            return VariantState.INLINE_PARTIAL;
        }
        return VariantState.NONE;
    }

    private SubEntry describe(FormatProfile.Header header, int start, int end, String text,
                              boolean degraded, int position) {
        PropertyBag bag = PropertyBag.of(text);
        Optional<String> declared = bag.getString(profile.getSubEntryNameProperty()).filter(s -> !s.isBlank());
        String name = declared.orElseGet(() -> header.identifierToken() != null
            ? header.identifier()
            : header.typeTag() + "#" + (position + 1));
        Map<String, Long> numeric = new LinkedHashMap<>();
        if (rules.getNumericAttribute() != null) {
            bag.getLong(rules.getNumericAttribute()).ifPresent(v -> numeric.put(rules.getNumericAttribute(), v));
        }
        return new SubEntry(name, declared.isPresent(), header.identifierToken(), header.typeTag(), header.indent(),
            start, end, text,
            rules.hasDiscriminator(bag), rules.hasExclusionFlag(bag), rules.hasOverride(bag),
            numeric, degraded);
    }
}
