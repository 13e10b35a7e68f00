package com.variantforge.transform;

import com.variantforge.AppLogger;
import com.variantforge.document.AssetReference;
import com.variantforge.document.BlockScanner;
import com.variantforge.document.DocumentReader;
import com.variantforge.document.Entry;
import com.variantforge.document.EntityExtractor;
import com.variantforge.document.FormatProfile;
import com.variantforge.document.PropertyBag;
import com.variantforge.document.SourceText;
import com.variantforge.document.SubEntry;
import com.variantforge.document.VariantMarkers;
import com.variantforge.document.VariantState;
import com.variantforge.transform.TransformParams.Side;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure Entry-level transforms. Each call takes one Entry's raw text and returns replacement text,
 * the asset copies the caller must perform and a report. No storage is touched here.
 */
public class VariantTransformEngine {

    private static final Pattern PROPERTY_LINE = Pattern.compile("^([A-Za-z_]\\w*)\\s*:\\s*[^=]+=.*$");

    private final EntityExtractor extractor;

    public VariantTransformEngine() {
        this(new EntityExtractor());
    }

    public VariantTransformEngine(EntityExtractor extractor) {
        this.extractor = extractor != null ? extractor : new EntityExtractor();
    }

    public EntityExtractor getExtractor() {
        return extractor;
    }

    /**
     * Duplicates every SubEntry in place: the original becomes the A copy, a B copy follows it.
     * SubEntries matching the exclusion predicate pass through untouched. An Entry that already
     * carries only A copies gets its missing B copies; a complete pair is left alone.
     */
    public EntryTransformResult inlineVariantPair(String entryText, TransformParams params) {
        return onExpanded(entryText, text -> inlinePair(text, params));
    }

    private EntryTransformResult inlinePair(String entryText, TransformParams params) {
        TransformReport report = new TransformReport();
        EntityExtractor scoped = extractor.withMarkers(params.markers());
        Optional<Entry> parsed = new DocumentReader(scoped).readEntry(entryText);
        if (parsed.isEmpty()) {
            report.note("No entry header found");
            return EntryTransformResult.unchanged(entryText, report);
        }
        Entry entry = parsed.get();
        VariantState state = entry.getVariantState();
        if (state == VariantState.INLINE_PAIR || state == VariantState.DISPATCHER) {
            log("Entry " + entry.getIdentifier() + " already has both variants (" + state + "), skipping");
            report.alreadyVariant(entry.getIdentifier());
            return EntryTransformResult.unchanged(entryText, report);
        }
        if (state == VariantState.INLINE_PARTIAL) {
            return completeHalfPair(entryText, entry, params, scoped, report);
        }
        if (entry.getSubEntries().isEmpty()) {
            report.note("Entry " + entry.getIdentifier() + " has no sub-entries");
            return EntryTransformResult.unchanged(entryText, report);
        }

        SourceText source = new SourceText(entryText);
        Map<String, AssetMapping> mappings = new LinkedHashMap<>();
        StringBuilder out = new StringBuilder();
        int cursor = 0;
        for (SubEntry sub : entry.getSubEntries()) {
            if (sub.isDegraded()) {
                report.degraded(sub.getName());
                continue;
            }
            if (params.getExclusion().test(sub)) {
                log("Keeping excluded sub-entry unchanged: " + sub.getName());
                report.excluded(sub.getName());
                continue;
            }
            String copyA = variantCopy(sub, Side.A, params, scoped, report, mappings);
            String copyB = variantCopy(sub, Side.B, params, scoped, report, mappings);
            out.append(entryText, cursor, source.lineStart(sub.getStartLine()));
            out.append(copyA).append('\n').append(copyB);
            cursor = source.lineEnd(sub.getEndLine());
            report.countDuplicated();
        }
        if (report.getDuplicated() == 0) {
            return EntryTransformResult.unchanged(entryText, report);
        }
        out.append(entryText.substring(cursor));
        return EntryTransformResult.changed(out.toString(), new ArrayList<>(mappings.values()), report);
    }

    /**
     * Replaces the Entry with a dispatcher and two full sibling copies. Siblings are keyed by the
     * original identifier plus the A and B suffixes of {@code params}; existing variants are detected
     * with the extractor's own markers.
     */
    public EntryTransformResult detachedVariantPair(String entryText, TransformParams params) {
        return onExpanded(entryText, text -> detachedPair(text, params));
    }

    private EntryTransformResult detachedPair(String entryText, TransformParams params) {
        TransformReport report = new TransformReport();
        EntityExtractor scoped = extractor;
        Optional<Entry> parsed = new DocumentReader(scoped).readEntry(entryText);
        if (parsed.isEmpty()) {
            report.note("No entry header found");
            return EntryTransformResult.unchanged(entryText, report);
        }
        Entry entry = parsed.get();
        if (entry.getVariantState() != VariantState.NONE) {
            report.alreadyVariant(entry.getIdentifier());
            return EntryTransformResult.unchanged(entryText, report);
        }
        if (entry.isDegraded()) {
            report.degraded(entry.getIdentifier());
            return EntryTransformResult.unchanged(entryText, report);
        }

        String key = entry.getIdentifier();
        String keyA = key + params.getSuffixA();
        String keyB = key + params.getSuffixB();
        Map<String, AssetMapping> mappings = new LinkedHashMap<>();
        String siblingA = sibling(entry, keyA, Side.A, params, scoped, report, mappings);
        String siblingB = sibling(entry, keyB, Side.B, params, scoped, report, mappings);

        String subType = entry.getSubEntries().isEmpty() ? null : entry.getSubEntries().get(0).getTypeTag();
        DispatcherTemplate template = new DispatcherTemplate(scoped.getProfile(), scoped.getMarkers());
        String dispatcher = template.render(SourceText.indentOf(entryText), entry.getIdentifierToken(), key,
            entry.getTypeTag(), subType, keyA, keyB);
        report.countDuplicated();
        log("Detached " + key + " into " + keyA + " and " + keyB);
        return EntryTransformResult.detached(dispatcher, siblingA, siblingB, new ArrayList<>(mappings.values()), report);
    }

    /**
     * Undoes {@link #inlineVariantPair}: B copies are deleted, A copies lose their suffix and the
     * discriminator this engine injected. Discriminator values that differ from what would have been
     * injected are kept and reported.
     */
    public EntryTransformResult reverseInline(String entryText, TransformParams params) {
        TransformReport report = new TransformReport();
        EntityExtractor scoped = extractor.withMarkers(params.markers());
        Optional<Entry> parsed = new DocumentReader(scoped).readEntry(entryText);
        if (parsed.isEmpty()) {
            report.note("No entry header found");
            return EntryTransformResult.unchanged(entryText, report);
        }
        Entry entry = parsed.get();
        VariantMarkers markers = scoped.getMarkers();
        SourceText source = new SourceText(entryText);
        StringBuilder out = new StringBuilder();
        int cursor = 0;
        boolean changed = false;
        for (SubEntry sub : entry.getSubEntries()) {
            if (sub.isDegraded()) {
                report.degraded(sub.getName());
                continue;
            }
            if (markers.isVariantB(sub.getName())) {
                out.append(entryText, cursor, source.lineStart(sub.getStartLine()));
                cursor = lineAfter(source, sub.getEndLine());
                report.removed(sub.getName());
                changed = true;
            } else if (markers.isVariantA(sub.getName())) {
                out.append(entryText, cursor, source.lineStart(sub.getStartLine()));
                out.append(restoreVariantA(sub, params, scoped, report));
                cursor = source.lineEnd(sub.getEndLine());
                changed = true;
            }
        }
        if (!changed) {
            report.note("No variants found in " + entry.getIdentifier());
            return EntryTransformResult.unchanged(entryText, report);
        }
        out.append(entryText.substring(cursor));
        return EntryTransformResult.changed(out.toString(), List.of(), report);
    }

    /**
     * Removes the dispatch element named {@code dispatchName} from a dispatcher Entry.
     */
    public EntryTransformResult removeDispatchElement(String entryText, String dispatchName) {
        TransformReport report = new TransformReport();
        Optional<Entry> parsed = new DocumentReader(extractor).readEntry(entryText);
        if (parsed.isEmpty()) {
            report.note("No entry header found");
            return EntryTransformResult.unchanged(entryText, report);
        }
        SourceText source = new SourceText(entryText);
        for (SubEntry sub : parsed.get().getSubEntries()) {
            if (dispatchName.equalsIgnoreCase(sub.getName())) {
                String text = entryText.substring(0, source.lineStart(sub.getStartLine()))
                    + entryText.substring(lineAfter(source, sub.getEndLine()));
                report.removed(sub.getName());
                return EntryTransformResult.changed(text, List.of(), report);
            }
        }
        report.note("No dispatch element named " + dispatchName);
        return EntryTransformResult.unchanged(entryText, report);
    }

    /**
     * Inserts the discriminator lines after the SubEntry header unless a mode or reference
     * property is already present. Applying it twice gives the same text as applying it once.
     */
    public InjectionResult injectDiscriminator(String subEntryText, int mode, Discriminator discriminator) {
        PropertyBag bag = PropertyBag.of(subEntryText);
        if (bag.has(discriminator.getModeProperty()) || bag.has(discriminator.getReferenceProperty())) {
            return new InjectionResult(subEntryText, false);
        }
        List<String> lines = new ArrayList<>(discriminator.render(mode));
        String override = discriminator.getOverrideProperty();
        if (override != null && bag.has(override)) {
            lines.removeIf(line -> {
                PropertyBag.Property property = PropertyBag.parseLine(line, 0);
                return property != null && property.name().equalsIgnoreCase(override);
            });
        }
        return new InjectionResult(BlockEditor.insertAfterHeader(subEntryText, lines), true);
    }

    /**
     * Adds {@code propertyLine} to every SubEntry that does not already assign that property name.
     */
    public EntryTransformResult addProperty(String entryText, String propertyLine) {
        return onExpanded(entryText, text -> propertyAdded(text, propertyLine));
    }

    private EntryTransformResult propertyAdded(String entryText, String propertyLine) {
        TransformReport report = new TransformReport();
        String line = propertyLine == null ? "" : propertyLine.trim();
        Matcher m = PROPERTY_LINE.matcher(line);
        if (!m.matches()) {
            report.note("Not a property assignment: " + line);
            return EntryTransformResult.unchanged(entryText, report);
        }
        String name = m.group(1);
        Optional<Entry> parsed = new DocumentReader(extractor).readEntry(entryText);
        if (parsed.isEmpty()) {
            report.note("No entry header found");
            return EntryTransformResult.unchanged(entryText, report);
        }
        SourceText source = new SourceText(entryText);
        StringBuilder out = new StringBuilder();
        int cursor = 0;
        for (SubEntry sub : parsed.get().getSubEntries()) {
            if (sub.isDegraded()) {
                report.degraded(sub.getName());
                continue;
            }
            if (PropertyBag.of(sub.getText()).has(name)) {
                report.propertySkipped(sub.getName());
                continue;
            }
            out.append(entryText, cursor, source.lineStart(sub.getStartLine()));
            out.append(BlockEditor.insertAfterHeader(sub.getText(), List.of(line)));
            cursor = source.lineEnd(sub.getEndLine());
            report.countPropertyInjected();
        }
        if (report.getPropertiesInjected() == 0) {
            return EntryTransformResult.unchanged(entryText, report);
        }
        out.append(entryText.substring(cursor));
        return EntryTransformResult.changed(out.toString(), List.of(), report);
    }

    /**
     * Removes every single-line assignment of {@code propertyName} inside the Entry.
     * Assignments that open a nested block are left alone.
     */
    public EntryTransformResult removeProperty(String entryText, String propertyName) {
        return onExpanded(entryText, text -> propertyRemoved(text, propertyName));
    }

    private EntryTransformResult propertyRemoved(String entryText, String propertyName) {
        TransformReport report = new TransformReport();
        SourceText source = new SourceText(entryText);
        Set<Integer> remove = new HashSet<>();
        for (int i = 1; i < source.lineCount(); i++) {
            String line = source.line(i);
            PropertyBag.Property property = PropertyBag.parseLine(line, i);
            if (property != null && property.name().equalsIgnoreCase(propertyName)
                && isBalanced(line)) {
                remove.add(i);
            }
        }
        if (remove.isEmpty()) {
            return EntryTransformResult.unchanged(entryText, report);
        }
        report.countPropertiesRemoved(remove.size());
        return EntryTransformResult.changed(BlockEditor.removeLines(entryText, remove), List.of(), report);
    }

    /**
     * Runs {@code transform} with one-line SubEntry blocks split into lines. Entries it leaves alone
     * keep their original layout.
     */
    private EntryTransformResult onExpanded(String entryText, Function<String, EntryTransformResult> transform) {
        String expanded = BlockEditor.expandNestedBlocks(entryText, extractor.getProfile());
        EntryTransformResult result = transform.apply(expanded);
        if (!result.isChanged() && !expanded.equals(entryText)) {
            return EntryTransformResult.unchanged(entryText, result.getReport());
        }
        return result;
    }

    private EntryTransformResult completeHalfPair(String entryText, Entry entry, TransformParams params,
                                                  EntityExtractor scoped, TransformReport report) {
        log("Entry " + entry.getIdentifier() + " already has A copies, creating B copies from them");
        VariantMarkers markers = scoped.getMarkers();
        SourceText source = new SourceText(entryText);
        Map<String, AssetMapping> mappings = new LinkedHashMap<>();
        StringBuilder out = new StringBuilder();
        int cursor = 0;
        for (SubEntry sub : entry.getSubEntries()) {
            if (sub.isDegraded() || !markers.isVariantA(sub.getName())) {
                continue;
            }
            String copyB = copyFromVariantA(sub, params, scoped, report, mappings);
            int end = source.lineEnd(sub.getEndLine());
            out.append(entryText, cursor, end);
            out.append('\n').append(copyB);
            cursor = end;
            report.countDuplicated();
        }
        out.append(entryText.substring(cursor));
        return EntryTransformResult.changed(out.toString(), new ArrayList<>(mappings.values()), report);
    }

    private String variantCopy(SubEntry sub, Side side, TransformParams params, EntityExtractor scoped,
                               TransformReport report, Map<String, AssetMapping> mappings) {
        String suffix = params.suffix(side);
        String text = rename(sub, sub.getText(), name -> name + suffix, scoped.getProfile());
        text = repath(text, params.folder(side), side, scoped, mappings);
        InjectionResult injection = injectDiscriminator(text, params.mode(side), params.getDiscriminator());
        if (injection.injected()) {
            report.countDiscriminatorInjected();
        } else {
            log("Skipping " + sub.getName() + suffix + ", it already carries a discriminator");
            report.skippedConflicting(sub.getName() + suffix);
        }
        return injection.text();
    }

    private String copyFromVariantA(SubEntry sub, TransformParams params, EntityExtractor scoped,
                                    TransformReport report, Map<String, AssetMapping> mappings) {
        VariantMarkers markers = scoped.getMarkers();
        String text = rename(sub, sub.getText(), name -> markers.baseName(name) + params.getSuffixB(),
            scoped.getProfile());

        String folderA = trimFolder(params.getFolderA());
        for (AssetReference ref : scoped.findAssetReferences(text)) {
            String path = ref.getOriginalPath();
            String target = path.startsWith(folderA + "/")
                ? trimFolder(params.getFolderB()) + path.substring(folderA.length())
                : ref.repathedTo(params.getFolderB()).getRepathedPath();
            if (!target.equals(path)) {
                text = BlockEditor.replaceQuoted(text, path, target);
                mappings.putIfAbsent(Side.B + ":" + target,
                    new AssetMapping(path, target, ref.getFilename(), Side.B.name()));
            }
        }

        Discriminator discriminator = params.getDiscriminator();
        PropertyBag.Property reference = ownProperty(text, discriminator.getReferenceProperty());
        PropertyBag.Property mode = ownProperty(text, discriminator.getModeProperty());
        if (reference != null && mode != null && discriminator.isOwnReference(reference.value())) {
            text = BlockEditor.setValue(text, mode.line(), String.valueOf(params.getModeB()));
            report.countDiscriminatorInjected();
        } else {
            log("Copying " + sub.getName() + " unchanged, its discriminator is not ours");
            report.skippedConflicting(markers.baseName(sub.getName()) + params.getSuffixB());
        }
        return text;
    }

    private String restoreVariantA(SubEntry sub, TransformParams params, EntityExtractor scoped,
                                   TransformReport report) {
        Discriminator discriminator = params.getDiscriminator();
        String text = sub.getText();
        PropertyBag.Property mode = ownProperty(text, discriminator.getModeProperty());
        PropertyBag.Property reference = ownProperty(text, discriminator.getReferenceProperty());
        PropertyBag.Property override = discriminator.getOverrideProperty() == null
            ? null : ownProperty(text, discriminator.getOverrideProperty());

        Set<Integer> remove = new HashSet<>();
        if (mode != null || reference != null) {
            boolean modeMatches = mode != null && String.valueOf(params.getModeA()).equals(mode.value().trim());
            boolean referenceMatches = reference != null && discriminator.isOwnReference(reference.value());
            if (modeMatches && referenceMatches) {
                remove.add(mode.line());
                remove.add(reference.line());
                if (override != null && discriminator.isOwnOverride(override.value())) {
                    remove.add(override.line());
                } else if (override != null) {
                    report.identityMismatch(sub.getName() + ": " + override.name() + " = " + override.value()
                        + " (expected " + discriminator.getOverrideValue() + ")");
                }
            } else {
                report.identityMismatch(sub.getName() + ": "
                    + describe(mode, String.valueOf(params.getModeA())) + ", "
                    + describe(reference, discriminator.getReferenceId()));
                log("Keeping discriminator on " + sub.getName() + ", values differ from the injected ones");
            }
        }
        text = BlockEditor.removeLines(text, remove);

        VariantMarkers markers = scoped.getMarkers();
        String baseName = markers.baseName(sub.getName());
        FormatProfile profile = scoped.getProfile();
        PropertyBag.Property nameProperty = BlockEditor.firstProperty(text, profile.getSubEntryNameProperty());
        if (nameProperty != null && isPositionalName(baseName, sub.getTypeTag())) {
            text = BlockEditor.removeLines(text, Set.of(nameProperty.line()));
        } else if (nameProperty != null && markers.isVariantA(nameProperty.unquotedValue())) {
            text = BlockEditor.setValue(text, nameProperty.line(),
                FormatProfile.quote(markers.baseName(nameProperty.unquotedValue())));
        }
        String token = sub.getIdentifierToken();
        if (token != null && token.startsWith("\"") && markers.isVariantA(sub.getIdentifier())) {
            text = BlockEditor.renameHeaderIdentifier(text, token,
                FormatProfile.quote(markers.baseName(sub.getIdentifier())));
        }
        report.restored(baseName);
        return text;
    }

    private String sibling(Entry entry, String siblingKey, Side side, TransformParams params,
                           EntityExtractor scoped, TransformReport report, Map<String, AssetMapping> mappings) {
        String text = BlockEditor.renameHeaderIdentifier(entry.getText(), entry.getIdentifierToken(),
            FormatProfile.quote(siblingKey));
        SourceText lines = new SourceText(text);
        for (int i = 1; i < lines.lineCount(); i++) {
            PropertyBag.Property property = PropertyBag.parseLine(lines.line(i), i);
            if (property != null && isSiblingNameProperty(property.name(), params)) {
                text = BlockEditor.setValue(text, i, FormatProfile.quote(siblingKey));
            }
        }
        text = repath(text, params.folder(side), side, scoped, mappings);

        List<SubEntry> subs = scoped.extractSubEntries(text);
        SourceText source = new SourceText(text);
        String result = text;
        for (int i = subs.size() - 1; i >= 0; i--) {
            SubEntry sub = subs.get(i);
            InjectionResult injection = injectDiscriminator(sub.getText(), params.mode(side),
                params.getDiscriminator());
            if (!injection.injected()) {
                report.skippedConflicting(siblingKey + "/" + sub.getName());
                continue;
            }
            report.countDiscriminatorInjected();
            result = result.substring(0, source.lineStart(sub.getStartLine())) + injection.text()
                + result.substring(source.lineEnd(sub.getEndLine()));
        }
        return result;
    }

    private String rename(SubEntry sub, String text, UnaryOperator<String> renamer, FormatProfile profile) {
        String token = sub.getIdentifierToken();
        boolean quotedIdentifier = token != null && token.startsWith("\"");
        String result = text;
        if (quotedIdentifier) {
            result = BlockEditor.renameHeaderIdentifier(result, token,
                FormatProfile.quote(renamer.apply(sub.getIdentifier())));
        }
        PropertyBag.Property nameProperty = BlockEditor.firstProperty(result, profile.getSubEntryNameProperty());
        if (nameProperty != null) {
            result = BlockEditor.setValue(result, nameProperty.line(),
                FormatProfile.quote(renamer.apply(sub.getName())));
        } else if (!quotedIdentifier) {
            result = BlockEditor.insertAfterHeader(result, List.of(
                profile.getSubEntryNameProperty() + ": string = " + FormatProfile.quote(renamer.apply(sub.getName()))));
        }
        return result;
    }

    private String repath(String text, String folder, Side side, EntityExtractor scoped,
                          Map<String, AssetMapping> mappings) {
        String result = text;
        for (AssetReference ref : scoped.findAssetReferences(text)) {
            AssetReference moved = ref.repathedTo(folder);
            if (!moved.isMoved()) {
                continue;
            }
            result = BlockEditor.replaceQuoted(result, moved.getOriginalPath(), moved.getRepathedPath());
            mappings.putIfAbsent(side + ":" + moved.getRepathedPath(), new AssetMapping(moved.getOriginalPath(),
                moved.getRepathedPath(), moved.getFilename(), side.name()));
        }
        return result;
    }

    private static PropertyBag.Property ownProperty(String block, String name) {
        for (PropertyBag.Property property : BlockEditor.ownProperties(block)) {
            if (property.name().equalsIgnoreCase(name)) {
                return property;
            }
        }
        return null;
    }

    private static boolean isSiblingNameProperty(String name, TransformParams params) {
        return params.getSiblingNameProperties().stream().anyMatch(name::equalsIgnoreCase);
    }

    private static boolean isPositionalName(String name, String typeTag) {
        return name != null && name.matches(Pattern.quote(typeTag) + "#\\d+");
    }

    private static boolean isBalanced(String line) {
        BlockScanner.DelimiterCount count = BlockScanner.countDelimiters(line);
        return count.opens() == count.closes();
    }

    private static int lineAfter(SourceText source, int line) {
        return line + 1 < source.lineCount() ? source.lineStart(line + 1) : source.lineEnd(line);
    }

    private static String describe(PropertyBag.Property property, String expected) {
        if (property == null) {
            return "missing (expected " + expected + ")";
        }
        return property.name() + " = " + property.value() + " (expected " + expected + ")";
    }

    private static String trimFolder(String folder) {
        String trimmed = folder.replace('\\', '/');
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[VariantTransformEngine] " + message);
        }
    }

    /**
     * Text after an injection attempt; {@code injected} is false when a conflicting property was found.
     */
    public record InjectionResult(String text, boolean injected) {
    }
}
