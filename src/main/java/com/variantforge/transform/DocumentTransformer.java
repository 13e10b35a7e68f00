package com.variantforge.transform;

import com.variantforge.AppLogger;
import com.variantforge.document.Document;
import com.variantforge.document.DocumentReader;
import com.variantforge.document.EntityExtractor;
import com.variantforge.document.Entry;
import com.variantforge.document.SourceText;
import com.variantforge.document.VariantState;
import com.variantforge.xref.CrossReferenceUpdater;
import com.variantforge.xref.XrefEdit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Runs a {@link TransformRequest} against a whole document: finds the selected Entries, hands each
 * to the {@link VariantTransformEngine}, splices the results back and keeps the resolver map and
 * linked-file list in step. Pure text in, text out.
 */
public class DocumentTransformer {

    private final DocumentReader reader;
    private final VariantTransformEngine engine;
    private final CrossReferenceUpdater crossReferences;
    private final TransformDefaults defaults;

    public DocumentTransformer() {
        this(new EntityExtractor(), new CrossReferenceUpdater(), TransformDefaults.defaults());
    }

    public DocumentTransformer(EntityExtractor extractor, CrossReferenceUpdater crossReferences,
                               TransformDefaults defaults) {
        this.reader = new DocumentReader(extractor);
        this.engine = new VariantTransformEngine(extractor);
        this.crossReferences = crossReferences != null ? crossReferences : new CrossReferenceUpdater();
        this.defaults = defaults != null ? defaults : TransformDefaults.defaults();
    }

    public DocumentReader getReader() {
        return reader;
    }

    public TransformDefaults getDefaults() {
        return defaults;
    }

    public TransformOutcome apply(String documentText, TransformRequest request) {
        if (documentText == null || documentText.isBlank()) {
            return TransformOutcome.failure("Document is empty", documentText);
        }
        if (request == null) {
            return TransformOutcome.failure("No transform request given", documentText);
        }
        if (request.needsIdentifiers() && request.getIdentifiers().isEmpty()) {
            return TransformOutcome.failure("No entries selected", documentText);
        }
        Document document = reader.read(documentText);
        TransformReport report = new TransformReport();
        for (String id : request.getIdentifiers()) {
            if (document.find(id).isEmpty()) {
                report.notFound(id);
            }
        }
        if (!report.getNotFound().isEmpty()) {
            return TransformOutcome.failure("Entry not found: " + String.join(", ", report.getNotFound()),
                documentText, report);
        }
        log("Running " + request.getKind() + " on " + document.getEntries().size() + " entr(ies), "
            + request.getIdentifiers().size() + " selected");
        try {
            return request.accept(new Run(document, new LinkedHashSet<>(request.getIdentifiers())));
        } catch (IllegalArgumentException e) {
            return TransformOutcome.failure(e.getMessage(), documentText);
        }
    }

    private final class Run implements TransformRequest.Visitor<TransformOutcome> {

        private final Document document;
        private final Set<String> identifiers;
        private final Map<Entry, String> replacements = new HashMap<>();
        private final Map<Entry, String> insertions = new HashMap<>();
        private final Set<Entry> removals = new HashSet<>();
        private final TransformReport report = new TransformReport();
        private final List<AssetMapping> mappings = new ArrayList<>();
        private final List<String> affected = new ArrayList<>();

        Run(Document document, Set<String> identifiers) {
            this.document = document;
            this.identifiers = identifiers;
        }

        @Override
        public TransformOutcome visit(TransformRequest.InlineVariantPair request) {
            TransformParams params = overlay(request, defaults.getInline())
                .skipExcluded(request.isSkipExcluded())
                .build();
            eachEntry(variantTargets(), entry -> engine.inlineVariantPair(entry.getText(), params));
            return TransformOutcome.success(message("Converted", "to inline variants"), affected, text(),
                mappings, report);
        }

        @Override
        public TransformOutcome visit(TransformRequest.DetachedVariantPair request) {
            TransformParams params = overlay(request, defaults.getDetached()).build();
            Map<String, String> records = new LinkedHashMap<>();
            eachEntry(variantTargets(), entry -> {
                EntryTransformResult result = detach(entry, params);
                if (result.isDetached()) {
                    addSiblingRecords(records, entry, params);
                }
                return result;
            });
            String text = addResolverRecords(text(), records);
            return TransformOutcome.success(message("Converted", "to detached variants"), affected, text,
                mappings, report);
        }

        @Override
        public TransformOutcome visit(TransformRequest.DetachedVariantDocuments request) {
            TransformParams params = overlay(request, defaults.getDetached()).build();
            Map<String, String> records = new LinkedHashMap<>();
            List<String> entriesA = new ArrayList<>();
            List<String> entriesB = new ArrayList<>();
            for (Entry entry : variantTargets()) {
                EntryTransformResult result = detach(entry, params);
                report.absorb(result.getReport());
                if (!result.isDetached()) {
                    continue;
                }
                replacements.put(entry, result.getDispatcher());
                entriesA.add(result.getSiblingA());
                entriesB.add(result.getSiblingB());
                mappings.addAll(result.getAssetMappings());
                affected.add(entry.getIdentifier());
                addSiblingRecords(records, entry, params);
            }
            String text = addResolverRecords(text(), records);
            if (!affected.isEmpty()) {
                XrefEdit linked = crossReferences.addLinkedFiles(text,
                    List.of(defaults.getLinkedPathA(), defaults.getLinkedPathB()));
                if (!linked.isSectionFound()) {
                    report.note("No linked-file list found; secondary documents were not linked");
                }
                linked.getApplied().forEach(report::crossReferenceAdded);
                linked.getSkipped().forEach(report::crossReferenceSkipped);
                text = linked.getText();
            }
            return TransformOutcome.successWithSecondaries(message("Converted", "to variant documents"), affected,
                text, entriesA, entriesB, mappings, report);
        }

        @Override
        public TransformOutcome visit(TransformRequest.Reverse request) {
            TransformParams inline = overlay(request, defaults.getInline()).build();
            TransformParams detached = overlay(request, defaults.getDetached()).build();
            String dispatchNameB = engine.getExtractor().getMarkers().getDispatchNameB();
            List<String> removedKeys = new ArrayList<>();
            eachEntry(variantTargets(), entry -> {
                if (entry.getVariantState() != VariantState.DISPATCHER) {
                    return engine.reverseInline(entry.getText(), inline);
                }
                EntryTransformResult result = engine.removeDispatchElement(entry.getText(), dispatchNameB);
                String siblingKey = entry.getIdentifier() + detached.getSuffixB();
                document.find(siblingKey).ifPresent(sibling -> {
                    removals.add(sibling);
                    result.getReport().removed(siblingKey);
                });
                removedKeys.add(siblingKey);
                return result;
            });
            String text = text();
            if (!removedKeys.isEmpty()) {
                XrefEdit edit = crossReferences.removeResolverRecords(text, removedKeys);
                edit.getApplied().forEach(report::crossReferenceRemoved);
                text = edit.getText();
            }
            return TransformOutcome.success(message("Reverted", "to their original form"), affected, text,
                mappings, report);
        }

        @Override
        public TransformOutcome visit(TransformRequest.AddProperty request) {
            if (request.getPropertyLine() == null || request.getPropertyLine().isBlank()) {
                return TransformOutcome.failure("No property line given", document.getText());
            }
            eachEntry(selected(), entry -> engine.addProperty(entry.getText(), request.getPropertyLine()));
            return TransformOutcome.success("Added property to " + report.getPropertiesInjected()
                + " sub-entr(ies), skipped " + report.getPropertySkipped().size(), affected, text(), mappings, report);
        }

        @Override
        public TransformOutcome visit(TransformRequest.RemoveProperty request) {
            if (request.getPropertyName() == null || request.getPropertyName().isBlank()) {
                return TransformOutcome.failure("No property name given", document.getText());
            }
            eachEntry(selected(), entry -> engine.removeProperty(entry.getText(), request.getPropertyName().trim()));
            return TransformOutcome.success("Removed " + report.getPropertiesRemoved() + " "
                + request.getPropertyName().trim() + " line(s)", affected, text(), mappings, report);
        }

        @Override
        public TransformOutcome visit(TransformRequest.InsertToggleScreen request) {
            Optional<Entry> existing = ToggleScreen.find(document);
            if (existing.isPresent()) {
                return TransformOutcome.failure("Toggle screen already exists: " + existing.get().getIdentifier(),
                    document.getText());
            }
            List<Entry> entries = document.getEntries();
            if (entries.isEmpty()) {
                return TransformOutcome.failure("Document has no entries to place the toggle screen next to",
                    document.getText());
            }
            Discriminator discriminator = defaults.getInline().getDiscriminator();
            if (request.getReferenceId() != null && !request.getReferenceId().isBlank()) {
                discriminator = discriminator.withReferenceId(request.getReferenceId());
            }
            String indent = SourceText.indentOf(entries.get(0).getText());
            String screen = ToggleScreen.render(indent, discriminator,
                orDefault(request.getTexturePath(), ToggleScreen.DEFAULT_TEXTURE),
                orDefault(request.getMeshPath(), ToggleScreen.DEFAULT_MESH));

            Optional<Entry> resolver = entries.stream()
                .filter(e -> e.getTypeTag().equals(crossReferences.getResolverType()))
                .findFirst();
            if (resolver.isPresent()) {
                insertions.put(resolver.get(), screen);
            } else {
                Entry last = entries.get(entries.size() - 1);
                replacements.put(last, last.getText() + "\n" + screen);
            }
            affected.add(ToggleScreen.KEY);
            log("Inserting toggle screen with reference " + discriminator.getReferenceId());
            String text = addResolverRecords(text(), Map.of(ToggleScreen.KEY, ToggleScreen.KEY));
            return TransformOutcome.success("Added toggle screen", affected, text, mappings, report);
        }

        /**
         * Without an explicit reference id, variants share the id of the document's toggle screen.
         */
        private TransformParams.Builder overlay(TransformRequest.VariantRequest request, TransformParams base) {
            TransformParams effective = base;
            if (request.getReferenceId() == null || request.getReferenceId().isBlank()) {
                String property = base.getDiscriminator().getReferenceProperty();
                Optional<String> screenId = ToggleScreen.find(document)
                    .flatMap(screen -> ToggleScreen.referenceId(screen, property));
                if (screenId.isPresent()) {
                    effective = base.toBuilder().referenceId(screenId.get()).build();
                }
            }
            return request.overlay(effective);
        }

        /** Siblings that already exist would end up as duplicate identifiers. */
        private EntryTransformResult detach(Entry entry, TransformParams params) {
            String keyA = entry.getIdentifier() + params.getSuffixA();
            String keyB = entry.getIdentifier() + params.getSuffixB();
            if (document.find(keyA).isPresent() || document.find(keyB).isPresent()) {
                TransformReport skipped = new TransformReport();
                skipped.alreadyVariant(entry.getIdentifier());
                skipped.note("Skipped " + entry.getIdentifier() + ", " + keyA + " or " + keyB + " already exists");
                log("Sibling entries of " + entry.getIdentifier() + " already exist, skipping");
                return EntryTransformResult.unchanged(entry.getText(), skipped);
            }
            return engine.detachedVariantPair(entry.getText(), params);
        }

        private List<Entry> variantTargets() {
            List<Entry> entries = new ArrayList<>();
            for (Entry entry : selected()) {
                if (ToggleScreen.isToggleScreen(entry)) {
                    report.note("Skipped " + entry.getIdentifier() + ", the toggle screen cannot be a variant");
                    continue;
                }
                entries.add(entry);
            }
            return entries;
        }

        private List<Entry> selected() {
            List<Entry> entries = new ArrayList<>();
            for (String id : identifiers) {
                document.find(id).ifPresent(entries::add);
            }
            return entries;
        }

        private void eachEntry(List<Entry> entries, Function<Entry, EntryTransformResult> transform) {
            for (Entry entry : entries) {
                EntryTransformResult result = transform.apply(entry);
                report.absorb(result.getReport());
                if (result.isChanged()) {
                    replacements.put(entry, result.getText());
                    mappings.addAll(result.getAssetMappings());
                    affected.add(entry.getIdentifier());
                }
            }
        }

        private void addSiblingRecords(Map<String, String> records, Entry entry, TransformParams params) {
            String keyA = entry.getIdentifier() + params.getSuffixA();
            String keyB = entry.getIdentifier() + params.getSuffixB();
            records.put(keyA, keyA);
            records.put(keyB, keyB);
        }

        private String addResolverRecords(String text, Map<String, String> records) {
            if (records.isEmpty()) {
                return text;
            }
            XrefEdit edit = crossReferences.addResolverRecords(text, records);
            if (!edit.isSectionFound()) {
                report.note("No resolver map found; sibling records were not added");
            }
            edit.getApplied().forEach(report::crossReferenceAdded);
            edit.getSkipped().forEach(report::crossReferenceSkipped);
            return edit.getText();
        }

        private String text() {
            StringBuilder sb = new StringBuilder(document.getHeader());
            for (Entry entry : document.getEntries()) {
                if (removals.contains(entry)) {
                    if (!entry.getPrefix().isBlank()) {
                        sb.append(entry.getPrefix());
                    }
                    continue;
                }
                sb.append(entry.getPrefix());
                if (insertions.containsKey(entry)) {
                    sb.append(insertions.get(entry)).append('\n');
                }
                sb.append(replacements.getOrDefault(entry, entry.getText()));
            }
            sb.append(document.getFooter());
            return sb.toString();
        }

        private String message(String verb, String tail) {
            if (affected.isEmpty()) {
                return "No changes made to " + String.join(", ", identifiers);
            }
            return verb + " " + affected.size() + " entr(ies) " + tail;
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[DocumentTransformer] " + message);
        }
    }
}
