package com.variantforge;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.variantforge.document.Document;
import com.variantforge.document.DocumentReader;
import com.variantforge.document.EntityExtractor;
import com.variantforge.document.Entry;
import com.variantforge.merge.MergeReconciler;
import com.variantforge.merge.MergeResult;
import com.variantforge.models.AuditRecord;
import com.variantforge.models.DocumentChange;
import com.variantforge.models.EntrySummary;
import com.variantforge.models.VariantDefaults;
import com.variantforge.models.VariantRunResult;
import com.variantforge.transform.AssetMapping;
import com.variantforge.transform.DocumentTransformer;
import com.variantforge.transform.TransformOutcome;
import com.variantforge.transform.TransformRequest;
import com.variantforge.xref.CrossReferenceTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives the document engine against files in the workspace: reads documents, previews transforms as
 * unified diffs, and on apply writes every touched document (after backing it up), copies the assets
 * the transform repathed and records the run in the history file.
 */
public class VariantService {

    private final DocumentWorkspace workspace;
    private final VariantDefaultsStore defaultsStore;
    private final TransformAuditStore auditStore;

    public VariantService(DocumentWorkspace workspace, VariantDefaultsStore defaultsStore,
                          TransformAuditStore auditStore) {
        this.workspace = workspace;
        this.defaultsStore = defaultsStore;
        this.auditStore = auditStore;
    }

    public List<EntrySummary> listEntries(String path) throws IOException {
        requirePath(path);
        EntityExtractor extractor = defaultsStore.loadOrDefault().toExtractor();
        Document document = new DocumentReader(extractor).read(workspace.readFile(path));
        List<EntrySummary> summaries = new ArrayList<>();
        for (Entry entry : document.getEntries()) {
            summaries.add(EntrySummary.of(entry, extractor));
        }
        return summaries;
    }

    public CrossReferenceTable crossReferences(String path) throws IOException {
        requirePath(path);
        return defaultsStore.loadOrDefault().toCrossReferenceUpdater().read(workspace.readFile(path));
    }

    /**
     * Runs the request in memory and reports the diff of every document it would touch. Nothing is written.
     */
    public VariantRunResult preview(String path, TransformRequest request) throws IOException {
        Plan plan = plan(path, request);
        return new VariantRunResult(plan.outcome(), plan.changes(), false);
    }

    public VariantRunResult apply(String path, TransformRequest request) throws IOException {
        Plan plan = plan(path, request);
        TransformOutcome outcome = plan.outcome();
        if (!outcome.isSuccess()) {
            record(path, request, outcome, List.of(), List.of());
            return new VariantRunResult(outcome, plan.changes(), false);
        }

        VariantRunResult result = new VariantRunResult(outcome, plan.changes(), true);
        List<String> written = new ArrayList<>();
        for (DocumentChange change : plan.changes()) {
            if (!change.isChanged()) {
                continue;
            }
            String backup = workspace.createBackup(change.getPath());
            if (backup != null) {
                result.getBackups().add(backup);
            }
            workspace.writeFile(change.getPath(), change.getNewText());
            written.add(change.getPath());
        }
        copyAssets(path, outcome.getAssetMappings(), result);
        record(path, request, outcome, written, result.getBackups());
        log("Applied " + request.getKind() + " to " + path + ": " + outcome.getMessage());
        return result;
    }

    public List<AuditRecord> history() throws IOException {
        return auditStore.list();
    }

    public VariantDefaults getDefaults() {
        return defaultsStore.loadOrDefault();
    }

    /**
     * Validates and persists new defaults.
     *
     * @throws IllegalArgumentException if the settings cannot produce a usable transform configuration
     */
    public VariantDefaults updateDefaults(VariantDefaults defaults) throws IOException {
        if (defaults == null) {
            throw new IllegalArgumentException("Defaults body is required");
        }
        defaults.toTransformDefaults();
        defaults.toExtractor();
        defaultsStore.save(defaults);
        log("Variant defaults updated");
        return defaults;
    }

    private Plan plan(String path, TransformRequest request) throws IOException {
        requirePath(path);
        if (request == null) {
            throw new IllegalArgumentException("Transform request is required");
        }
        VariantDefaults defaults = defaultsStore.loadOrDefault();
        DocumentTransformer transformer = new DocumentTransformer(defaults.toExtractor(),
            defaults.toCrossReferenceUpdater(), defaults.toTransformDefaults());
        String original = workspace.readFile(path);
        TransformOutcome outcome = transformer.apply(original, request);

        List<DocumentChange> changes = new ArrayList<>();
        if (!outcome.isSuccess()) {
            return new Plan(outcome, changes);
        }
        changes.add(new DocumentChange(path, false, diff(path, original, outcome.getText()), outcome.getText(),
            List.of()));

        MergeReconciler reconciler = new MergeReconciler(transformer.getReader());
        addSecondary(changes, outcome, reconciler, secondaryPath(path, defaults.getSecondaryNameA()),
            outcome.getSecondaryEntriesA());
        addSecondary(changes, outcome, reconciler, secondaryPath(path, defaults.getSecondaryNameB()),
            outcome.getSecondaryEntriesB());
        return new Plan(outcome, changes);
    }

    private void addSecondary(List<DocumentChange> changes, TransformOutcome outcome, MergeReconciler reconciler,
                              String secondaryPath, List<String> entryTexts) throws IOException {
        if (entryTexts.isEmpty()) {
            return;
        }
        String existing = workspace.exists(secondaryPath) ? workspace.readFile(secondaryPath) : "";
        MergeResult merged = reconciler.mergeIntoDocument(existing, entryTexts);
        for (String dropped : merged.getDropped()) {
            outcome.getReport().note("Kept existing " + dropped + " in " + secondaryPath);
        }
        changes.add(new DocumentChange(secondaryPath, merged.isCreated(), diff(secondaryPath, existing,
            merged.getText()), merged.getText(), merged.getDropped()));
    }

    /** {@code <dir of main>/<name>.<extension of main>} */
    private String secondaryPath(String mainPath, String name) {
        Path main = workspace.resolvePath(mainPath);
        String fileName = main.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String extension = dot > 0 ? fileName.substring(dot) : "";
        return workspace.toRelativePath(main.resolveSibling(name + extension));
    }

    private void copyAssets(String documentPath, List<AssetMapping> mappings, VariantRunResult result) {
        Path start = workspace.resolvePath(documentPath).getParent();
        Set<String> done = new LinkedHashSet<>();
        for (AssetMapping mapping : mappings) {
            if (!done.add(mapping.getOriginalPath() + "->" + mapping.getNewPath())) {
                continue;
            }
            Path root = assetRoot(start, mapping.getOriginalPath());
            if (root == null) {
                warn("Asset not found, not copied: " + mapping.getOriginalPath());
                result.getMissingAssets().add(mapping.getOriginalPath());
                continue;
            }
            Path target = root.resolve(mapping.getNewPath()).normalize();
            if (!target.startsWith(workspace.getWorkspaceRoot())) {
                warn("Asset target escapes workspace, not copied: " + mapping.getNewPath());
                result.getMissingAssets().add(mapping.getOriginalPath());
                continue;
            }
            try {
                workspace.copyFile(root.resolve(mapping.getOriginalPath()).normalize(), target);
                result.getCopiedAssets().add(workspace.toRelativePath(target));
            } catch (IOException e) {
                warn("Failed to copy " + mapping.getOriginalPath() + ": " + e.getMessage());
                result.getMissingAssets().add(mapping.getOriginalPath());
            }
        }
    }

    /**
     * Nearest folder, from the document's own folder up to the workspace root, that contains the asset path.
     */
    private Path assetRoot(Path start, String assetPath) {
        Path root = workspace.getWorkspaceRoot();
        for (Path dir = start; dir != null && dir.startsWith(root); dir = dir.getParent()) {
            Path candidate = dir.resolve(assetPath).normalize();
            if (candidate.startsWith(root) && Files.isRegularFile(candidate)) {
                return dir;
            }
        }
        return null;
    }

    private void record(String path, TransformRequest request, TransformOutcome outcome, List<String> written,
                        List<String> backups) {
        AuditRecord record = new AuditRecord(System.currentTimeMillis(), request.getKind().name(), path,
            outcome.isSuccess(), outcome.getMessage(), outcome.getAffectedIdentifiers(), written, backups);
        try {
            auditStore.append(record);
        } catch (IOException e) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.error("[VariantService] Failed to record history: " + e.getMessage(), e);
            }
        }
    }

    static String diff(String path, String original, String revised) {
        if (original.equals(revised)) {
            return "";
        }
        List<String> originalLines = original.lines().collect(Collectors.toList());
        List<String> revisedLines = revised.lines().collect(Collectors.toList());
        var patch = DiffUtils.diff(originalLines, revisedLines);
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(path, path, originalLines, patch, 3);
        if (unified.isEmpty()) {
            // line terminators only
            return "--- " + path + "\n+++ " + path + "\n";
        }
        return String.join("\n", unified);
    }

    private static void requirePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Document path is required");
        }
    }

    private record Plan(TransformOutcome outcome, List<DocumentChange> changes) {}

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[VariantService] " + message);
        }
    }

    private void warn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[VariantService] " + message);
        }
    }
}
