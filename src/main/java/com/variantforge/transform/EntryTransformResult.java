package com.variantforge.transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one pure Entry-level transform: replacement text, files to copy, and the report.
 * Detached transforms also expose the two generated siblings on their own.
 */
public class EntryTransformResult {

    private final String text;
    private final List<AssetMapping> assetMappings;
    private final TransformReport report;
    private final boolean changed;
    private final String siblingA;
    private final String siblingB;
    private final String dispatcher;

    private EntryTransformResult(String text, boolean changed, List<AssetMapping> assetMappings,
                                 TransformReport report, String dispatcher, String siblingA, String siblingB) {
        this.text = text;
        this.changed = changed;
        this.assetMappings = assetMappings != null ? assetMappings : new ArrayList<>();
        this.report = report != null ? report : new TransformReport();
        this.dispatcher = dispatcher;
        this.siblingA = siblingA;
        this.siblingB = siblingB;
    }

    public static EntryTransformResult changed(String text, List<AssetMapping> mappings, TransformReport report) {
        return new EntryTransformResult(text, true, mappings, report, null, null, null);
    }

    public static EntryTransformResult unchanged(String text, TransformReport report) {
        return new EntryTransformResult(text, false, List.of(), report, null, null, null);
    }

    public static EntryTransformResult detached(String dispatcher, String siblingA, String siblingB,
                                                List<AssetMapping> mappings, TransformReport report) {
        String combined = dispatcher + "\n" + siblingA + "\n" + siblingB;
        return new EntryTransformResult(combined, true, mappings, report, dispatcher, siblingA, siblingB);
    }

    public String getText() {
        return text;
    }

    public boolean isChanged() {
        return changed;
    }

    public List<AssetMapping> getAssetMappings() {
        return assetMappings;
    }

    public TransformReport getReport() {
        return report;
    }

    public String getDispatcher() {
        return dispatcher;
    }

    public String getSiblingA() {
        return siblingA;
    }

    public String getSiblingB() {
        return siblingB;
    }

    public boolean isDetached() {
        return dispatcher != null;
    }
}
