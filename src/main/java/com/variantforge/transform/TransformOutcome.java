package com.variantforge.transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Document-level result handed back to the caller. Failures carry the untouched input text.
 */
public class TransformOutcome {

    private final boolean success;
    private final String message;
    private final List<String> affectedIdentifiers;
    private final String text;
    private final List<String> secondaryEntriesA;
    private final List<String> secondaryEntriesB;
    private final List<AssetMapping> assetMappings;
    private final TransformReport report;

    private TransformOutcome(boolean success, String message, List<String> affectedIdentifiers, String text,
                             List<String> secondaryEntriesA, List<String> secondaryEntriesB,
                             List<AssetMapping> assetMappings, TransformReport report) {
        this.success = success;
        this.message = message;
        this.affectedIdentifiers = affectedIdentifiers != null ? List.copyOf(affectedIdentifiers) : List.of();
        this.text = text;
        this.secondaryEntriesA = secondaryEntriesA != null ? List.copyOf(secondaryEntriesA) : List.of();
        this.secondaryEntriesB = secondaryEntriesB != null ? List.copyOf(secondaryEntriesB) : List.of();
        this.assetMappings = assetMappings != null ? List.copyOf(assetMappings) : List.of();
        this.report = report != null ? report : new TransformReport();
    }

    public static TransformOutcome success(String message, List<String> affected, String text,
                                           List<AssetMapping> mappings, TransformReport report) {
        return new TransformOutcome(true, message, affected, text, null, null, mappings, report);
    }

    public static TransformOutcome successWithSecondaries(String message, List<String> affected, String text,
                                                          List<String> entriesA, List<String> entriesB,
                                                          List<AssetMapping> mappings, TransformReport report) {
        return new TransformOutcome(true, message, affected, text, entriesA, entriesB, mappings, report);
    }

    public static TransformOutcome failure(String message, String text) {
        return new TransformOutcome(false, message, new ArrayList<>(), text, null, null, null, null);
    }

    public static TransformOutcome failure(String message, String text, TransformReport report) {
        return new TransformOutcome(false, message, new ArrayList<>(), text, null, null, null, report);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getAffectedIdentifiers() {
        return affectedIdentifiers;
    }

    public String getText() {
        return text;
    }

    /** Sibling Entries destined for the A secondary document; empty unless siblings were detached out. */
    public List<String> getSecondaryEntriesA() {
        return secondaryEntriesA;
    }

    public List<String> getSecondaryEntriesB() {
        return secondaryEntriesB;
    }

    public List<AssetMapping> getAssetMappings() {
        return assetMappings;
    }

    public TransformReport getReport() {
        return report;
    }
}
