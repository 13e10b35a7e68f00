package com.variantforge.models;

import com.variantforge.transform.TransformOutcome;

import java.util.ArrayList;
import java.util.List;

public class VariantRunResult {

    private final TransformOutcome outcome;
    private final List<DocumentChange> changes;
    private final boolean applied;
    private final List<String> backups = new ArrayList<>();
    private final List<String> copiedAssets = new ArrayList<>();
    private final List<String> missingAssets = new ArrayList<>();

    public VariantRunResult(TransformOutcome outcome, List<DocumentChange> changes, boolean applied) {
        this.outcome = outcome;
        this.changes = changes != null ? List.copyOf(changes) : List.of();
        this.applied = applied;
    }

    public TransformOutcome getOutcome() {
        return outcome;
    }

    public List<DocumentChange> getChanges() {
        return changes;
    }

    /** False for previews and for failed transforms. */
    public boolean isApplied() {
        return applied;
    }

    public List<String> getBackups() {
        return backups;
    }

    public List<String> getCopiedAssets() {
        return copiedAssets;
    }

    public List<String> getMissingAssets() {
        return missingAssets;
    }
}
