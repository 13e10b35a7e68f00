package com.variantforge.transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured counts and names collected while a transform runs. Nothing here is an error:
 * skips, exclusions and mismatches are expected outcomes the operator should see.
 */
public class TransformReport {

    private int duplicated;
    private int discriminatorsInjected;
    private int propertiesInjected;
    private int propertiesRemoved;
    private final List<String> skippedConflicting = new ArrayList<>();
    private final List<String> excluded = new ArrayList<>();
    private final List<String> removed = new ArrayList<>();
    private final List<String> restored = new ArrayList<>();
    private final List<String> identityMismatches = new ArrayList<>();
    private final List<String> alreadyVariant = new ArrayList<>();
    private final List<String> notFound = new ArrayList<>();
    private final List<String> degraded = new ArrayList<>();
    private final List<String> propertySkipped = new ArrayList<>();
    private final List<String> crossReferencesAdded = new ArrayList<>();
    private final List<String> crossReferencesSkipped = new ArrayList<>();
    private final List<String> crossReferencesRemoved = new ArrayList<>();
    private final List<String> notes = new ArrayList<>();

    public void countDuplicated() {
        duplicated++;
    }

    public void countDiscriminatorInjected() {
        discriminatorsInjected++;
    }

    public void countPropertyInjected() {
        propertiesInjected++;
    }

    public void countPropertiesRemoved(int count) {
        propertiesRemoved += count;
    }

    public void skippedConflicting(String name) {
        skippedConflicting.add(name);
    }

    public void excluded(String name) {
        excluded.add(name);
    }

    public void removed(String name) {
        removed.add(name);
    }

    public void restored(String name) {
        restored.add(name);
    }

    public void identityMismatch(String detail) {
        identityMismatches.add(detail);
    }

    public void alreadyVariant(String identifier) {
        alreadyVariant.add(identifier);
    }

    public void notFound(String identifier) {
        notFound.add(identifier);
    }

    public void degraded(String identifier) {
        degraded.add(identifier);
    }

    public void propertySkipped(String name) {
        propertySkipped.add(name);
    }

    public void crossReferenceAdded(String key) {
        crossReferencesAdded.add(key);
    }

    public void crossReferenceSkipped(String key) {
        crossReferencesSkipped.add(key);
    }

    public void crossReferenceRemoved(String key) {
        crossReferencesRemoved.add(key);
    }

    public void note(String note) {
        notes.add(note);
    }

    public void absorb(TransformReport other) {
        if (other == null) {
            return;
        }
        duplicated += other.duplicated;
        discriminatorsInjected += other.discriminatorsInjected;
        propertiesInjected += other.propertiesInjected;
        propertiesRemoved += other.propertiesRemoved;
        skippedConflicting.addAll(other.skippedConflicting);
        excluded.addAll(other.excluded);
        removed.addAll(other.removed);
        restored.addAll(other.restored);
        identityMismatches.addAll(other.identityMismatches);
        alreadyVariant.addAll(other.alreadyVariant);
        notFound.addAll(other.notFound);
        degraded.addAll(other.degraded);
        propertySkipped.addAll(other.propertySkipped);
        crossReferencesAdded.addAll(other.crossReferencesAdded);
        crossReferencesSkipped.addAll(other.crossReferencesSkipped);
        crossReferencesRemoved.addAll(other.crossReferencesRemoved);
        notes.addAll(other.notes);
    }

    public int getDuplicated() {
        return duplicated;
    }

    public int getDiscriminatorsInjected() {
        return discriminatorsInjected;
    }

    public int getPropertiesInjected() {
        return propertiesInjected;
    }

    public int getPropertiesRemoved() {
        return propertiesRemoved;
    }

    public List<String> getSkippedConflicting() {
        return skippedConflicting;
    }

    public List<String> getExcluded() {
        return excluded;
    }

    public List<String> getRemoved() {
        return removed;
    }

    public List<String> getRestored() {
        return restored;
    }

    public List<String> getIdentityMismatches() {
        return identityMismatches;
    }

    public List<String> getAlreadyVariant() {
        return alreadyVariant;
    }

    public List<String> getNotFound() {
        return notFound;
    }

    public List<String> getDegraded() {
        return degraded;
    }

    public List<String> getPropertySkipped() {
        return propertySkipped;
    }

    public List<String> getCrossReferencesAdded() {
        return crossReferencesAdded;
    }

    public List<String> getCrossReferencesSkipped() {
        return crossReferencesSkipped;
    }

    public List<String> getCrossReferencesRemoved() {
        return crossReferencesRemoved;
    }

    public List<String> getNotes() {
        return notes;
    }
}
