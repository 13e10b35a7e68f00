package com.variantforge.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.variantforge.document.CapabilityRules;
import com.variantforge.document.EntityExtractor;
import com.variantforge.document.FormatProfile;
import com.variantforge.document.VariantMarkers;
import com.variantforge.transform.Discriminator;
import com.variantforge.transform.TransformDefaults;
import com.variantforge.transform.TransformParams;
import com.variantforge.xref.CrossReferenceUpdater;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted variant settings for a workspace. Every field has a built-in default, so a partial
 * JSON file only overrides what it names.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VariantDefaults {

    private String suffixA = VariantMarkers.DEFAULT_SUFFIX_A;
    private String suffixB = VariantMarkers.DEFAULT_SUFFIX_B;
    private String detachedSuffixA = TransformDefaults.DEFAULT_DETACHED_SUFFIX_A;
    private String detachedSuffixB = TransformDefaults.DEFAULT_DETACHED_SUFFIX_B;
    private String folderA = TransformParams.DEFAULT_FOLDER_A;
    private String folderB = TransformParams.DEFAULT_FOLDER_B;
    private int modeA = Discriminator.DEFAULT_MODE_A;
    private int modeB = Discriminator.DEFAULT_MODE_B;
    private String modeProperty = CapabilityRules.DEFAULT_MODE_PROPERTY;
    private String modeType = "u8";
    private String referenceProperty = CapabilityRules.DEFAULT_REFERENCE_PROPERTY;
    private String referenceType = "hash";
    private String referenceId = Discriminator.DEFAULT_REFERENCE_ID;
    private String overrideProperty = CapabilityRules.DEFAULT_OVERRIDE_PROPERTY;
    private String overrideType = "u8";
    private String overrideValue = Discriminator.DEFAULT_OVERRIDE_VALUE;
    private String exclusionProperty = CapabilityRules.DEFAULT_EXCLUSION_PROPERTY;
    private String secondaryNameA = VariantMarkers.DEFAULT_DISPATCH_NAME_A;
    private String secondaryNameB = VariantMarkers.DEFAULT_DISPATCH_NAME_B;
    private String linkedPathA = TransformDefaults.DEFAULT_LINKED_PATH_A;
    private String linkedPathB = TransformDefaults.DEFAULT_LINKED_PATH_B;
    private String subEntryTypePattern = FormatProfile.DEFAULT_SUB_ENTRY_TYPE;
    private String entryNameProperty = FormatProfile.DEFAULT_ENTRY_NAME_PROPERTY;
    private String subEntryNameProperty = FormatProfile.DEFAULT_SUB_ENTRY_NAME_PROPERTY;
    private List<String> assetExtensions = new ArrayList<>(FormatProfile.DEFAULT_ASSET_EXTENSIONS);

    public FormatProfile toFormatProfile() {
        return new FormatProfile(subEntryTypePattern, entryNameProperty, subEntryNameProperty, assetExtensions);
    }

    public EntityExtractor toExtractor() {
        CapabilityRules rules = new CapabilityRules(modeProperty, referenceProperty, overrideProperty,
            exclusionProperty, CapabilityRules.DEFAULT_NUMERIC_ATTRIBUTE);
        VariantMarkers markers = new VariantMarkers(suffixA, suffixB, secondaryNameA, secondaryNameB,
            VariantMarkers.DEFAULT_CHILD_SET_PROPERTY);
        return new EntityExtractor(toFormatProfile(), rules, markers);
    }

    public CrossReferenceUpdater toCrossReferenceUpdater() {
        return new CrossReferenceUpdater(toFormatProfile(), CrossReferenceUpdater.DEFAULT_RESOLVER_TYPE,
            CrossReferenceUpdater.DEFAULT_RESOLVER_MAP, CrossReferenceUpdater.DEFAULT_LINKED_PROPERTY);
    }

    public TransformDefaults toTransformDefaults() {
        Discriminator discriminator = new Discriminator(modeProperty, modeType, referenceProperty, referenceType,
            referenceId, overrideProperty, overrideType, overrideValue);
        TransformParams inline = new TransformParams.Builder()
            .suffixes(suffixA, suffixB)
            .folders(folderA, folderB)
            .modes(modeA, modeB)
            .discriminator(discriminator)
            .build();
        TransformParams detached = inline.toBuilder()
            .suffixes(detachedSuffixA, detachedSuffixB)
            .build();
        return new TransformDefaults(inline, detached, linkedPathA, linkedPathB);
    }

    public String getSuffixA() {
        return suffixA;
    }

    public void setSuffixA(String suffixA) {
        this.suffixA = suffixA;
    }

    public String getSuffixB() {
        return suffixB;
    }

    public void setSuffixB(String suffixB) {
        this.suffixB = suffixB;
    }

    public String getDetachedSuffixA() {
        return detachedSuffixA;
    }

    public void setDetachedSuffixA(String detachedSuffixA) {
        this.detachedSuffixA = detachedSuffixA;
    }

    public String getDetachedSuffixB() {
        return detachedSuffixB;
    }

    public void setDetachedSuffixB(String detachedSuffixB) {
        this.detachedSuffixB = detachedSuffixB;
    }

    public String getFolderA() {
        return folderA;
    }

    public void setFolderA(String folderA) {
        this.folderA = folderA;
    }

    public String getFolderB() {
        return folderB;
    }

    public void setFolderB(String folderB) {
        this.folderB = folderB;
    }

    public int getModeA() {
        return modeA;
    }

    public void setModeA(int modeA) {
        this.modeA = modeA;
    }

    public int getModeB() {
        return modeB;
    }

    public void setModeB(int modeB) {
        this.modeB = modeB;
    }

    public String getModeProperty() {
        return modeProperty;
    }

    public void setModeProperty(String modeProperty) {
        this.modeProperty = modeProperty;
    }

    public String getModeType() {
        return modeType;
    }

    public void setModeType(String modeType) {
        this.modeType = modeType;
    }

    public String getReferenceProperty() {
        return referenceProperty;
    }

    public void setReferenceProperty(String referenceProperty) {
        this.referenceProperty = referenceProperty;
    }

    public String getReferenceType() {
        return referenceType;
    }

    public void setReferenceType(String referenceType) {
        this.referenceType = referenceType;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public void setReferenceId(String referenceId) {
        this.referenceId = referenceId;
    }

    public String getOverrideProperty() {
        return overrideProperty;
    }

    public void setOverrideProperty(String overrideProperty) {
        this.overrideProperty = overrideProperty;
    }

    public String getOverrideType() {
        return overrideType;
    }

    public void setOverrideType(String overrideType) {
        this.overrideType = overrideType;
    }

    public String getOverrideValue() {
        return overrideValue;
    }

    public void setOverrideValue(String overrideValue) {
        this.overrideValue = overrideValue;
    }

    public String getExclusionProperty() {
        return exclusionProperty;
    }

    public void setExclusionProperty(String exclusionProperty) {
        this.exclusionProperty = exclusionProperty;
    }

    public String getSecondaryNameA() {
        return secondaryNameA;
    }

    public void setSecondaryNameA(String secondaryNameA) {
        this.secondaryNameA = secondaryNameA;
    }

    public String getSecondaryNameB() {
        return secondaryNameB;
    }

    public void setSecondaryNameB(String secondaryNameB) {
        this.secondaryNameB = secondaryNameB;
    }

    public String getLinkedPathA() {
        return linkedPathA;
    }

    public void setLinkedPathA(String linkedPathA) {
        this.linkedPathA = linkedPathA;
    }

    public String getLinkedPathB() {
        return linkedPathB;
    }

    public void setLinkedPathB(String linkedPathB) {
        this.linkedPathB = linkedPathB;
    }

    public String getSubEntryTypePattern() {
        return subEntryTypePattern;
    }

    public void setSubEntryTypePattern(String subEntryTypePattern) {
        this.subEntryTypePattern = subEntryTypePattern;
    }

    public String getEntryNameProperty() {
        return entryNameProperty;
    }

    public void setEntryNameProperty(String entryNameProperty) {
        this.entryNameProperty = entryNameProperty;
    }

    public String getSubEntryNameProperty() {
        return subEntryNameProperty;
    }

    public void setSubEntryNameProperty(String subEntryNameProperty) {
        this.subEntryNameProperty = subEntryNameProperty;
    }

    public List<String> getAssetExtensions() {
        return assetExtensions;
    }

    public void setAssetExtensions(List<String> assetExtensions) {
        this.assetExtensions = assetExtensions;
    }
}
