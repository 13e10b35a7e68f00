package com.variantforge.models;

import com.variantforge.document.AssetReference;
import com.variantforge.document.Entry;
import com.variantforge.document.EntityExtractor;
import com.variantforge.document.SubEntry;
import com.variantforge.document.VariantState;
import com.variantforge.transform.ToggleScreen;

import java.util.ArrayList;
import java.util.List;

/**
 * Listing view of one Entry: what a caller needs to pick targets, without the raw text.
 */
public class EntrySummary {

    private final String identifier;
    private final String displayName;
    private final String typeTag;
    private final VariantState variantState;
    private final boolean degraded;
    private final boolean toggleScreen;
    private final List<SubEntryFlags> subEntries;
    private final List<String> assets;

    public EntrySummary(String identifier, String displayName, String typeTag, VariantState variantState,
                        boolean degraded, boolean toggleScreen, List<SubEntryFlags> subEntries,
                        List<String> assets) {
        this.identifier = identifier;
        this.displayName = displayName;
        this.typeTag = typeTag;
        this.variantState = variantState;
        this.degraded = degraded;
        this.toggleScreen = toggleScreen;
        this.subEntries = List.copyOf(subEntries);
        this.assets = List.copyOf(assets);
    }

    public static EntrySummary of(Entry entry, EntityExtractor extractor) {
        List<SubEntryFlags> subs = new ArrayList<>();
        for (SubEntry sub : entry.getSubEntries()) {
            subs.add(new SubEntryFlags(sub.getName(), sub.getTypeTag(), sub.isHasDiscriminator(),
                sub.isHasExclusionFlag(), sub.isHasOverride(), sub.isDegraded()));
        }
        List<String> assets = new ArrayList<>();
        for (AssetReference ref : extractor.findAssetReferences(entry.getText())) {
            assets.add(ref.getOriginalPath());
        }
        return new EntrySummary(entry.getIdentifier(), entry.getDisplayName(), entry.getTypeTag(),
            entry.getVariantState(), entry.isDegraded(), ToggleScreen.isToggleScreen(entry), subs, assets);
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getTypeTag() {
        return typeTag;
    }

    public VariantState getVariantState() {
        return variantState;
    }

    public boolean isDegraded() {
        return degraded;
    }

    /** The shared reference screen; never offered as a variant target. */
    public boolean isToggleScreen() {
        return toggleScreen;
    }

    public List<SubEntryFlags> getSubEntries() {
        return subEntries;
    }

    public List<String> getAssets() {
        return assets;
    }

    public record SubEntryFlags(String name, String typeTag, boolean hasDiscriminator, boolean hasExclusionFlag,
                                boolean hasOverride, boolean degraded) {}
}
