package com.variantforge.transform;

import com.variantforge.document.SubEntry;
import com.variantforge.document.VariantMarkers;

import java.util.List;
import java.util.function.Predicate;

/**
 * Parameter bag for the variant transforms.
 */
public class TransformParams {

    public static final String DEFAULT_FOLDER_A = "assets/variant1";
    public static final String DEFAULT_FOLDER_B = "assets/variant2";
    public static final List<String> DEFAULT_SIBLING_NAME_PROPERTIES = List.of("particleName", "particlePath");

    private final String suffixA;
    private final String suffixB;
    private final String folderA;
    private final String folderB;
    private final int modeA;
    private final int modeB;
    private final Discriminator discriminator;
    private final Predicate<SubEntry> exclusion;
    private final List<String> siblingNameProperties;

    private TransformParams(Builder b) {
        this.suffixA = b.suffixA;
        this.suffixB = b.suffixB;
        this.folderA = b.folderA;
        this.folderB = b.folderB;
        this.modeA = b.modeA;
        this.modeB = b.modeB;
        this.discriminator = b.discriminator;
        this.exclusion = b.exclusion;
        this.siblingNameProperties = List.copyOf(b.siblingNameProperties);
    }

    public static TransformParams defaults() {
        return new Builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
            .suffixes(suffixA, suffixB)
            .folders(folderA, folderB)
            .modes(modeA, modeB)
            .discriminator(discriminator)
            .exclusion(exclusion)
            .siblingNameProperties(siblingNameProperties);
    }

    public VariantMarkers markers() {
        return VariantMarkers.defaults().withSuffixes(suffixA, suffixB);
    }

    public String suffix(Side side) {
        return side == Side.A ? suffixA : suffixB;
    }

    public String folder(Side side) {
        return side == Side.A ? folderA : folderB;
    }

    public int mode(Side side) {
        return side == Side.A ? modeA : modeB;
    }

    public String getSuffixA() {
        return suffixA;
    }

    public String getSuffixB() {
        return suffixB;
    }

    public String getFolderA() {
        return folderA;
    }

    public String getFolderB() {
        return folderB;
    }

    public int getModeA() {
        return modeA;
    }

    public int getModeB() {
        return modeB;
    }

    public Discriminator getDiscriminator() {
        return discriminator;
    }

    public Predicate<SubEntry> getExclusion() {
        return exclusion;
    }

    public List<String> getSiblingNameProperties() {
        return siblingNameProperties;
    }

    public enum Side {
        A, B
    }

    public static class Builder {
        private String suffixA = VariantMarkers.DEFAULT_SUFFIX_A;
        private String suffixB = VariantMarkers.DEFAULT_SUFFIX_B;
        private String folderA = DEFAULT_FOLDER_A;
        private String folderB = DEFAULT_FOLDER_B;
        private int modeA = Discriminator.DEFAULT_MODE_A;
        private int modeB = Discriminator.DEFAULT_MODE_B;
        private Discriminator discriminator = Discriminator.defaults();
        private Predicate<SubEntry> exclusion = sub -> false;
        private List<String> siblingNameProperties = DEFAULT_SIBLING_NAME_PROPERTIES;

        public Builder suffixes(String a, String b) {
            if (a != null && !a.isBlank()) {
                this.suffixA = a;
            }
            if (b != null && !b.isBlank()) {
                this.suffixB = b;
            }
            return this;
        }

        public Builder folders(String a, String b) {
            if (a != null && !a.isBlank()) {
                this.folderA = a;
            }
            if (b != null && !b.isBlank()) {
                this.folderB = b;
            }
            return this;
        }

        public Builder modes(int a, int b) {
            this.modeA = a;
            this.modeB = b;
            return this;
        }

        public Builder discriminator(Discriminator discriminator) {
            if (discriminator != null) {
                this.discriminator = discriminator;
            }
            return this;
        }

        public Builder referenceId(String referenceId) {
            if (referenceId != null && !referenceId.isBlank()) {
                this.discriminator = discriminator.withReferenceId(referenceId);
            }
            return this;
        }

        public Builder exclusion(Predicate<SubEntry> exclusion) {
            this.exclusion = exclusion != null ? exclusion : sub -> false;
            return this;
        }

        /** Routes SubEntries carrying an exclusion flag through untouched. */
        public Builder skipExcluded(boolean skip) {
            return exclusion(skip ? SubEntry::isHasExclusionFlag : null);
        }

        public Builder siblingNameProperties(List<String> names) {
            if (names != null) {
                this.siblingNameProperties = names;
            }
            return this;
        }

        public TransformParams build() {
            if (suffixA.equalsIgnoreCase(suffixB)) {
                throw new IllegalArgumentException("Variant suffixes must differ: " + suffixA);
            }
            return new TransformParams(this);
        }
    }
}
