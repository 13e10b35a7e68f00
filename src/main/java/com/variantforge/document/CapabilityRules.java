package com.variantforge.document;

/**
 * Property names the extractor probes when deriving SubEntry capability flags.
 */
public class CapabilityRules {

    public static final String DEFAULT_MODE_PROPERTY = "stencilMode";
    public static final String DEFAULT_REFERENCE_PROPERTY = "StencilReferenceId";
    public static final String DEFAULT_OVERRIDE_PROPERTY = "renderPhaseOverride";
    public static final String DEFAULT_EXCLUSION_PROPERTY = "isGroundLayer";
    public static final String DEFAULT_NUMERIC_ATTRIBUTE = "blendMode";

    private final String modeProperty;
    private final String referenceProperty;
    private final String overrideProperty;
    private final String exclusionProperty;
    private final String numericAttribute;

    public CapabilityRules(String modeProperty, String referenceProperty, String overrideProperty,
                           String exclusionProperty, String numericAttribute) {
        this.modeProperty = modeProperty;
        this.referenceProperty = referenceProperty;
        this.overrideProperty = overrideProperty;
        this.exclusionProperty = exclusionProperty;
        this.numericAttribute = numericAttribute;
    }

    public static CapabilityRules defaults() {
        return new CapabilityRules(DEFAULT_MODE_PROPERTY, DEFAULT_REFERENCE_PROPERTY, DEFAULT_OVERRIDE_PROPERTY,
            DEFAULT_EXCLUSION_PROPERTY, DEFAULT_NUMERIC_ATTRIBUTE);
    }

    /** Any discriminator-like property, whatever its value. */
    public boolean hasDiscriminator(PropertyBag bag) {
        return bag.has(modeProperty) || bag.has(referenceProperty);
    }

    /** Exclusion flags are bool or flag typed and must be literally true. */
    public boolean hasExclusionFlag(PropertyBag bag) {
        return bag.getAll(exclusionProperty).stream()
            .anyMatch(p -> ("bool".equalsIgnoreCase(p.type()) || "flag".equalsIgnoreCase(p.type()))
                && "true".equalsIgnoreCase(p.value()));
    }

    public boolean hasOverride(PropertyBag bag) {
        return bag.has(overrideProperty);
    }

    public String getModeProperty() {
        return modeProperty;
    }

    public String getReferenceProperty() {
        return referenceProperty;
    }

    public String getOverrideProperty() {
        return overrideProperty;
    }

    public String getExclusionProperty() {
        return exclusionProperty;
    }

    public String getNumericAttribute() {
        return numericAttribute;
    }
}
