package com.variantforge.transform;

import com.variantforge.document.CapabilityRules;
import com.variantforge.document.FormatProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The small property block that makes an A copy and a B copy mutually exclusive at runtime:
 * a mode, a shared reference id and an optional render override.
 */
public class Discriminator {

    public static final String DEFAULT_REFERENCE_ID = "0xe6deedc4";
    public static final int DEFAULT_MODE_A = 3;
    public static final int DEFAULT_MODE_B = 2;
    public static final String DEFAULT_OVERRIDE_VALUE = "4";

    private static final Pattern HEX = Pattern.compile("^0x[0-9a-fA-F]+$");

    private final String modeProperty;
    private final String modeType;
    private final String referenceProperty;
    private final String referenceType;
    private final String referenceId;
    private final String overrideProperty;
    private final String overrideType;
    private final String overrideValue;

    public Discriminator(String modeProperty, String modeType, String referenceProperty, String referenceType,
                         String referenceId, String overrideProperty, String overrideType, String overrideValue) {
        this.modeProperty = modeProperty;
        this.modeType = modeType;
        this.referenceProperty = referenceProperty;
        this.referenceType = referenceType;
        this.referenceId = formatReference(referenceId);
        this.overrideProperty = overrideProperty;
        this.overrideType = overrideType;
        this.overrideValue = overrideValue;
    }

    public static Discriminator defaults() {
        return withReference(DEFAULT_REFERENCE_ID);
    }

    public static Discriminator withReference(String referenceId) {
        return new Discriminator(CapabilityRules.DEFAULT_MODE_PROPERTY, "u8",
            CapabilityRules.DEFAULT_REFERENCE_PROPERTY, "hash", referenceId,
            CapabilityRules.DEFAULT_OVERRIDE_PROPERTY, "u8", DEFAULT_OVERRIDE_VALUE);
    }

    public Discriminator withReferenceId(String id) {
        return new Discriminator(modeProperty, modeType, referenceProperty, referenceType, id,
            overrideProperty, overrideType, overrideValue);
    }

    /**
     * Hex hashes and already-quoted values pass through; anything else is quoted.
     * Blank input falls back to the default reference id.
     */
    public static String formatReference(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_REFERENCE_ID;
        }
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed;
        }
        if (HEX.matcher(trimmed).matches()) {
            return trimmed;
        }
        return FormatProfile.quote(trimmed);
    }

    /** Property lines without indentation, in injection order. */
    public List<String> render(int mode) {
        List<String> lines = new ArrayList<>();
        lines.add(modeProperty + ": " + modeType + " = " + mode);
        lines.add(referenceProperty + ": " + referenceType + " = " + referenceId);
        if (overrideProperty != null && overrideValue != null) {
            lines.add(overrideProperty + ": " + overrideType + " = " + overrideValue);
        }
        return lines;
    }

    public boolean isOwnReference(String value) {
        return value != null && formatReference(value).equalsIgnoreCase(referenceId);
    }

    public boolean isOwnOverride(String value) {
        return overrideValue != null && overrideValue.equals(value == null ? null : value.trim());
    }

    public String getModeProperty() {
        return modeProperty;
    }

    public String getReferenceProperty() {
        return referenceProperty;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public String getOverrideProperty() {
        return overrideProperty;
    }

    public String getOverrideValue() {
        return overrideValue;
    }
}
