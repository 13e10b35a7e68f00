package com.variantforge.document;

import java.util.Locale;

/**
 * Naming conventions that identify text this tool generated: A/B suffixes on SubEntry names
 * and the two named dispatch elements of a dispatcher Entry.
 */
public class VariantMarkers {

    public static final String DEFAULT_SUFFIX_A = "_Variant1";
    public static final String DEFAULT_SUFFIX_B = "_Variant2";
    public static final String DEFAULT_DISPATCH_NAME_A = "variant1";
    public static final String DEFAULT_DISPATCH_NAME_B = "variant2";
    public static final String DEFAULT_CHILD_SET_PROPERTY = "childParticleSetDefinition";

    private final String suffixA;
    private final String suffixB;
    private final String dispatchNameA;
    private final String dispatchNameB;
    private final String childSetProperty;

    public VariantMarkers(String suffixA, String suffixB, String dispatchNameA, String dispatchNameB,
                          String childSetProperty) {
        this.suffixA = suffixA;
        this.suffixB = suffixB;
        this.dispatchNameA = dispatchNameA;
        this.dispatchNameB = dispatchNameB;
        this.childSetProperty = childSetProperty;
    }

    public static VariantMarkers defaults() {
        return new VariantMarkers(DEFAULT_SUFFIX_A, DEFAULT_SUFFIX_B, DEFAULT_DISPATCH_NAME_A,
            DEFAULT_DISPATCH_NAME_B, DEFAULT_CHILD_SET_PROPERTY);
    }

    public VariantMarkers withSuffixes(String a, String b) {
        return new VariantMarkers(a, b, dispatchNameA, dispatchNameB, childSetProperty);
    }

    public boolean isVariantA(String name) {
        return endsWithIgnoreCase(name, suffixA);
    }

    public boolean isVariantB(String name) {
        return endsWithIgnoreCase(name, suffixB);
    }

    public boolean isVariant(String name) {
        return isVariantA(name) || isVariantB(name);
    }

    /** Removes a trailing A or B suffix, case-insensitively. */
    public String baseName(String name) {
        if (isVariantA(name)) {
            return name.substring(0, name.length() - suffixA.length());
        }
        if (isVariantB(name)) {
            return name.substring(0, name.length() - suffixB.length());
        }
        return name;
    }

    public String getSuffixA() {
        return suffixA;
    }

    public String getSuffixB() {
        return suffixB;
    }

    public String getDispatchNameA() {
        return dispatchNameA;
    }

    public String getDispatchNameB() {
        return dispatchNameB;
    }

    public String getChildSetProperty() {
        return childSetProperty;
    }

    private static boolean endsWithIgnoreCase(String value, String suffix) {
        if (value == null || suffix == null || suffix.isEmpty() || value.length() <= suffix.length()) {
            return false;
        }
        return value.toLowerCase(Locale.ROOT).endsWith(suffix.toLowerCase(Locale.ROOT));
    }
}
