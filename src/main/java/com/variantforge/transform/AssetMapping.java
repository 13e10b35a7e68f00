package com.variantforge.transform;

/**
 * One file the caller must copy so a repathed reference resolves: {@code originalPath} to {@code newPath}.
 */
public class AssetMapping {

    private final String originalPath;
    private final String newPath;
    private final String filename;
    private final String variant;

    public AssetMapping(String originalPath, String newPath, String filename, String variant) {
        this.originalPath = originalPath;
        this.newPath = newPath;
        this.filename = filename;
        this.variant = variant;
    }

    public String getOriginalPath() {
        return originalPath;
    }

    public String getNewPath() {
        return newPath;
    }

    public String getFilename() {
        return filename;
    }

    /** "A" or "B". */
    public String getVariant() {
        return variant;
    }
}
