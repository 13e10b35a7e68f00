package com.variantforge.document;

/**
 * A quoted asset path found inside an Entry or SubEntry, with the path it was moved to.
 */
public class AssetReference {

    private final String originalPath;
    private final String repathedPath;
    private final String filename;

    public AssetReference(String originalPath, String repathedPath, String filename) {
        this.originalPath = originalPath;
        this.repathedPath = repathedPath;
        this.filename = filename;
    }

    public static AssetReference found(String path) {
        return new AssetReference(path, path, filenameOf(path));
    }

    public AssetReference repathedTo(String folder) {
        String trimmed = folder == null ? "" : folder.replace('\\', '/');
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        String target = trimmed.isEmpty() ? filename : trimmed + "/" + filename;
        return new AssetReference(originalPath, target, filename);
    }

    public static String filenameOf(String path) {
        if (path == null) {
            return "";
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    public boolean isMoved() {
        return !originalPath.equals(repathedPath);
    }

    public String getOriginalPath() {
        return originalPath;
    }

    public String getRepathedPath() {
        return repathedPath;
    }

    public String getFilename() {
        return filename;
    }
}
