package com.variantforge;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * File access for documents and assets, confined to one workspace root.
 */
public class DocumentWorkspace {

    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path workspaceRoot;

    public DocumentWorkspace(Path workspaceRoot) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        log("DocumentWorkspace initialized with root: " + this.workspaceRoot);
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    /**
     * Resolves a workspace-relative path and rejects anything that lands outside the root.
     *
     * @throws SecurityException if the path escapes the workspace root
     */
    public Path resolvePath(String relativePath) {
        if (relativePath == null || relativePath.isBlank() || ".".equals(relativePath)) {
            return workspaceRoot;
        }
        String normalized = relativePath.replace('\\', '/');
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (normalized.isEmpty()) {
            return workspaceRoot;
        }
        Path resolved = workspaceRoot.resolve(normalized).normalize();
        if (!resolved.startsWith(workspaceRoot)) {
            throw new SecurityException("Path escapes workspace root: " + relativePath);
        }
        return resolved;
    }

    public String toRelativePath(Path absolutePath) {
        return workspaceRoot.relativize(absolutePath).toString().replace('\\', '/');
    }

    public boolean exists(String relativePath) {
        return Files.isRegularFile(resolvePath(relativePath));
    }

    public String readFile(String relativePath) throws IOException {
        Path path = resolvePath(relativePath);
        if (!Files.exists(path)) {
            throw new FileNotFoundException("File not found: " + relativePath);
        }
        if (Files.isDirectory(path)) {
            throw new IOException("Cannot read directory as file: " + relativePath);
        }
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    public void writeFile(String relativePath, String content) throws IOException {
        Path path = resolvePath(relativePath);
        Files.createDirectories(path.getParent());
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        log("Wrote file: " + relativePath);
    }

    /**
     * Copies an existing file to {@code <file>.bak_yyyyMMdd_HHmmss} next to it.
     *
     * @return the backup's workspace-relative path, or null when there was nothing to back up
     */
    public String createBackup(String relativePath) throws IOException {
        Path path = resolvePath(relativePath);
        if (!Files.isRegularFile(path)) {
            return null;
        }
        Path backup = path.resolveSibling(path.getFileName() + ".bak_" + LocalDateTime.now().format(BACKUP_STAMP));
        Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
        log("Backup created: " + toRelativePath(backup));
        return toRelativePath(backup);
    }

    /**
     * Copies {@code source} to {@code target}, creating parent folders.
     *
     * @throws FileNotFoundException if the source file does not exist
     */
    public void copyFile(Path source, Path target) throws IOException {
        if (!Files.isRegularFile(source)) {
            throw new FileNotFoundException("Asset not found: " + toRelativePath(source));
        }
        Files.createDirectories(target.getParent());
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[DocumentWorkspace] " + message);
        }
    }
}
