package com.buildmender.core.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * File access for project checkouts under the workspace root.
 *
 * Every path handed in is resolved against a root and rejected if it escapes
 * it. Writes are committed by writing a sibling temp file and renaming it over
 * the target, so a reader (or a crash) never sees a half-written file.
 */
@Component
public class FileSystemManager {

    private static final Logger log = LoggerFactory.getLogger(FileSystemManager.class);

    private static final long MAX_FILE_SIZE = 10 * 1024 * 1024;

    private final Path workspaceRoot;

    public FileSystemManager(
            @Value("${buildmender.workspace-path:temp_projects}") String workspacePath
    ) {
        this.workspaceRoot = Paths.get(workspacePath).toAbsolutePath().normalize();
        try {
            if (!Files.exists(workspaceRoot)) {
                Files.createDirectories(workspaceRoot);
                log.info("[FileSystem] Created workspace: {}", workspaceRoot);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize workspace: " + workspacePath, e);
        }
        log.info("[FileSystem] Workspace initialized: {}", workspaceRoot);
    }

    public String getWorkspacePath() {
        return workspaceRoot.toString();
    }

    /**
     * Directory a project named {@code projectName} is checked out into.
     */
    public Path resolveProjectDirectory(String projectName) throws FileSystemException {
        Path resolved = resolveSafePath(workspaceRoot, projectName);
        if (resolved.equals(workspaceRoot)) {
            throw new FileSystemException("Project name resolves to the workspace root: " + projectName);
        }
        return resolved;
    }

    // ================================================================
    // Reads
    // ================================================================

    public String readFile(Path root, String relativePath) throws FileSystemException {
        Path targetPath = resolveSafePath(root, relativePath);
        try {
            long fileSize = Files.size(targetPath);
            if (fileSize > MAX_FILE_SIZE)
                throw new FileSystemException("File too large: " + relativePath + " (" + fileSize + " bytes)");
            String content = Files.readString(targetPath, StandardCharsets.UTF_8);
            log.debug("[FileSystem] Read {} chars from {}", content.length(), targetPath);
            return content;
        } catch (IOException e) {
            throw new FileSystemException("Failed to read file: " + relativePath, e);
        }
    }

    /**
     * Contents of the file, or the empty string when it does not exist.
     */
    public String readIfExists(Path root, String relativePath) throws FileSystemException {
        if (!fileExists(root, relativePath)) {
            return "";
        }
        return readFile(root, relativePath);
    }

    public boolean fileExists(Path root, String relativePath) {
        try { return Files.isRegularFile(resolveSafePath(root, relativePath)); }
        catch (FileSystemException e) { return false; }
    }

    public long getFileSize(Path root, String relativePath) throws FileSystemException {
        try { return Files.size(resolveSafePath(root, relativePath)); }
        catch (IOException e) { throw new FileSystemException("Failed to get file size: " + relativePath, e); }
    }

    // ================================================================
    // Atomic write
    // ================================================================

    /**
     * Replace the file's contents as one step: temp file in the same directory,
     * then rename over the target. The temp file is removed on every exit path.
     */
    public void writeAtomically(Path root, String relativePath, String content) throws FileSystemException {
        Path targetPath = resolveSafePath(root, relativePath);
        Path parent = targetPath.getParent();
        log.info("[FileSystem] Writing {} chars to {}", content.length(), targetPath);

        Path temp = null;
        try {
            if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
            temp = Files.createTempFile(parent, "." + targetPath.getFileName() + ".", ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            moveIntoPlace(temp, targetPath);
            log.info("[FileSystem] Committed {}", targetPath);
        } catch (IOException e) {
            throw new FileSystemException("Failed to write file: " + relativePath, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[FileSystem] Atomic move unsupported for {}; falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[FileSystem] Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }

    private Path resolveSafePath(Path root, String relativePath) throws FileSystemException {
        if (relativePath == null || relativePath.trim().isEmpty())
            throw new FileSystemException("Path cannot be empty");
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path resolved = normalizedRoot.resolve(relativePath).normalize();
        if (!resolved.startsWith(normalizedRoot))
            throw new FileSystemException("Path traversal attempt detected: " + relativePath);
        return resolved;
    }

    // ================================================================
    // Inner classes
    // ================================================================

    public static class FileSystemException extends Exception {
        public FileSystemException(String message)                  { super(message); }
        public FileSystemException(String message, Throwable cause) { super(message, cause); }
    }
}
