package com.buildmender.core.patch;

import com.buildmender.core.filesystem.FileSystemManager;
import com.buildmender.core.filesystem.FileSystemManager.FileSystemException;
import com.buildmender.core.proposal.TargetFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Sets one key in a project's gradle.properties.
 *
 * Every line defining the key is rewritten to the new value, so a duplicate
 * further down can never shadow it. A missing key is appended and a missing
 * file is created. Comment lines (# or !) are never touched. Line
 * terminators are kept as found; an appended line uses \r\n when the file
 * already does.
 */
@Component
public class PropertyFileUpdater {

    private static final Logger log = LoggerFactory.getLogger(PropertyFileUpdater.class);

    private final FileSystemManager fileSystem;

    public PropertyFileUpdater(FileSystemManager fileSystem) {
        this.fileSystem = fileSystem;
    }

    /**
     * @return true if an existing definition was rewritten, false if the key was appended
     */
    public boolean setProperty(Path projectRoot, String key, String value) throws PatchWriteException {

        validate(key, value);
        String relativePath = TargetFile.PROPERTIES_FILE.getFileName();
        String newLine = key.trim() + "=" + value.trim();

        try {
            String existing = fileSystem.readIfExists(projectRoot, relativePath);

            String eol = existing.contains("\r\n") ? "\r\n" : "\n";
            StringBuilder updated = new StringBuilder();
            boolean replaced = false;

            // each chunk keeps its own terminator; the last one may have none
            for (String chunk : existing.split("(?<=\n)")) {
                String terminator = chunk.endsWith("\r\n") ? "\r\n" : chunk.endsWith("\n") ? "\n" : "";
                String line = chunk.substring(0, chunk.length() - terminator.length());
                if (definesKey(line, key.trim())) {
                    updated.append(newLine).append(terminator);
                    replaced = true;
                } else {
                    updated.append(chunk);
                }
            }

            if (!replaced) {
                if (updated.length() > 0 && updated.charAt(updated.length() - 1) != '\n') {
                    updated.append(eol);
                }
                updated.append(newLine).append(eol);
            }

            fileSystem.writeAtomically(projectRoot, relativePath, updated.toString());
            log.info("[Properties] {} {} in {}", replaced ? "Updated" : "Added", newLine, relativePath);
            return replaced;

        } catch (FileSystemException e) {
            log.error("[Properties] Failed to set {} in {}: {}", key, relativePath, e.getMessage());
            throw new PatchWriteException("Failed to update " + relativePath + ": " + e.getMessage(), e);
        }
    }

    private boolean definesKey(String line, String key) {
        String stripped = line.stripLeading();
        if (stripped.isEmpty() || stripped.startsWith("#") || stripped.startsWith("!")) {
            return false;
        }
        int separator = indexOfSeparator(stripped);
        if (separator == -1) {
            return false;
        }
        return stripped.substring(0, separator).trim().equals(key);
    }

    private int indexOfSeparator(String line) {
        int equals = line.indexOf('=');
        int colon  = line.indexOf(':');
        if (equals == -1) return colon;
        if (colon == -1) return equals;
        return Math.min(equals, colon);
    }

    private void validate(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Property name cannot be empty");
        }
        if (key.contains("=") || key.contains(":") || key.contains("\n") || key.contains("\r")) {
            throw new IllegalArgumentException("Invalid property name: " + key);
        }
        if (value == null || value.contains("\n") || value.contains("\r")) {
            throw new IllegalArgumentException("Invalid value for property " + key);
        }
    }
}
