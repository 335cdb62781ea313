package com.buildmender.core.proposal;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * The two configuration artifacts a proposal may edit.
 */
public enum TargetFile {

    PROPERTIES_FILE("gradle.properties", "#"),
    BUILD_SCRIPT("build.gradle", "//"),
    NONE(null, null);

    private static final String KOTLIN_BUILD_SCRIPT = "build.gradle.kts";

    private final String fileName;
    private final String commentPrefix;

    TargetFile(String fileName, String commentPrefix) {
        this.fileName = fileName;
        this.commentPrefix = commentPrefix;
    }

    public String getFileName() {
        return fileName;
    }

    public String getCommentPrefix() {
        return commentPrefix;
    }

    /**
     * Relative path of this artifact inside a project. The Kotlin DSL script is
     * used only when the Groovy one is absent.
     */
    public String relativePath(Path projectRoot) {
        if (this == NONE) {
            throw new IllegalStateException("TargetFile.NONE has no path");
        }
        if (this == BUILD_SCRIPT
                && !Files.exists(projectRoot.resolve(fileName))
                && Files.exists(projectRoot.resolve(KOTLIN_BUILD_SCRIPT))) {
            return KOTLIN_BUILD_SCRIPT;
        }
        return fileName;
    }

    /**
     * Maps an oracle-supplied identifier to a target. Accepts the bare file
     * name in any case, with optional "./" prefix and quoting.
     */
    public static Optional<TargetFile> fromIdentifier(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        String id = identifier.trim()
                .replaceAll("^[`'\"]+|[`'\"]+$", "")
                .replaceFirst("^\\./", "")
                .toLowerCase(Locale.ROOT);

        if (id.equals(PROPERTIES_FILE.fileName)) {
            return Optional.of(PROPERTIES_FILE);
        }
        if (id.equals(BUILD_SCRIPT.fileName) || id.equals(KOTLIN_BUILD_SCRIPT)) {
            return Optional.of(BUILD_SCRIPT);
        }
        return Optional.empty();
    }
}
