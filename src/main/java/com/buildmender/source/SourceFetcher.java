package com.buildmender.source;

import java.nio.file.Path;

/**
 * Makes a project's sources present at a directory.
 *
 * Idempotent: calling it again for a directory that already holds the project
 * leaves the directory usable and back at the fetched state, with any local
 * edits from an earlier repair session discarded.
 */
public interface SourceFetcher {

    void ensurePresent(String projectUrl, Path projectDir) throws SourceFetchException, InterruptedException;
}
