package com.buildmender.core.patch;

import com.buildmender.core.filesystem.FileSystemManager;
import com.buildmender.core.filesystem.FileSystemManager.FileSystemException;
import com.buildmender.core.proposal.FixAction;
import com.buildmender.core.proposal.FixProposal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.regex.Matcher;

/**
 * PatchApplier - applies one FixProposal to its configuration file.
 *
 * APPEND:
 *   Creates the file if needed and adds a marker comment plus the content
 *   after the existing bytes. Existing bytes are never changed. Identical
 *   appends are not deduplicated; each one grows the file.
 *
 * REPLACE_MATCH:
 *   First match only. The matched region is replaced literally by the content
 *   and everything else is kept byte for byte. No match (or no file) is a
 *   no-op reported as applied=false.
 *
 * Every commit goes through FileSystemManager.writeAtomically, so a failed or
 * interrupted call leaves the previous contents in place.
 *
 * Not safe for concurrent calls on the same file; callers hold the project
 * lock.
 */
@Component
public class PatchApplier {

    private static final Logger log = LoggerFactory.getLogger(PatchApplier.class);

    static final String MARKER_TEXT = "buildmender: suggested fix";

    private final FileSystemManager fileSystem;

    public PatchApplier(FileSystemManager fileSystem) {
        this.fileSystem = fileSystem;
    }

    public PatchResult apply(FixProposal proposal, Path projectRoot) throws PatchWriteException {

        if (!proposal.getAction().isEdit()) {
            throw new IllegalArgumentException("Not an edit proposal: " + proposal.getAction());
        }

        String relativePath = proposal.getTargetFile().relativePath(projectRoot);
        log.info("[Patch] {} on {}", proposal.getAction(), relativePath);

        try {
            return proposal.getAction() == FixAction.APPEND
                    ? append(proposal, projectRoot, relativePath)
                    : replaceMatch(proposal, projectRoot, relativePath);
        } catch (FileSystemException e) {
            log.error("[Patch] Failed to patch {}: {}", relativePath, e.getMessage());
            throw new PatchWriteException("Failed to patch " + relativePath + ": " + e.getMessage(), e);
        }
    }

    private PatchResult append(FixProposal proposal, Path projectRoot, String relativePath)
            throws FileSystemException {

        String existing = fileSystem.readIfExists(projectRoot, relativePath);
        String content  = proposal.getContent();

        StringBuilder updated = new StringBuilder(existing);
        if (!existing.isEmpty() && !existing.endsWith("\n")) {
            updated.append('\n');
        }
        updated.append(proposal.getTargetFile().getCommentPrefix()).append(' ').append(MARKER_TEXT).append('\n');
        updated.append(content);
        if (!content.endsWith("\n")) {
            updated.append('\n');
        }

        fileSystem.writeAtomically(projectRoot, relativePath, updated.toString());

        long before = byteLength(existing);
        long after  = byteLength(updated.toString());
        log.info("[Patch] Appended {} chars to {} ({} -> {} bytes)", content.length(), relativePath, before, after);
        return PatchResult.applied(relativePath, "appended to " + relativePath, before, after);
    }

    private PatchResult replaceMatch(FixProposal proposal, Path projectRoot, String relativePath)
            throws FileSystemException {

        if (!fileSystem.fileExists(projectRoot, relativePath)) {
            log.warn("[Patch] {} does not exist; nothing to replace", relativePath);
            return PatchResult.notApplicable(relativePath, relativePath + " does not exist", 0);
        }

        String existing = fileSystem.readFile(projectRoot, relativePath);
        long   before   = byteLength(existing);

        Matcher matcher = proposal.getMatchPattern().matcher(existing);
        if (!matcher.find()) {
            log.warn("[Patch] Pattern /{}/ not found in {}", proposal.getMatchPattern().pattern(), relativePath);
            return PatchResult.notApplicable(relativePath,
                    "pattern /" + proposal.getMatchPattern().pattern() + "/ not found in " + relativePath, before);
        }

        String updated = existing.substring(0, matcher.start())
                + proposal.getContent()
                + existing.substring(matcher.end());

        if (updated.equals(existing)) {
            log.info("[Patch] {} already contains the replacement; no write", relativePath);
            return PatchResult.applied(relativePath, relativePath + " already up to date", before, before);
        }

        fileSystem.writeAtomically(projectRoot, relativePath, updated);

        long after = byteLength(updated);
        log.info("[Patch] Replaced '{}' in {} ({} -> {} bytes)", matcher.group(), relativePath, before, after);
        return PatchResult.applied(relativePath,
                "replaced '" + matcher.group() + "' in " + relativePath, before, after);
    }

    private long byteLength(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }
}
