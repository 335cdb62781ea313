package com.buildmender.core.patch;

/**
 * PatchResult - outcome of one PatchApplier call that did not fail with I/O.
 *
 * applied == false means the edit was not applicable (pattern absent or target
 * missing) and the file was left untouched.
 */
public final class PatchResult {

    private final boolean applied;
    private final String  relativePath;
    private final String  detail;
    private final long    sizeBefore;
    private final long    sizeAfter;

    private PatchResult(boolean applied, String relativePath, String detail, long sizeBefore, long sizeAfter) {
        this.applied      = applied;
        this.relativePath = relativePath;
        this.detail       = detail != null ? detail : "";
        this.sizeBefore   = sizeBefore;
        this.sizeAfter    = sizeAfter;
    }

    public static PatchResult applied(String relativePath, String detail, long sizeBefore, long sizeAfter) {
        return new PatchResult(true, relativePath, detail, sizeBefore, sizeAfter);
    }

    public static PatchResult notApplicable(String relativePath, String detail, long size) {
        return new PatchResult(false, relativePath, detail, size, size);
    }

    public boolean isApplied()       { return applied; }
    public String  getRelativePath() { return relativePath; }
    public String  getDetail()       { return detail; }
    public long    getSizeBefore()   { return sizeBefore; }
    public long    getSizeAfter()    { return sizeAfter; }

    @Override
    public String toString() {
        return String.format("PatchResult{applied=%b, file='%s', size=%d->%d, detail='%s'}",
                applied, relativePath, sizeBefore, sizeAfter, detail);
    }
}
