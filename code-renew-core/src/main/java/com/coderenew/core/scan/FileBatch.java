package com.coderenew.core.scan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Files submitted together in one analysis call, with running totals.
 *
 * <p>Only exists during batch planning and dispatch. Not thread-safe.
 */
public final class FileBatch {

    private final int index;
    private final List<SourceFile> files = new ArrayList<>();
    private long totalBytes;
    private long totalTokens;

    FileBatch(int index) {
        this.index = index;
    }

    void add(SourceFile file, long bytes, long tokens) {
        files.add(file);
        totalBytes += bytes;
        totalTokens += tokens;
    }

    /**
     * Zero-based position of this batch in the plan.
     *
     * @return batch index
     */
    public int index() {
        return index;
    }

    public List<SourceFile> files() {
        return Collections.unmodifiableList(files);
    }

    public int size() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public long totalBytes() {
        return totalBytes;
    }

    public long totalTokens() {
        return totalTokens;
    }

    @Override
    public String toString() {
        return "FileBatch[" + index + ", files=" + files.size() + ", tokens=" + totalTokens + ", bytes=" + totalBytes + "]";
    }
}
