package com.coderenew.core.scan;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions an ordered file list into bounded batches.
 *
 * <p>Files are taken in the given order. A new batch is started before appending
 * a file when the current batch already holds {@code maxFiles} files, or when the
 * file would push the running token sum above {@code maxTokens} or the running byte
 * sum above {@code maxTokens * 4}. A single file larger than the ceilings is counted
 * at the ceiling and ends up alone in its batch; its content is truncated at dispatch.
 */
public class BatchPlanner {

    static final int BYTES_PER_TOKEN = 4;

    private final long maxTokens;
    private final long maxBytes;
    private final int maxFiles;

    public BatchPlanner(int maxTokens, int maxFiles) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (maxFiles <= 0) {
            throw new IllegalArgumentException("maxFiles must be positive: " + maxFiles);
        }
        this.maxTokens = maxTokens;
        this.maxBytes = (long) maxTokens * BYTES_PER_TOKEN;
        this.maxFiles = maxFiles;
    }

    /**
     * Plans batches for the files in order.
     *
     * @param files files in dispatch order
     * @return non-empty batches covering every file exactly once
     */
    public List<FileBatch> plan(List<SourceFile> files) {
        List<FileBatch> batches = new ArrayList<>();
        FileBatch current = new FileBatch(0);

        for (SourceFile file : files) {
            long tokens = Math.min(file.estimatedTokens(), maxTokens);
            long bytes = Math.min(file.sizeBytes(), maxBytes);

            boolean full = current.size() >= maxFiles;
            boolean overTokens = current.totalTokens() + tokens > maxTokens;
            boolean overBytes = current.totalBytes() + bytes > maxBytes;
            if (!current.isEmpty() && (full || overTokens || overBytes)) {
                batches.add(current);
                current = new FileBatch(batches.size());
            }
            current.add(file, bytes, tokens);
        }

        if (!current.isEmpty()) {
            batches.add(current);
        }
        return batches;
    }

    /**
     * Counts the analysis calls needed to cover the files completely.
     *
     * <p>Unlike {@link #plan(List)}, a file above the token ceiling is counted as
     * as many calls as it takes to send all of it.
     *
     * @param files files in dispatch order
     * @return projected number of calls
     */
    public int estimateBatchCount(List<SourceFile> files) {
        int count = plan(files).size();
        for (SourceFile file : files) {
            if (file.estimatedTokens() > maxTokens) {
                count += (int) ((file.estimatedTokens() - 1) / maxTokens);
            }
        }
        return count;
    }

    public long getMaxTokens() {
        return maxTokens;
    }

    public int getMaxFiles() {
        return maxFiles;
    }
}
