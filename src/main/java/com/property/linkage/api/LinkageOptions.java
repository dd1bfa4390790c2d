package com.property.linkage.api;

import com.property.linkage.merge.InsertionSynthesizer;

/**
 * Options for linkage runs.
 */
public class LinkageOptions {

    private static final int DEFAULT_PARALLELISM = 1;
    private static final int DEFAULT_PROGRESS_INTERVAL = 5_000;

    private final int parallelism;
    private final int progressInterval;
    private final int nicheOnlyPriorityId;

    private LinkageOptions(Builder builder) {
        this.parallelism = builder.parallelism;
        this.progressInterval = builder.progressInterval;
        this.nicheOnlyPriorityId = builder.nicheOnlyPriorityId;
    }

    /**
     * Worker threads for the match phase; 1 resolves on the calling thread.
     */
    public int getParallelism() {
        return parallelism;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public int getNicheOnlyPriorityId() {
        return nicheOnlyPriorityId;
    }

    public static LinkageOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int parallelism = DEFAULT_PARALLELISM;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;
        private int nicheOnlyPriorityId = InsertionSynthesizer.DEFAULT_NICHE_ONLY_PRIORITY_ID;

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            if (progressInterval <= 0) {
                throw new IllegalArgumentException("progressInterval must be positive");
            }
            this.progressInterval = progressInterval;
            return this;
        }

        public Builder nicheOnlyPriorityId(int nicheOnlyPriorityId) {
            this.nicheOnlyPriorityId = nicheOnlyPriorityId;
            return this;
        }

        public LinkageOptions build() {
            return new LinkageOptions(this);
        }
    }

    @Override
    public String toString() {
        return "LinkageOptions{" +
                "parallelism=" + parallelism +
                ", progressInterval=" + progressInterval +
                ", nicheOnlyPriorityId=" + nicheOnlyPriorityId +
                '}';
    }
}
