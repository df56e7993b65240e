package org.example.shaker.workspace;

/**
 * Result of materializing a resolved dependency set into the workspace.
 */
public class MaterializationResult {

    private final int updated;
    private final int unchanged;
    private final int orphansRemoved;
    private final int linksCreated;
    private final long executionTimeMs;

    private MaterializationResult(Builder builder) {
        this.updated = builder.updated;
        this.unchanged = builder.unchanged;
        this.orphansRemoved = builder.orphansRemoved;
        this.linksCreated = builder.linksCreated;
        this.executionTimeMs = builder.executionTimeMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Formulas cloned or checked out to a new revision.
     */
    public int getUpdated() {
        return updated;
    }

    /**
     * Formulas already at the wanted revision.
     */
    public int getUnchanged() {
        return unchanged;
    }

    public int getOrphansRemoved() {
        return orphansRemoved;
    }

    public int getLinksCreated() {
        return linksCreated;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    @Override
    public String toString() {
        return String.format(
                "MaterializationResult{updated=%d, unchanged=%d, orphansRemoved=%d, links=%d, time=%dms}",
                updated, unchanged, orphansRemoved, linksCreated, executionTimeMs
        );
    }

    public static class Builder {
        private int updated;
        private int unchanged;
        private int orphansRemoved;
        private int linksCreated;
        private long executionTimeMs;

        public Builder updated(int updated) {
            this.updated = updated;
            return this;
        }

        public Builder unchanged(int unchanged) {
            this.unchanged = unchanged;
            return this;
        }

        public Builder orphansRemoved(int orphansRemoved) {
            this.orphansRemoved = orphansRemoved;
            return this;
        }

        public Builder linksCreated(int linksCreated) {
            this.linksCreated = linksCreated;
            return this;
        }

        public Builder executionTimeMs(long executionTimeMs) {
            this.executionTimeMs = executionTimeMs;
            return this;
        }

        public MaterializationResult build() {
            return new MaterializationResult(this);
        }
    }
}
