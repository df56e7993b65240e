package org.example.shaker.model;

import java.util.Objects;

/**
 * Immutable view of a finalized dependency, handed to the workspace materializer.
 */
public final class ResolvedDependency {

    private final PackageKey key;
    private final String source;
    private final String sha;
    private final String tag;

    public ResolvedDependency(PackageKey key, String source, String sha, String tag) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.sha = Objects.requireNonNull(sha, "sha cannot be null");
        this.tag = Objects.requireNonNull(tag, "tag cannot be null");
    }

    // Getters

    public PackageKey getKey() {
        return key;
    }

    /**
     * Directory name the formula is cloned into.
     */
    public String getName() {
        return key.getName();
    }

    public String getSource() {
        return source;
    }

    public String getSha() {
        return sha;
    }

    public String getTag() {
        return tag;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedDependency that = (ResolvedDependency) o;
        return key.equals(that.key) && source.equals(that.source)
                && sha.equals(that.sha) && tag.equals(that.tag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, source, sha, tag);
    }

    @Override
    public String toString() {
        return key + "==" + tag + " (" + sha + ")";
    }
}
