package org.example.shaker.model;

import java.util.Objects;

/**
 * A concrete revision picked for a formula: the tag, branch or commit
 * name together with the commit it points at.
 */
public final class ResolvedRevision {

    private final String name;
    private final String sha;

    public ResolvedRevision(String name, String sha) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.sha = Objects.requireNonNull(sha, "sha cannot be null");
    }

    public String getName() {
        return name;
    }

    public String getSha() {
        return sha;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedRevision that = (ResolvedRevision) o;
        return name.equals(that.name) && sha.equals(that.sha);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sha);
    }

    @Override
    public String toString() {
        return name + "@" + sha;
    }
}
