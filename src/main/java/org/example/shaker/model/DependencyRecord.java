package org.example.shaker.model;

import org.example.shaker.version.VersionConstraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One entry of the dependency set being resolved.
 *
 * <p>Created when a formula is first discovered, mutated in place as further
 * constraints are merged in, and finalized once a concrete revision is known.
 * {@code sourcedConstraints} only ever grows.</p>
 */
public class DependencyRecord {

    private final PackageKey key;
    private final String source;
    private VersionConstraint constraint;
    private final List<String> sourcedConstraints;
    private String resolvedSha;
    private String resolvedTag;

    public DependencyRecord(PackageKey key, String source, VersionConstraint constraint) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.constraint = Objects.requireNonNull(constraint, "constraint cannot be null");
        this.sourcedConstraints = new ArrayList<>();
    }

    // Getters

    public PackageKey getKey() {
        return key;
    }

    public String getSource() {
        return source;
    }

    public VersionConstraint getConstraint() {
        return constraint;
    }

    public List<String> getSourcedConstraints() {
        return Collections.unmodifiableList(sourcedConstraints);
    }

    public String getResolvedSha() {
        return resolvedSha;
    }

    public String getResolvedTag() {
        return resolvedTag;
    }

    // Mutators

    public void setConstraint(VersionConstraint constraint) {
        this.constraint = Objects.requireNonNull(constraint, "constraint cannot be null");
    }

    /**
     * Records a constraint string as processed. Duplicates are ignored.
     */
    public void markSourced(String constraint) {
        if (!sourcedConstraints.contains(constraint)) {
            sourcedConstraints.add(constraint);
        }
    }

    public void markSourced(List<String> constraints) {
        constraints.forEach(this::markSourced);
    }

    public boolean isSourced(String constraint) {
        return sourcedConstraints.contains(constraint);
    }

    public void resolve(ResolvedRevision revision) {
        this.resolvedSha = revision.getSha();
        this.resolvedTag = revision.getName();
    }

    public boolean isResolved() {
        return resolvedSha != null && resolvedTag != null;
    }

    /**
     * Copy carrying the same identity and constraint but a fresh sourced list.
     * Used to hand records to the next recursion level.
     */
    public DependencyRecord copy() {
        DependencyRecord copy = new DependencyRecord(key, source, constraint);
        copy.markSourced(sourcedConstraints);
        copy.resolvedSha = resolvedSha;
        copy.resolvedTag = resolvedTag;
        return copy;
    }

    /**
     * Converts a finalized record to the materializer's view.
     *
     * @throws IllegalStateException if no revision has been resolved yet
     */
    public ResolvedDependency toResolvedDependency() {
        if (!isResolved()) {
            throw new IllegalStateException("Dependency " + key + " has not been resolved");
        }
        return new ResolvedDependency(key, source, resolvedSha, resolvedTag);
    }

    @Override
    public String toString() {
        return "DependencyRecord{" +
                "key=" + key +
                ", source='" + source + '\'' +
                ", constraint='" + constraint + '\'' +
                ", sourced=" + sourcedConstraints +
                ", sha='" + resolvedSha + '\'' +
                ", tag='" + resolvedTag + '\'' +
                '}';
    }
}
