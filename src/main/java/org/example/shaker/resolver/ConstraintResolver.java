package org.example.shaker.resolver;

import org.apache.maven.artifact.versioning.ComparableVersion;
import org.example.shaker.exception.ConstraintResolutionException;
import org.example.shaker.exception.RemoteConnectionException;
import org.example.shaker.model.PackageKey;
import org.example.shaker.model.ResolvedRevision;
import org.example.shaker.remote.RemoteRepository;
import org.example.shaker.remote.RemoteTag;
import org.example.shaker.version.SemverTag;
import org.example.shaker.version.VersionConstraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Picks the single revision of a formula that best satisfies a constraint.
 *
 * <ul>
 *   <li>unconstrained: the latest release tag, or empty when the repository has none</li>
 *   <li>{@code ==vX.Y.Z}: exactly that version</li>
 *   <li>{@code ==name}: the head of branch {@code name}, or a commit when {@code name} is a sha</li>
 *   <li>{@code >=}: scanning downward, the first release at or above the bound; the scan
 *       aborts on the first candidate below it</li>
 *   <li>{@code <=}: scanning downward, the first release at or below the bound</li>
 * </ul>
 *
 * <p>Prereleases are only ever picked by exact equality.</p>
 */
public class ConstraintResolver {

    private static final Pattern COMMIT_SHA = Pattern.compile("^[0-9a-f]{7,40}$");

    private final RemoteRepository remote;
    private final Logger log;
    private final Map<PackageKey, TagCatalogue> catalogues = new HashMap<>();

    public ConstraintResolver(RemoteRepository remote) {
        this(remote, LoggerFactory.getLogger(ConstraintResolver.class));
    }

    public ConstraintResolver(RemoteRepository remote, Logger log) {
        this.remote = remote;
        this.log = log;
    }

    /**
     * Resolves a constraint against the repository of the given formula.
     *
     * @param key        the formula
     * @param constraint the constraint, possibly unconstrained
     * @return the revision, or empty when unconstrained and the repository has no release tag
     * @throws ConstraintResolutionException if the constraint cannot be satisfied
     * @throws RemoteConnectionException     if the remote cannot be queried
     */
    public Optional<ResolvedRevision> resolve(PackageKey key, VersionConstraint constraint)
            throws ConstraintResolutionException, RemoteConnectionException {
        log.debug("Resolving {} '{}'", key, constraint);

        if (!constraint.isEmpty()) {
            if (!constraint.isRecognised()) {
                throw new ConstraintResolutionException(String.format(
                        "Unknown comparator in constraint '%s' for %s", constraint.getRaw(), key));
            }
            if (constraint.getVersion() == null) {
                if (!constraint.isEquality()) {
                    throw new ConstraintResolutionException(String.format(
                            "Constraint '%s' for %s compares against '%s', which is not a version",
                            constraint, key, constraint.getTag()));
                }
                return Optional.of(resolveReference(key, constraint.getTag()));
            }
        }

        TagCatalogue catalogue = getCatalogue(key);

        if (constraint.isEmpty()) {
            Optional<ResolvedRevision> latest = catalogue.latest(false).map(ConstraintResolver::toRevision);
            if (latest.isPresent()) {
                log.debug("No constraint for {}, using latest release {}", key, latest.get().getName());
            } else {
                log.debug("No constraint for {} and no release tags found", key);
            }
            return latest;
        }

        String version = constraint.getVersion();
        switch (constraint.getComparator()) {
            case VersionConstraint.EQUAL:
                return Optional.of(catalogue.findByVersion(version)
                        .map(ConstraintResolver::toRevision)
                        .orElseThrow(() -> new ConstraintResolutionException(String.format(
                                "Could not satisfy constraint '%s' for %s: version %s not in tag list %s",
                                constraint, key, version, catalogue.getVersions()))));
            case VersionConstraint.GREATER_OR_EQUAL:
                return Optional.of(resolveAtLeast(key, constraint, catalogue));
            case VersionConstraint.LESS_OR_EQUAL:
                return Optional.of(resolveAtMost(key, constraint, catalogue));
            default:
                throw new ConstraintResolutionException(String.format(
                        "Unknown comparator '%s' in constraint '%s' for %s",
                        constraint.getComparator(), constraint, key));
        }
    }

    /**
     * Drops cached tag listings so the next call queries the remote again.
     */
    public void clearCache() {
        catalogues.clear();
    }

    private ResolvedRevision resolveAtLeast(PackageKey key, VersionConstraint constraint, TagCatalogue catalogue)
            throws ConstraintResolutionException {
        ComparableVersion bound = new ComparableVersion(constraint.getVersion());
        for (SemverTag candidate : catalogue.getSortedTagsDescending()) {
            if (new ComparableVersion(candidate.getVersion()).compareTo(bound) < 0) {
                throw new ConstraintResolutionException(String.format(
                        "No non-prerelease version satisfies '%s' for %s (reached %s)",
                        constraint, key, candidate.getTag()));
            }
            if (candidate.isPrerelease()) {
                log.debug("Skipping prerelease {} of {}", candidate.getTag(), key);
                continue;
            }
            return toRevision(catalogue.get(candidate));
        }
        throw new ConstraintResolutionException(String.format(
                "No non-prerelease version satisfies '%s' for %s in %s", constraint, key, catalogue.getVersions()));
    }

    private ResolvedRevision resolveAtMost(PackageKey key, VersionConstraint constraint, TagCatalogue catalogue)
            throws ConstraintResolutionException {
        ComparableVersion bound = new ComparableVersion(constraint.getVersion());
        for (SemverTag candidate : catalogue.getSortedTagsDescending()) {
            if (new ComparableVersion(candidate.getVersion()).compareTo(bound) > 0) {
                continue;
            }
            if (candidate.isPrerelease()) {
                log.debug("Skipping prerelease {} of {}", candidate.getTag(), key);
                continue;
            }
            return toRevision(catalogue.get(candidate));
        }
        throw new ConstraintResolutionException(String.format(
                "No non-prerelease version satisfies '%s' for %s in %s", constraint, key, catalogue.getVersions()));
    }

    private ResolvedRevision resolveReference(PackageKey key, String reference)
            throws ConstraintResolutionException, RemoteConnectionException {
        Optional<ResolvedRevision> branch = remote.getBranch(key, reference);
        if (branch.isPresent()) {
            log.debug("Resolved {} to branch {} at {}", key, reference, branch.get().getSha());
            return branch.get();
        }
        if (COMMIT_SHA.matcher(reference).matches()) {
            Optional<ResolvedRevision> commit = remote.getCommit(key, reference);
            if (commit.isPresent()) {
                log.debug("Resolved {} to commit {}", key, commit.get().getSha());
                return commit.get();
            }
        }
        throw new ConstraintResolutionException(String.format(
                "Could not find branch or commit '%s' for %s", reference, key));
    }

    private TagCatalogue getCatalogue(PackageKey key) throws RemoteConnectionException {
        TagCatalogue catalogue = catalogues.get(key);
        if (catalogue == null) {
            catalogue = new TagCatalogue(remote.listTags(key));
            catalogues.put(key, catalogue);
            log.debug("Tags for {}: {}", key, catalogue.getVersions());
        }
        return catalogue;
    }

    private static ResolvedRevision toRevision(RemoteTag tag) {
        return new ResolvedRevision(tag.getName(), tag.getCommitSha());
    }
}
