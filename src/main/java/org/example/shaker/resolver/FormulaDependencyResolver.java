package org.example.shaker.resolver;

import org.example.shaker.config.ShakerConfiguration;
import org.example.shaker.exception.ConfigException;
import org.example.shaker.exception.ConstraintFormatException;
import org.example.shaker.exception.ConstraintResolutionException;
import org.example.shaker.exception.RemoteConnectionException;
import org.example.shaker.exception.ShakerException;
import org.example.shaker.lockfile.RequirementsFile;
import org.example.shaker.model.DependencyGraph;
import org.example.shaker.model.DependencyRecord;
import org.example.shaker.model.FormulaMetadata;
import org.example.shaker.model.PackageKey;
import org.example.shaker.model.ResolvedRevision;
import org.example.shaker.remote.RemoteRepository;
import org.example.shaker.version.ConstraintMerger;
import org.example.shaker.version.VersionConstraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks the formula dependency graph depth first, starting either from the
 * root manifest or from a pinned requirements file, and resolves every
 * formula to one concrete revision.
 *
 * <p>Each (formula, constraint string) pair triggers at most one remote
 * lookup per run: before fetching, the constraint is claimed in the record's
 * sourced constraints, and a later visit with the same string is skipped.
 * This also terminates cycles. The root formula is never added to its own
 * dependency set.</p>
 *
 * <p>For a visited formula, its own requirements file is preferred over its
 * manifest. A requirements file is already a flattened closure, so its
 * entries arrive pre-marked as sourced and are not fetched again.</p>
 *
 * <p>Not thread-safe; one instance resolves one graph at a time.</p>
 */
public class FormulaDependencyResolver implements DependencyResolver {

    private final RemoteRepository remote;
    private final ConstraintResolver constraintResolver;
    private final ConstraintMerger merger;
    private final RequirementParser requirementParser;
    private final MetadataParser metadataParser;
    private final String metadataFilename;
    private final String requirementsFilename;
    private final Logger log;

    private final Map<String, ResolvedRevision> revisions = new HashMap<>();

    public FormulaDependencyResolver(RemoteRepository remote, ShakerConfiguration config) {
        this(remote, config, LoggerFactory.getLogger(FormulaDependencyResolver.class));
    }

    public FormulaDependencyResolver(RemoteRepository remote, ShakerConfiguration config, Logger log) {
        this(remote,
                new ConstraintResolver(remote),
                new ConstraintMerger(),
                new RequirementParser(config.getGitHost()),
                config.getMetadataFilename(),
                config.getRequirementsFilename(),
                log);
    }

    public FormulaDependencyResolver(RemoteRepository remote,
                                     ConstraintResolver constraintResolver,
                                     ConstraintMerger merger,
                                     RequirementParser requirementParser,
                                     String metadataFilename,
                                     String requirementsFilename,
                                     Logger log) {
        this.remote = remote;
        this.constraintResolver = constraintResolver;
        this.merger = merger;
        this.requirementParser = requirementParser;
        this.metadataParser = new MetadataParser(requirementParser, log);
        this.metadataFilename = metadataFilename;
        this.requirementsFilename = requirementsFilename;
        this.log = log;
    }

    @Override
    public DependencyGraph updateDependencies(FormulaMetadata rootMetadata,
                                              Map<PackageKey, DependencyRecord> localRequirements,
                                              boolean ignoreLocalRequirements,
                                              boolean ignoreDependencyRequirements) throws ShakerException {
        remote.verifyAccess();
        constraintResolver.clearCache();
        revisions.clear();

        DependencyGraph graph = new DependencyGraph(rootMetadata.getRootKey().orElse(null));
        Map<PackageKey, DependencyRecord> pinned = localRequirements != null ? localRequirements : Collections.emptyMap();

        if (!ignoreLocalRequirements && !pinned.isEmpty()) {
            log.info("Updating {} dependencies from pinned requirements", pinned.size());
            seedFromRequirements(graph, pinned);
        } else if (rootMetadata.getDependencies().isEmpty()) {
            log.info("No dependencies found in metadata");
        } else {
            log.info("Updating dependencies from metadata of {}",
                    rootMetadata.getRootKey().map(PackageKey::toString).orElse("<unnamed formula>"));
            Map<PackageKey, DependencyRecord> added = addDependencies(graph, rootMetadata.getDependencies());
            fetchDependencies(graph, added, ignoreDependencyRequirements);
        }

        finalizeRevisions(graph);
        log.info("Resolved {} dependencies", graph.size());
        return graph;
    }

    /**
     * Visits each base dependency once per constraint string and recurses into
     * whatever new dependencies its requirements file or manifest declares.
     */
    void fetchDependencies(DependencyGraph graph,
                           Map<PackageKey, DependencyRecord> base,
                           boolean ignoreDependencyRequirements) throws ShakerException {
        for (DependencyRecord dependency : new ArrayList<>(base.values())) {
            PackageKey key = dependency.getKey();
            String constraint = dependency.getConstraint().toString();

            if (graph.isRoot(key)) {
                log.debug("Skipping root formula {} found as a dependency", key);
                continue;
            }
            if (!claim(graph, dependency, constraint)) {
                log.debug("Already sourced {} '{}'", key, constraint);
                continue;
            }

            log.debug("Fetching dependencies of {} '{}'", key, constraint);
            Optional<FormulaMetadata> remoteMetadata =
                    fetchRemoteDependencies(key, dependency.getConstraint(), ignoreDependencyRequirements);

            if (remoteMetadata.isPresent()) {
                Map<PackageKey, DependencyRecord> added = addDependencies(graph, remoteMetadata.get().getDependencies());
                fetchDependencies(graph, added, ignoreDependencyRequirements);
            } else {
                log.debug("No requirements or metadata found for {}, treating as leaf", key);
            }
        }
    }

    /**
     * Merges discovered dependencies into the graph: unseen formulas are
     * inserted, known ones have their constraints merged and their sourced
     * constraints combined.
     *
     * @return the discovered dependencies, minus the root formula
     * @throws ConfigException if a formula shares its name with one from another organisation
     */
    Map<PackageKey, DependencyRecord> addDependencies(DependencyGraph graph,
                                                      Map<PackageKey, DependencyRecord> discovered)
            throws ConfigException, ConstraintFormatException, ConstraintResolutionException {
        Map<PackageKey, DependencyRecord> added = new LinkedHashMap<>();
        for (DependencyRecord record : discovered.values()) {
            PackageKey key = record.getKey();
            if (graph.isRoot(key)) {
                log.debug("Ignoring root formula {} declared as a dependency", key);
                continue;
            }

            Optional<DependencyRecord> existing = graph.find(key);
            if (existing.isEmpty()) {
                checkNameClash(graph, key);
                log.debug("Adding dependency {} '{}'", key, record.getConstraint());
                graph.put(record.copy());
            } else {
                DependencyRecord current = existing.get();
                VersionConstraint merged = merge(key, record.getConstraint(), current.getConstraint());
                if (!merged.equals(current.getConstraint())) {
                    log.debug("Constraint for {} updated from '{}' to '{}'", key, current.getConstraint(), merged);
                }
                current.setConstraint(merged);
                current.markSourced(record.getSourcedConstraints());
            }
            added.put(key, record);
        }
        return added;
    }

    private VersionConstraint merge(PackageKey key, VersionConstraint newConstraint, VersionConstraint current)
            throws ConstraintFormatException, ConstraintResolutionException {
        try {
            return merger.merge(newConstraint, current);
        } catch (ConstraintResolutionException e) {
            throw new ConstraintResolutionException(key + ": " + e.getMessage(), e);
        } catch (ConstraintFormatException e) {
            throw new ConstraintFormatException(key + ": " + e.getMessage(), e);
        }
    }

    /**
     * Marks a constraint as sourced for its formula.
     *
     * @return false if it had already been sourced
     */
    private boolean claim(DependencyGraph graph, DependencyRecord dependency, String constraint) {
        DependencyRecord current = graph.find(dependency.getKey()).orElse(null);
        if (current == null) {
            current = dependency.copy();
            graph.put(current);
        } else if (current.isSourced(constraint)) {
            return false;
        }
        current.markSourced(constraint);
        return true;
    }

    /**
     * Clones live in a directory named after the formula, so two organisations
     * cannot both contribute a formula of the same name.
     */
    private void checkNameClash(DependencyGraph graph, PackageKey key) throws ConfigException {
        Optional<PackageKey> clash = graph.findByName(key.getName());
        if (clash.isPresent() && !clash.get().equals(key)) {
            throw new ConfigException(String.format(
                    "Formula %s clashes with %s: formula names must be unique across organisations",
                    key, clash.get()));
        }
    }

    private void seedFromRequirements(DependencyGraph graph, Map<PackageKey, DependencyRecord> pinned)
            throws ConfigException {
        for (DependencyRecord record : pinned.values()) {
            if (graph.isRoot(record.getKey())) {
                log.warn("Ignoring root formula {} listed in pinned requirements", record.getKey());
                continue;
            }
            checkNameClash(graph, record.getKey());
            DependencyRecord seed = record.copy();
            seed.markSourced(seed.getConstraint().toString());
            graph.put(seed);
        }
    }

    /**
     * Fetches a formula's requirements file, falling back to its manifest,
     * at the revision its constraint resolves to.
     */
    private Optional<FormulaMetadata> fetchRemoteDependencies(PackageKey key,
                                                              VersionConstraint constraint,
                                                              boolean ignoreDependencyRequirements)
            throws ShakerException {
        ResolvedRevision revision = resolveRevision(key, constraint);
        String ref = revision.getSha();

        if (!ignoreDependencyRequirements) {
            Optional<String> requirements = remote.fetchFile(key, ref, requirementsFilename);
            if (requirements.isPresent()) {
                List<String> lines = RequirementsFile.parseLines(requirements.get());
                if (lines.isEmpty()) {
                    throw new ConfigException(String.format(
                            "Requirements file %s of %s at %s has no entries", requirementsFilename, key, revision.getName()));
                }
                Map<PackageKey, DependencyRecord> records = requirementParser.parseAll(lines);
                for (DependencyRecord record : records.values()) {
                    record.markSourced(record.getConstraint().toString());
                }
                log.debug("Found {} pinned requirements for {}", records.size(), key);
                return Optional.of(new FormulaMetadata(null, records, null));
            }
        }

        Optional<String> metadata = remote.fetchFile(key, ref, metadataFilename);
        if (metadata.isPresent()) {
            String origin = key + "@" + revision.getName() + "/" + metadataFilename;
            return Optional.of(metadataParser.parse(metadata.get(), origin));
        }
        return Optional.empty();
    }

    private void finalizeRevisions(DependencyGraph graph) throws ConstraintResolutionException, RemoteConnectionException {
        for (DependencyRecord record : graph.getDependencies().values()) {
            ResolvedRevision revision = resolveRevision(record.getKey(), record.getConstraint());
            record.resolve(revision);
            log.debug("{} '{}' resolved to {}", record.getKey(), record.getConstraint(), revision);
        }
    }

    /**
     * Resolves a constraint, memoised per formula and constraint for the run.
     * An unconstrained formula without release tags falls back to its default branch.
     */
    private ResolvedRevision resolveRevision(PackageKey key, VersionConstraint constraint)
            throws ConstraintResolutionException, RemoteConnectionException {
        String cacheKey = key + "|" + constraint;
        ResolvedRevision cached = revisions.get(cacheKey);
        if (cached != null) {
            return cached;
        }

        Optional<ResolvedRevision> resolved = constraintResolver.resolve(key, constraint);
        ResolvedRevision revision;
        if (resolved.isPresent()) {
            revision = resolved.get();
        } else {
            revision = remote.getDefaultBranch(key).orElseThrow(() -> new ConstraintResolutionException(
                    "No release tags or default branch found for " + key));
            log.info("No release tags for {}, using default branch {}", key, revision.getName());
        }
        revisions.put(cacheKey, revision);
        return revision;
    }
}
