package org.example.shaker.resolver;

import org.example.shaker.exception.ShakerException;
import org.example.shaker.model.DependencyGraph;
import org.example.shaker.model.DependencyRecord;
import org.example.shaker.model.FormulaMetadata;
import org.example.shaker.model.PackageKey;

import java.util.Map;

/**
 * Interface for resolving a formula's dependency graph to concrete revisions.
 */
public interface DependencyResolver {

    /**
     * Resolves the full dependency set of a root formula.
     *
     * @param rootMetadata                 the root formula's manifest
     * @param localRequirements            previously pinned requirements, empty when there are none
     * @param ignoreLocalRequirements      derive from the manifest even when pins exist
     * @param ignoreDependencyRequirements read dependencies' manifests rather than their requirements files
     * @return the graph with every record finalized
     * @throws ShakerException if any part of the graph cannot be resolved
     */
    DependencyGraph updateDependencies(FormulaMetadata rootMetadata,
                                       Map<PackageKey, DependencyRecord> localRequirements,
                                       boolean ignoreLocalRequirements,
                                       boolean ignoreDependencyRequirements) throws ShakerException;
}
