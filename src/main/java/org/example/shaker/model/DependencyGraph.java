package org.example.shaker.model;

import java.util.*;
import java.util.stream.Collectors;

/**
 * The root formula's identity plus every formula it depends on, directly or
 * transitively. The root itself is never an entry of its own map.
 */
public class DependencyGraph {

    private final PackageKey rootKey;
    private final Map<PackageKey, DependencyRecord> dependencies;

    /**
     * @param rootKey the root formula, or {@code null} when the manifest declares none
     */
    public DependencyGraph(PackageKey rootKey) {
        this.rootKey = rootKey;
        this.dependencies = new LinkedHashMap<>();
    }

    // Getters

    public Optional<PackageKey> getRootKey() {
        return Optional.ofNullable(rootKey);
    }

    public Map<PackageKey, DependencyRecord> getDependencies() {
        return Collections.unmodifiableMap(dependencies);
    }

    // Modification methods

    /**
     * Adds or replaces the record for its key.
     *
     * @throws IllegalArgumentException if the record is the root formula
     */
    public void put(DependencyRecord record) {
        if (isRoot(record.getKey())) {
            throw new IllegalArgumentException("Root formula " + rootKey + " cannot depend on itself");
        }
        dependencies.put(record.getKey(), record);
    }

    // Query methods

    public boolean isRoot(PackageKey key) {
        return rootKey != null && rootKey.equals(key);
    }

    public Optional<DependencyRecord> find(PackageKey key) {
        return Optional.ofNullable(dependencies.get(key));
    }

    /**
     * The entry with the given formula name, whatever its organisation.
     */
    public Optional<PackageKey> findByName(String name) {
        return dependencies.keySet().stream()
                .filter(key -> key.getName().equals(name))
                .findFirst();
    }

    public boolean contains(PackageKey key) {
        return dependencies.containsKey(key);
    }

    public int size() {
        return dependencies.size();
    }

    /**
     * Finalized dependencies keyed by formula, in discovery order.
     *
     * @throws IllegalStateException if any record is still unresolved
     */
    public Map<PackageKey, ResolvedDependency> getResolvedDependencies() {
        Map<PackageKey, ResolvedDependency> resolved = new LinkedHashMap<>();
        for (DependencyRecord record : dependencies.values()) {
            resolved.put(record.getKey(), record.toResolvedDependency());
        }
        return resolved;
    }

    /**
     * Lockfile lines, {@code <source>==<tag or sha>}, sorted by formula.
     */
    public List<String> getRequirementsLines() {
        return dependencies.values().stream()
                .sorted(Comparator.comparing(DependencyRecord::getKey))
                .map(r -> r.getSource() + "==" + (r.getResolvedTag() != null ? r.getResolvedTag() : r.getConstraint().getTag()))
                .collect(Collectors.toList());
    }

    /**
     * Directory names that are present on disk but no longer belong to the dependency set.
     *
     * @param existingDirectories names of the directories currently materialized
     * @return the orphaned names, sorted
     */
    public List<String> findOrphans(Collection<String> existingDirectories) {
        Set<String> wanted = dependencies.keySet().stream()
                .map(PackageKey::getName)
                .collect(Collectors.toSet());
        return existingDirectories.stream()
                .filter(name -> !wanted.contains(name))
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
                "root=" + rootKey +
                ", dependencies=" + dependencies.size() +
                '}';
    }
}
