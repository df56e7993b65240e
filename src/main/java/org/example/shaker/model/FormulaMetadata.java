package org.example.shaker.model;

import java.util.*;

/**
 * Parsed {@code metadata.yml} of a formula: its own identity, declared
 * dependencies and exported directories.
 */
public class FormulaMetadata {

    private final PackageKey rootKey;
    private final Map<PackageKey, DependencyRecord> dependencies;
    private final List<String> exports;

    public FormulaMetadata(PackageKey rootKey, Map<PackageKey, DependencyRecord> dependencies, List<String> exports) {
        this.rootKey = rootKey;
        this.dependencies = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(dependencies, "dependencies cannot be null")));
        this.exports = exports != null ? List.copyOf(exports) : Collections.emptyList();
    }

    public Optional<PackageKey> getRootKey() {
        return Optional.ofNullable(rootKey);
    }

    public Map<PackageKey, DependencyRecord> getDependencies() {
        return dependencies;
    }

    /**
     * Directories the formula declares for linking; empty when it declares none.
     */
    public List<String> getExports() {
        return exports;
    }

    @Override
    public String toString() {
        return "FormulaMetadata{root=" + rootKey + ", dependencies=" + dependencies.keySet() + ", exports=" + exports + '}';
    }
}
