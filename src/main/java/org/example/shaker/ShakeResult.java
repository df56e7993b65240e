package org.example.shaker;

import org.example.shaker.model.DependencyGraph;
import org.example.shaker.workspace.MaterializationResult;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one shaker run.
 */
public class ShakeResult {

    private final DependencyGraph graph;
    private final List<String> requirements;
    private final MaterializationResult materialization;
    private final boolean requirementsWritten;

    ShakeResult(DependencyGraph graph, List<String> requirements,
                MaterializationResult materialization, boolean requirementsWritten) {
        this.graph = graph;
        this.requirements = List.copyOf(requirements);
        this.materialization = materialization;
        this.requirementsWritten = requirementsWritten;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    /**
     * Lockfile lines of the resolved set.
     */
    public List<String> getRequirements() {
        return requirements;
    }

    /**
     * Empty for simulated runs.
     */
    public Optional<MaterializationResult> getMaterialization() {
        return Optional.ofNullable(materialization);
    }

    public boolean isRequirementsWritten() {
        return requirementsWritten;
    }

    public boolean isSimulated() {
        return materialization == null;
    }
}
