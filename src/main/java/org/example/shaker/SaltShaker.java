package org.example.shaker;

import org.example.shaker.config.ShakerConfiguration;
import org.example.shaker.exception.ConfigException;
import org.example.shaker.exception.ShakerException;
import org.example.shaker.lockfile.RequirementsFile;
import org.example.shaker.model.DependencyGraph;
import org.example.shaker.model.DependencyRecord;
import org.example.shaker.model.FormulaMetadata;
import org.example.shaker.model.PackageKey;
import org.example.shaker.remote.GitHubRepository;
import org.example.shaker.remote.RemoteRepository;
import org.example.shaker.resolver.DependencyResolver;
import org.example.shaker.resolver.FormulaDependencyResolver;
import org.example.shaker.resolver.MetadataParser;
import org.example.shaker.resolver.RequirementParser;
import org.example.shaker.workspace.LocalWorkspaceMaterializer;
import org.example.shaker.workspace.MaterializationResult;
import org.example.shaker.workspace.ProcessGitClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one full cycle: load the root manifest and lockfile, resolve the
 * dependency graph, then materialize it and write the lockfile (or, when
 * simulating, only log the lockfile lines).
 */
public class SaltShaker {

    private static final Logger log = LoggerFactory.getLogger(SaltShaker.class);

    private final ShakerConfiguration config;
    private final DependencyResolver resolver;
    private final LocalWorkspaceMaterializer materializer;
    private final RequirementParser requirementParser;
    private final MetadataParser metadataParser;

    public SaltShaker(ShakerConfiguration config, DependencyResolver resolver, LocalWorkspaceMaterializer materializer) {
        this.config = config;
        this.resolver = resolver;
        this.materializer = materializer;
        this.requirementParser = new RequirementParser(config.getGitHost());
        this.metadataParser = new MetadataParser(requirementParser);
    }

    /**
     * Wires the GitHub client, the git executable and the resolver from configuration.
     */
    public static SaltShaker create(ShakerConfiguration config) {
        RemoteRepository remote = GitHubRepository.fromConfiguration(config);
        return new SaltShaker(config,
                new FormulaDependencyResolver(remote, config),
                new LocalWorkspaceMaterializer(new ProcessGitClient(), config));
    }

    /**
     * Refreshes the workspace from the lockfile, or from metadata when no lockfile exists.
     */
    public ShakeResult shake() throws ShakerException {
        return run(config.isIgnoreLocalRequirements());
    }

    /**
     * Recalculates every dependency from metadata and rebuilds the clone directory.
     */
    public ShakeResult update() throws ShakerException {
        return run(true);
    }

    private ShakeResult run(boolean recalculate) throws ShakerException {
        FormulaMetadata rootMetadata = metadataParser.parseFile(config.getMetadataFile().toPath());
        RequirementsFile lockfile = new RequirementsFile(config.getRequirementsFile().toPath());

        Map<PackageKey, DependencyRecord> pinned = recalculate ? Collections.emptyMap() : loadPinned(lockfile);
        if (recalculate) {
            log.info("Recalculating all dependencies from {}", config.getMetadataFile());
        }

        DependencyGraph graph = resolver.updateDependencies(rootMetadata, pinned, recalculate,
                config.isIgnoreDependencyRequirements());
        List<String> requirements = graph.getRequirementsLines();

        if (config.isSimulate()) {
            log.warn("Simulation mode enabled, no changes will be made");
            requirements.forEach(line -> log.info("  {}", line));
            return new ShakeResult(graph, requirements, null, false);
        }

        MaterializationResult materialization = materializer.materialize(graph, recalculate);
        log.info("Materialized workspace: {}", materialization);
        boolean written = lockfile.write(requirements, true, true);
        return new ShakeResult(graph, requirements, materialization, written);
    }

    private Map<PackageKey, DependencyRecord> loadPinned(RequirementsFile lockfile) throws ShakerException {
        Optional<List<String>> lines;
        try {
            lines = lockfile.read();
        } catch (IOException e) {
            throw new ConfigException("Failed to read " + lockfile.getPath() + ": " + e.getMessage(), e);
        }
        if (lines.isEmpty()) {
            log.info("No pinned requirements in {}, resolving from metadata", lockfile.getPath());
            return Collections.emptyMap();
        }
        return requirementParser.parseAll(lines.get());
    }
}
