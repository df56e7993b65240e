package org.example.shaker.workspace;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.example.shaker.config.ShakerConfiguration;
import org.example.shaker.exception.MaterializationException;
import org.example.shaker.model.DependencyGraph;
import org.example.shaker.model.ResolvedDependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Clones each resolved formula at its pinned commit and links what it exports
 * into a single salt root.
 *
 * <p>Layout below the vendor directory:</p>
 * <pre>
 * formula-repos/&lt;name&gt;/      one clone per formula
 * _root/&lt;export&gt;              relative symlink into the clone
 * _root/_modules/&lt;file&gt;       dynamic modules, linked file by file
 * </pre>
 *
 * <p>The salt root holds only links and is rebuilt on every run.</p>
 */
public class LocalWorkspaceMaterializer {

    static final List<String> DYNAMIC_MODULE_DIRS =
            List.of("_modules", "_grains", "_renderers", "_returners", "_states");

    private final GitClient git;
    private final RetryExecutor retryExecutor;
    private final Path clonePath;
    private final Path saltRootPath;
    private final String metadataFilename;
    private final boolean removeOrphans;
    private final Logger log;
    private final YAMLMapper mapper = new YAMLMapper();

    public LocalWorkspaceMaterializer(GitClient git, ShakerConfiguration config) {
        this(git,
                new RetryExecutor(config.getRetryAttempts(), config.getRetryBackoffMs()),
                config.getClonePath().toPath(),
                config.getSaltRootPath().toPath(),
                config.getMetadataFilename(),
                config.isRemoveOrphans(),
                LoggerFactory.getLogger(LocalWorkspaceMaterializer.class));
    }

    public LocalWorkspaceMaterializer(GitClient git, RetryExecutor retryExecutor, Path clonePath,
                                      Path saltRootPath, String metadataFilename, boolean removeOrphans,
                                      Logger log) {
        this.git = git;
        this.retryExecutor = retryExecutor;
        this.clonePath = clonePath;
        this.saltRootPath = saltRootPath;
        this.metadataFilename = metadataFilename;
        this.removeOrphans = removeOrphans;
        this.log = log;
    }

    /**
     * Brings the workspace in line with a resolved graph.
     *
     * @param graph        the fully resolved graph
     * @param cleanInstall wipe existing clones first
     * @return counts of what changed
     * @throws MaterializationException if any clone, checkout or link fails
     */
    public MaterializationResult materialize(DependencyGraph graph, boolean cleanInstall)
            throws MaterializationException {
        long startTime = System.currentTimeMillis();
        prepareDirectories(cleanInstall);

        List<ResolvedDependency> dependencies = new ArrayList<>(graph.getResolvedDependencies().values());
        int updated = 0;
        int unchanged = 0;
        for (ResolvedDependency dependency : dependencies) {
            if (install(dependency)) {
                updated++;
            } else {
                unchanged++;
            }
        }

        int orphansRemoved = 0;
        if (removeOrphans) {
            for (String orphan : graph.findOrphans(listDirectories(clonePath))) {
                log.info("Removing orphaned formula directory {}", orphan);
                deleteRecursively(clonePath.resolve(orphan));
                orphansRemoved++;
            }
        }

        int links = 0;
        for (ResolvedDependency dependency : dependencies) {
            links += linkExports(dependency);
            links += linkDynamicModules(dependency);
        }

        return MaterializationResult.builder()
                .updated(updated)
                .unchanged(unchanged)
                .orphansRemoved(orphansRemoved)
                .linksCreated(links)
                .executionTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    void prepareDirectories(boolean cleanInstall) throws MaterializationException {
        try {
            if (Files.exists(saltRootPath, LinkOption.NOFOLLOW_LINKS)) {
                log.debug("Deleting salt root {}", saltRootPath);
                deleteRecursively(saltRootPath);
            }
            Files.createDirectories(saltRootPath);

            if (cleanInstall && Files.exists(clonePath)) {
                log.debug("Deleting clone directory {}", clonePath);
                deleteRecursively(clonePath);
            }
            Files.createDirectories(clonePath);
        } catch (IOException e) {
            throw new MaterializationException("Failed to prepare workspace directories: " + e.getMessage(), e);
        }
    }

    /**
     * @return true if the clone was created or moved to a new commit
     */
    boolean install(ResolvedDependency dependency) throws MaterializationException {
        Path repository = clonePath.resolve(dependency.getName());
        String description = dependency.getKey() + "==" + dependency.getTag();

        if (Files.exists(repository)) {
            Optional<String> head = headSha(repository);
            if (head.isPresent() && head.get().equals(dependency.getSha())) {
                log.info("{} already at {}", description, dependency.getSha());
                return false;
            }
            if (head.isEmpty()) {
                log.warn("{} is not a git repository, cloning again", repository);
                deleteRecursively(repository);
            }
        }

        if (!Files.exists(repository)) {
            log.info("Cloning {} from {}", description, dependency.getSource());
            retryExecutor.executeVoid(() -> git.cloneRepository(dependency.getSource(), repository),
                    "Cloning " + dependency.getSource());
        } else {
            log.info("Updating {}", description);
            retryExecutor.executeVoid(() -> git.fetch(repository), "Fetching " + dependency.getSource());
        }

        try {
            git.checkout(repository, dependency.getSha());
        } catch (IOException e) {
            throw new MaterializationException(
                    "Failed to check out " + dependency.getSha() + " for " + dependency.getKey() + ": " + e.getMessage(), e);
        }
        return true;
    }

    /**
     * Links each export: {@code <clone>/<export>} to {@code <root>/<export>} when
     * the clone has that directory, otherwise the whole clone to {@code <root>/<name>}.
     */
    int linkExports(ResolvedDependency dependency) throws MaterializationException {
        Path repository = clonePath.resolve(dependency.getName());
        int links = 0;
        for (String export : readExports(dependency)) {
            Path[][] candidates = {
                    {repository.resolve(export), saltRootPath.resolve(export)},
                    {repository, saltRootPath.resolve(dependency.getName())}
            };

            boolean linked = false;
            for (Path[] candidate : candidates) {
                Path source = candidate[0];
                Path target = candidate[1];
                if (!Files.exists(source)) {
                    continue;
                }
                if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                    throw new MaterializationException(
                            "Link target " + target + " for " + dependency.getKey() + " conflicts with something else");
                }
                createLink(source, target);
                log.info("Linked {} to {}", source, target);
                links++;
                linked = true;
                break;
            }

            if (!linked) {
                throw new MaterializationException(
                        "Could not find a directory to link for export '" + export + "' of " + dependency.getKey());
            }
        }
        return links;
    }

    int linkDynamicModules(ResolvedDependency dependency) throws MaterializationException {
        Path repository = clonePath.resolve(dependency.getName());
        int links = 0;
        for (String moduleDir : DYNAMIC_MODULE_DIRS) {
            Path sourceDir = repository.resolve(moduleDir);
            if (!Files.isDirectory(sourceDir)) {
                continue;
            }
            Path targetDir = saltRootPath.resolve(moduleDir);
            for (String entry : listEntries(sourceDir)) {
                Path target = targetDir.resolve(entry);
                if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                    log.warn("Not linking {}/{} of {}, link already exists", moduleDir, entry, dependency.getKey());
                    continue;
                }
                createLink(sourceDir.resolve(entry), target);
                links++;
            }
        }
        return links;
    }

    /**
     * Exports declared in the clone's metadata, defaulting to the name without a {@code -formula} suffix.
     */
    List<String> readExports(ResolvedDependency dependency) {
        List<String> defaults = List.of(dependency.getName().replaceFirst("-formula$", ""));
        Path metadata = clonePath.resolve(dependency.getName()).resolve(metadataFilename);
        if (!Files.isRegularFile(metadata)) {
            return defaults;
        }
        try {
            JsonNode exports = mapper.readTree(metadata.toFile()).path("exports");
            if (!exports.isArray() || exports.isEmpty()) {
                return defaults;
            }
            List<String> values = new ArrayList<>();
            exports.forEach(node -> values.add(node.asText()));
            return values;
        } catch (IOException e) {
            log.debug("Unreadable metadata {}, using default exports: {}", metadata, e.getMessage());
            return defaults;
        }
    }

    private Optional<String> headSha(Path repository) {
        try {
            return git.headSha(repository);
        } catch (IOException e) {
            log.debug("Could not read HEAD of {}: {}", repository, e.getMessage());
            return Optional.empty();
        }
    }

    private void createLink(Path source, Path target) throws MaterializationException {
        try {
            Files.createDirectories(target.getParent());
            Files.createSymbolicLink(target, target.getParent().relativize(source));
        } catch (IOException e) {
            throw new MaterializationException("Failed to link " + source + " to " + target + ": " + e.getMessage(), e);
        }
    }

    private List<String> listDirectories(Path directory) throws MaterializationException {
        try (Stream<Path> paths = Files.list(directory)) {
            return paths.filter(p -> Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS))
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new MaterializationException("Failed to list " + directory + ": " + e.getMessage(), e);
        }
    }

    private List<String> listEntries(Path directory) throws MaterializationException {
        try (Stream<Path> paths = Files.list(directory)) {
            return paths.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new MaterializationException("Failed to list " + directory + ": " + e.getMessage(), e);
        }
    }

    private void deleteRecursively(Path path) throws MaterializationException {
        try (Stream<Path> paths = Files.walk(path)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(p);
            }
        } catch (IOException e) {
            throw new MaterializationException("Failed to delete " + path + ": " + e.getMessage(), e);
        }
    }
}
