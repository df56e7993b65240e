package org.example.shaker;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.settings.Server;
import org.apache.maven.settings.Settings;
import org.example.shaker.config.ConfigurationValidator;
import org.example.shaker.config.ShakerConfiguration;
import org.example.shaker.exception.ConfigException;
import org.example.shaker.exception.ShakerException;
import org.example.shaker.workspace.MaterializationResult;

import java.io.File;

/**
 * Shared parameters and error handling of the shaker goals.
 */
public abstract class AbstractShakerMojo extends AbstractMojo {

    static final String TOKEN_ENVIRONMENT_VARIABLE = "GITHUB_TOKEN";

    // ========== Workspace Layout ==========

    /**
     * Directory containing the root metadata.yml and formula-requirements.txt.
     */
    @Parameter(property = "shaker.rootDirectory", defaultValue = "${basedir}")
    private File rootDirectory;

    @Parameter(property = "shaker.metadataFilename", defaultValue = ShakerConfiguration.DEFAULT_METADATA_FILENAME)
    private String metadataFilename;

    @Parameter(property = "shaker.requirementsFilename", defaultValue = ShakerConfiguration.DEFAULT_REQUIREMENTS_FILENAME)
    private String requirementsFilename;

    @Parameter(property = "shaker.vendorDirectory", defaultValue = "vendor")
    private String vendorDirectory;

    @Parameter(property = "shaker.cloneDirectory", defaultValue = "formula-repos")
    private String cloneDirectory;

    /**
     * Directory of links to add to the salt master's file_roots.
     */
    @Parameter(property = "shaker.saltRoot", defaultValue = "_root")
    private String saltRoot;

    // ========== Resolution ==========

    /**
     * Resolve from metadata.yml even when formula-requirements.txt pins the set.
     */
    @Parameter(property = "shaker.ignoreLocalRequirements", defaultValue = "false")
    private boolean ignoreLocalRequirements;

    /**
     * Always read dependencies' metadata.yml, never their formula-requirements.txt.
     */
    @Parameter(property = "shaker.ignoreDependencyRequirements", defaultValue = "false")
    private boolean ignoreDependencyRequirements;

    /**
     * Only log the resolved requirements.
     */
    @Parameter(property = "shaker.simulate", defaultValue = "false")
    private boolean simulate;

    @Parameter(property = "shaker.removeOrphans", defaultValue = "true")
    private boolean removeOrphans;

    @Parameter(property = "shaker.maxTagCount", defaultValue = "1000")
    private int maxTagCount;

    // ========== GitHub Access ==========

    /**
     * GitHub token. Falls back to the server password of {@code serverId}, then to GITHUB_TOKEN.
     */
    @Parameter(property = "shaker.githubToken")
    private String githubToken;

    /**
     * Server ID in settings.xml whose password is the GitHub token.
     */
    @Parameter(property = "shaker.serverId")
    private String serverId;

    @Parameter(property = "shaker.validateTokenOnline", defaultValue = "false")
    private boolean validateTokenOnline;

    @Parameter(property = "shaker.githubApiUrl", defaultValue = ShakerConfiguration.DEFAULT_GITHUB_API_URL)
    private String githubApiUrl;

    @Parameter(property = "shaker.githubRawUrl", defaultValue = ShakerConfiguration.DEFAULT_GITHUB_RAW_URL)
    private String githubRawUrl;

    @Parameter(property = "shaker.gitHost", defaultValue = "github.com")
    private String gitHost;

    // ========== Git ==========

    @Parameter(property = "shaker.retryAttempts", defaultValue = "3")
    private int retryAttempts;

    @Parameter(property = "shaker.retryBackoffMs", defaultValue = "2000")
    private long retryBackoffMs;

    /**
     * Whether to fail build on resolution or materialization error.
     */
    @Parameter(property = "shaker.failOnError", defaultValue = "true")
    private boolean failOnError;

    @Parameter(defaultValue = "${settings}", readonly = true)
    private Settings settings;

    // ========== Execution ==========

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        logBanner();

        try {
            ShakerConfiguration config = buildConfiguration();

            new ConfigurationValidator().validateOrThrow(config);
            getLog().debug("Configuration validated successfully");

            logConfigurationSummary(config);

            ShakeResult result = run(SaltShaker.create(config));

            logResult(result);

        } catch (ConfigException e) {
            // Configuration errors always fail the build (ignore failOnError)
            logError("Configuration is invalid", e);
            throw new MojoExecutionException("Salt shaker configuration is invalid: " + e.getMessage(), e);

        } catch (ShakerException e) {
            handleError(e);
        }
    }

    /**
     * Runs the goal's variant of the shaker cycle.
     */
    protected abstract ShakeResult run(SaltShaker shaker) throws ShakerException;

    protected abstract String getGoalDescription();

    /**
     * Builds the plugin configuration from Mojo parameters.
     */
    ShakerConfiguration buildConfiguration() {
        return ShakerConfiguration.builder()
                .rootDirectory(rootDirectory)
                .metadataFilename(metadataFilename)
                .requirementsFilename(requirementsFilename)
                .vendorDirectory(vendorDirectory)
                .cloneDirectory(cloneDirectory)
                .saltRoot(saltRoot)
                .ignoreLocalRequirements(ignoreLocalRequirements)
                .ignoreDependencyRequirements(ignoreDependencyRequirements)
                .simulate(simulate)
                .removeOrphans(removeOrphans)
                .maxTagCount(maxTagCount)
                .githubToken(resolveToken())
                .serverId(serverId)
                .validateTokenOnline(validateTokenOnline)
                .githubApiUrl(githubApiUrl)
                .githubRawUrl(githubRawUrl)
                .gitHost(gitHost)
                .retryAttempts(retryAttempts)
                .retryBackoffMs(retryBackoffMs)
                .failOnError(failOnError)
                .build();
    }

    private String resolveToken() {
        if (!isBlank(githubToken)) {
            return githubToken;
        }
        if (!isBlank(serverId) && settings != null) {
            Server server = settings.getServer(serverId);
            if (server != null && !isBlank(server.getPassword())) {
                getLog().debug("GitHub token loaded from server: " + serverId);
                return server.getPassword();
            }
            getLog().warn("Server not found in settings.xml or has no password: " + serverId);
        }
        return System.getenv(TOKEN_ENVIRONMENT_VARIABLE);
    }

    /**
     * Handles errors based on failOnError flag.
     */
    private void handleError(ShakerException e) throws MojoExecutionException {
        logError(getGoalDescription() + " failed", e);

        if (failOnError) {
            throw new MojoExecutionException("Salt shaker failed: " + e.getMessage(), e);
        } else {
            getLog().warn("Salt shaker failed but continuing build (failOnError=false)");
        }
    }

    // ========== Logging ==========

    private void logBanner() {
        getLog().info("============================================================");
        getLog().info("Salt Shaker - " + getGoalDescription());
        getLog().info("============================================================");
    }

    private void logConfigurationSummary(ShakerConfiguration config) {
        getLog().info("Configuration:");
        getLog().info("  Metadata: " + config.getMetadataFile());
        getLog().info("  Requirements: " + config.getRequirementsFile());
        getLog().info("  Clone directory: " + config.getClonePath());
        getLog().info("  Salt root: " + config.getSaltRootPath());
        getLog().info("  GitHub API: " + config.getGithubApiUrl());
        if (config.isIgnoreDependencyRequirements()) {
            getLog().info("  Ignoring dependency requirements files");
        }
        getLog().info("  Simulate: " + config.isSimulate());
        getLog().info("  Fail on error: " + config.isFailOnError());
        getLog().info("============================================================");
    }

    private void logResult(ShakeResult result) {
        getLog().info("============================================================");
        getLog().info("Resolved " + result.getRequirements().size() + " formula(s):");
        for (String requirement : result.getRequirements()) {
            getLog().info("  " + requirement);
        }
        if (result.getMaterialization().isPresent()) {
            MaterializationResult materialization = result.getMaterialization().get();
            getLog().info("  Updated: " + materialization.getUpdated());
            getLog().info("  Unchanged: " + materialization.getUnchanged());
            if (materialization.getOrphansRemoved() > 0) {
                getLog().info("  Orphans removed: " + materialization.getOrphansRemoved());
            }
            getLog().info("  Links created: " + materialization.getLinksCreated());
            getLog().info("  Execution time: " + materialization.getExecutionTimeMs() + "ms");
            getLog().info("  Requirements written: " + result.isRequirementsWritten());
        } else {
            getLog().info("  Simulation only, workspace untouched");
        }
        getLog().info("============================================================");
    }

    private void logError(String message, Exception e) {
        getLog().error("============================================================");
        getLog().error("Salt Shaker Failed: " + message);
        getLog().error("============================================================");
        getLog().error("Error: " + e.getMessage());
        if (getLog().isDebugEnabled()) {
            getLog().debug("Stack trace:", e);
        }
        getLog().error("============================================================");
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
