package org.example.shaker.config;

import java.io.File;
import java.util.Objects;

/**
 * Plugin configuration model.
 * Contains all configuration parameters for the Salt Shaker Maven Plugin.
 */
public class ShakerConfiguration {

    public static final String DEFAULT_METADATA_FILENAME = "metadata.yml";
    public static final String DEFAULT_REQUIREMENTS_FILENAME = "formula-requirements.txt";
    public static final String DEFAULT_GITHUB_API_URL = "https://api.github.com";
    public static final String DEFAULT_GITHUB_RAW_URL = "https://raw.githubusercontent.com";

    /**
     * Directory holding the root metadata.yml and the lockfile.
     */
    private File rootDirectory;

    private String metadataFilename = DEFAULT_METADATA_FILENAME;

    private String requirementsFilename = DEFAULT_REQUIREMENTS_FILENAME;

    /**
     * Working directory below the root, containing the clone directory and the salt root.
     */
    private String vendorDirectory = "vendor";

    private String cloneDirectory = "formula-repos";

    private String saltRoot = "_root";

    /**
     * Recalculate the dependency set from metadata, ignoring the lockfile.
     * Default: false
     */
    private boolean ignoreLocalRequirements = false;

    /**
     * Never read dependencies' own requirements files, always their metadata.
     * Default: false
     */
    private boolean ignoreDependencyRequirements = false;

    /**
     * Only log the resolved requirements, do not touch the workspace.
     * Default: false
     */
    private boolean simulate = false;

    private boolean removeOrphans = true;

    private String githubToken;

    private String serverId;

    private boolean validateTokenOnline = false;

    private String githubApiUrl = DEFAULT_GITHUB_API_URL;

    private String githubRawUrl = DEFAULT_GITHUB_RAW_URL;

    /**
     * Host used when expanding short {@code org/name} requirements into clone URLs.
     */
    private String gitHost = "github.com";

    private int maxTagCount = 1000;

    private int retryAttempts = 3;

    private long retryBackoffMs = 2000;

    /**
     * Whether to fail build on resolution or materialization error.
     * Default: true
     */
    private boolean failOnError = true;

    // Constructors

    public ShakerConfiguration() {
    }

    public static Builder builder() {
        return new Builder();
    }

    // Derived paths

    public File getMetadataFile() {
        return new File(rootDirectory, metadataFilename);
    }

    public File getRequirementsFile() {
        return new File(rootDirectory, requirementsFilename);
    }

    public File getClonePath() {
        return new File(new File(rootDirectory, vendorDirectory), cloneDirectory);
    }

    public File getSaltRootPath() {
        return new File(new File(rootDirectory, vendorDirectory), saltRoot);
    }

    // Getters and Setters

    public File getRootDirectory() {
        return rootDirectory;
    }

    public void setRootDirectory(File rootDirectory) {
        this.rootDirectory = rootDirectory;
    }

    public String getMetadataFilename() {
        return metadataFilename;
    }

    public void setMetadataFilename(String metadataFilename) {
        this.metadataFilename = metadataFilename;
    }

    public String getRequirementsFilename() {
        return requirementsFilename;
    }

    public void setRequirementsFilename(String requirementsFilename) {
        this.requirementsFilename = requirementsFilename;
    }

    public String getVendorDirectory() {
        return vendorDirectory;
    }

    public void setVendorDirectory(String vendorDirectory) {
        this.vendorDirectory = vendorDirectory;
    }

    public String getCloneDirectory() {
        return cloneDirectory;
    }

    public void setCloneDirectory(String cloneDirectory) {
        this.cloneDirectory = cloneDirectory;
    }

    public String getSaltRoot() {
        return saltRoot;
    }

    public void setSaltRoot(String saltRoot) {
        this.saltRoot = saltRoot;
    }

    public boolean isIgnoreLocalRequirements() {
        return ignoreLocalRequirements;
    }

    public void setIgnoreLocalRequirements(boolean ignoreLocalRequirements) {
        this.ignoreLocalRequirements = ignoreLocalRequirements;
    }

    public boolean isIgnoreDependencyRequirements() {
        return ignoreDependencyRequirements;
    }

    public void setIgnoreDependencyRequirements(boolean ignoreDependencyRequirements) {
        this.ignoreDependencyRequirements = ignoreDependencyRequirements;
    }

    public boolean isSimulate() {
        return simulate;
    }

    public void setSimulate(boolean simulate) {
        this.simulate = simulate;
    }

    public boolean isRemoveOrphans() {
        return removeOrphans;
    }

    public void setRemoveOrphans(boolean removeOrphans) {
        this.removeOrphans = removeOrphans;
    }

    public String getGithubToken() {
        return githubToken;
    }

    public void setGithubToken(String githubToken) {
        this.githubToken = githubToken;
    }

    public String getServerId() {
        return serverId;
    }

    public void setServerId(String serverId) {
        this.serverId = serverId;
    }

    public boolean isValidateTokenOnline() {
        return validateTokenOnline;
    }

    public void setValidateTokenOnline(boolean validateTokenOnline) {
        this.validateTokenOnline = validateTokenOnline;
    }

    public String getGithubApiUrl() {
        return githubApiUrl;
    }

    public void setGithubApiUrl(String githubApiUrl) {
        this.githubApiUrl = githubApiUrl != null ? githubApiUrl : DEFAULT_GITHUB_API_URL;
    }

    public String getGithubRawUrl() {
        return githubRawUrl;
    }

    public void setGithubRawUrl(String githubRawUrl) {
        this.githubRawUrl = githubRawUrl != null ? githubRawUrl : DEFAULT_GITHUB_RAW_URL;
    }

    public String getGitHost() {
        return gitHost;
    }

    public void setGitHost(String gitHost) {
        this.gitHost = gitHost;
    }

    public int getMaxTagCount() {
        return maxTagCount;
    }

    public void setMaxTagCount(int maxTagCount) {
        this.maxTagCount = maxTagCount;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = retryAttempts;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public void setRetryBackoffMs(long retryBackoffMs) {
        this.retryBackoffMs = retryBackoffMs;
    }

    public boolean isFailOnError() {
        return failOnError;
    }

    public void setFailOnError(boolean failOnError) {
        this.failOnError = failOnError;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ShakerConfiguration that = (ShakerConfiguration) o;
        return ignoreLocalRequirements == that.ignoreLocalRequirements &&
                ignoreDependencyRequirements == that.ignoreDependencyRequirements &&
                simulate == that.simulate &&
                removeOrphans == that.removeOrphans &&
                validateTokenOnline == that.validateTokenOnline &&
                maxTagCount == that.maxTagCount &&
                retryAttempts == that.retryAttempts &&
                retryBackoffMs == that.retryBackoffMs &&
                failOnError == that.failOnError &&
                Objects.equals(rootDirectory, that.rootDirectory) &&
                Objects.equals(metadataFilename, that.metadataFilename) &&
                Objects.equals(requirementsFilename, that.requirementsFilename) &&
                Objects.equals(vendorDirectory, that.vendorDirectory) &&
                Objects.equals(cloneDirectory, that.cloneDirectory) &&
                Objects.equals(saltRoot, that.saltRoot) &&
                Objects.equals(serverId, that.serverId) &&
                Objects.equals(githubApiUrl, that.githubApiUrl) &&
                Objects.equals(githubRawUrl, that.githubRawUrl) &&
                Objects.equals(gitHost, that.gitHost);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootDirectory, metadataFilename, requirementsFilename, vendorDirectory,
                cloneDirectory, saltRoot, ignoreLocalRequirements, ignoreDependencyRequirements, simulate,
                removeOrphans, serverId, validateTokenOnline, githubApiUrl, githubRawUrl, gitHost,
                maxTagCount, retryAttempts, retryBackoffMs, failOnError);
    }

    @Override
    public String toString() {
        return "ShakerConfiguration{" +
                "rootDirectory=" + rootDirectory +
                ", metadataFilename='" + metadataFilename + '\'' +
                ", requirementsFilename='" + requirementsFilename + '\'' +
                ", clonePath=" + (rootDirectory != null ? getClonePath() : null) +
                ", saltRootPath=" + (rootDirectory != null ? getSaltRootPath() : null) +
                ", ignoreLocalRequirements=" + ignoreLocalRequirements +
                ", ignoreDependencyRequirements=" + ignoreDependencyRequirements +
                ", simulate=" + simulate +
                ", githubToken='" + (githubToken != null ? "***" : "null") + '\'' +
                ", githubApiUrl='" + githubApiUrl + '\'' +
                ", maxTagCount=" + maxTagCount +
                ", failOnError=" + failOnError +
                '}';
    }

    /**
     * Builder for ShakerConfiguration.
     */
    public static class Builder {
        private final ShakerConfiguration config = new ShakerConfiguration();

        public Builder rootDirectory(File rootDirectory) {
            config.setRootDirectory(rootDirectory);
            return this;
        }

        public Builder metadataFilename(String metadataFilename) {
            config.setMetadataFilename(metadataFilename);
            return this;
        }

        public Builder requirementsFilename(String requirementsFilename) {
            config.setRequirementsFilename(requirementsFilename);
            return this;
        }

        public Builder vendorDirectory(String vendorDirectory) {
            config.setVendorDirectory(vendorDirectory);
            return this;
        }

        public Builder cloneDirectory(String cloneDirectory) {
            config.setCloneDirectory(cloneDirectory);
            return this;
        }

        public Builder saltRoot(String saltRoot) {
            config.setSaltRoot(saltRoot);
            return this;
        }

        public Builder ignoreLocalRequirements(boolean ignoreLocalRequirements) {
            config.setIgnoreLocalRequirements(ignoreLocalRequirements);
            return this;
        }

        public Builder ignoreDependencyRequirements(boolean ignoreDependencyRequirements) {
            config.setIgnoreDependencyRequirements(ignoreDependencyRequirements);
            return this;
        }

        public Builder simulate(boolean simulate) {
            config.setSimulate(simulate);
            return this;
        }

        public Builder removeOrphans(boolean removeOrphans) {
            config.setRemoveOrphans(removeOrphans);
            return this;
        }

        public Builder githubToken(String githubToken) {
            config.setGithubToken(githubToken);
            return this;
        }

        public Builder serverId(String serverId) {
            config.setServerId(serverId);
            return this;
        }

        public Builder validateTokenOnline(boolean validateTokenOnline) {
            config.setValidateTokenOnline(validateTokenOnline);
            return this;
        }

        public Builder githubApiUrl(String githubApiUrl) {
            config.setGithubApiUrl(githubApiUrl);
            return this;
        }

        public Builder githubRawUrl(String githubRawUrl) {
            config.setGithubRawUrl(githubRawUrl);
            return this;
        }

        public Builder gitHost(String gitHost) {
            config.setGitHost(gitHost);
            return this;
        }

        public Builder maxTagCount(int maxTagCount) {
            config.setMaxTagCount(maxTagCount);
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            config.setRetryAttempts(retryAttempts);
            return this;
        }

        public Builder retryBackoffMs(long retryBackoffMs) {
            config.setRetryBackoffMs(retryBackoffMs);
            return this;
        }

        public Builder failOnError(boolean failOnError) {
            config.setFailOnError(failOnError);
            return this;
        }

        public ShakerConfiguration build() {
            return config;
        }
    }
}
