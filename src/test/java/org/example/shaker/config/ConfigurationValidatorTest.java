package org.example.shaker.config;

import org.example.shaker.exception.ConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.File;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConfigurationValidator.
 */
class ConfigurationValidatorTest {

    private ConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ConfigurationValidator();
    }

    private ShakerConfiguration validConfig() {
        return ShakerConfiguration.builder()
                .rootDirectory(new File("/srv/formulas/root-formula"))
                .githubToken("token")
                .build();
    }

    @Nested
    @DisplayName("Required Field Validation")
    class RequiredFieldValidation {

        @Test
        @DisplayName("should pass with defaults and a root directory")
        void shouldPassWithDefaults() {
            assertThat(validator.validate(validConfig())).isEmpty();
        }

        @Test
        @DisplayName("should fail when rootDirectory is missing")
        void shouldFailWhenRootDirectoryMissing() {
            ShakerConfiguration config = validConfig();
            config.setRootDirectory(null);

            assertThat(validator.validate(config)).contains("rootDirectory is required");
        }

        @Test
        @DisplayName("should fail when metadataFilename is blank")
        void shouldFailWhenMetadataFilenameBlank() {
            ShakerConfiguration config = validConfig();
            config.setMetadataFilename("  ");

            assertThat(validator.validate(config)).contains("metadataFilename is required");
        }

        @Test
        @DisplayName("should fail when gitHost is missing")
        void shouldFailWhenGitHostMissing() {
            ShakerConfiguration config = validConfig();
            config.setGitHost(null);

            assertThat(validator.validate(config)).contains("gitHost is required");
        }
    }

    @Nested
    @DisplayName("Directory Validation")
    class DirectoryValidation {

        @ParameterizedTest
        @ValueSource(strings = {"vendor/nested", "..\\up", ".", ".."})
        @DisplayName("should reject names that are not a single path element")
        void shouldRejectNonSingleElements(String name) {
            ShakerConfiguration config = validConfig();
            config.setVendorDirectory(name);

            List<String> errors = validator.validate(config);

            assertThat(errors).hasSize(1);
            assertThat(errors.get(0)).startsWith("vendorDirectory must");
        }

        @Test
        @DisplayName("should reject a clone directory equal to the salt root")
        void shouldRejectSharedCloneAndSaltRoot() {
            ShakerConfiguration config = validConfig();
            config.setCloneDirectory("_root");

            assertThat(validator.validate(config))
                    .contains("cloneDirectory and saltRoot must differ, but both were: _root");
        }
    }

    @Nested
    @DisplayName("Remote Validation")
    class RemoteValidation {

        @Test
        @DisplayName("should reject non-http API URLs")
        void shouldRejectNonHttpApiUrl() {
            ShakerConfiguration config = validConfig();
            config.setGithubApiUrl("ftp://api.github.com");

            assertThat(validator.validate(config))
                    .contains("githubApiUrl must start with http:// or https://, but was: ftp://api.github.com");
        }

        @Test
        @DisplayName("should restore the default URL when set to null")
        void shouldDefaultNullUrl() {
            ShakerConfiguration config = validConfig();
            config.setGithubRawUrl(null);

            assertThat(config.getGithubRawUrl()).isEqualTo(ShakerConfiguration.DEFAULT_GITHUB_RAW_URL);
            assertThat(validator.validate(config)).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(strings = {"github.com", "git.example.org", "gitlab.local:2222"})
        @DisplayName("should accept plain host names")
        void shouldAcceptHostNames(String host) {
            ShakerConfiguration config = validConfig();
            config.setGitHost(host);

            assertThat(validator.validate(config)).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(strings = {"git@github.com", "https://github.com", "github.com/org"})
        @DisplayName("should reject host names with user or scheme")
        void shouldRejectHostNames(String host) {
            ShakerConfiguration config = validConfig();
            config.setGitHost(host);

            assertThat(validator.validate(config)).containsExactly("gitHost must be a plain host name, but was: " + host);
        }
    }

    @Nested
    @DisplayName("Numeric Validation")
    class NumericValidation {

        @Test
        @DisplayName("should fail when maxTagCount is zero")
        void shouldFailWhenMaxTagCountZero() {
            ShakerConfiguration config = validConfig();
            config.setMaxTagCount(0);

            assertThat(validator.validate(config)).contains("maxTagCount must be >= 1, but was: 0");
        }

        @Test
        @DisplayName("should fail when retry settings are out of range")
        void shouldFailWhenRetrySettingsInvalid() {
            ShakerConfiguration config = validConfig();
            config.setRetryAttempts(0);
            config.setRetryBackoffMs(-1);

            assertThat(validator.validate(config)).containsExactlyInAnyOrder(
                    "retryAttempts must be >= 1, but was: 0",
                    "retryBackoffMs must be >= 0, but was: -1");
        }
    }

    @Test
    @DisplayName("should throw with every error listed")
    void shouldThrowWithAllErrors() {
        ShakerConfiguration config = validConfig();
        config.setRootDirectory(null);
        config.setMaxTagCount(0);

        assertThatThrownBy(() -> validator.validateOrThrow(config))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("rootDirectory is required")
                .satisfies(e -> assertThat(((ConfigException) e).getValidationErrors()).hasSize(2));
    }

    @Test
    @DisplayName("should derive paths below the root directory")
    void shouldDerivePaths() {
        ShakerConfiguration config = validConfig();

        assertThat(config.getMetadataFile()).isEqualTo(new File("/srv/formulas/root-formula/metadata.yml"));
        assertThat(config.getRequirementsFile())
                .isEqualTo(new File("/srv/formulas/root-formula/formula-requirements.txt"));
        assertThat(config.getClonePath()).isEqualTo(new File("/srv/formulas/root-formula/vendor/formula-repos"));
        assertThat(config.getSaltRootPath()).isEqualTo(new File("/srv/formulas/root-formula/vendor/_root"));
    }

    @Test
    @DisplayName("should mask the token in toString")
    void shouldMaskToken() {
        ShakerConfiguration config = validConfig();
        config.setGithubToken("ghp_supersecret");

        assertThat(config.toString()).doesNotContain("ghp_supersecret");
    }
}
