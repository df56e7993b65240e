package org.example.shaker.model;

import org.example.shaker.exception.ConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PackageKey.
 */
class PackageKeyTest {

    @Test
    @DisplayName("should parse organisation and name")
    void shouldParse() throws ConfigException {
        PackageKey key = PackageKey.parse("test_organisation/testa-formula");

        assertThat(key.getOrganisation()).isEqualTo("test_organisation");
        assertThat(key.getName()).isEqualTo("testa-formula");
        assertThat(key).hasToString("test_organisation/testa-formula");
    }

    @ParameterizedTest
    @ValueSource(strings = {"no-slash", "a/b/c", "/name", "org/", ""})
    @DisplayName("should reject identifiers without exactly one separator")
    void shouldRejectMalformedIdentifier(String value) {
        assertThatThrownBy(() -> PackageKey.parse(value))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    @DisplayName("should compare case-sensitively")
    void shouldCompareCaseSensitively() {
        assertThat(new PackageKey("org", "a-formula")).isEqualTo(new PackageKey("org", "a-formula"));
        assertThat(new PackageKey("org", "a-formula")).isNotEqualTo(new PackageKey("Org", "a-formula"));
        assertThat(new PackageKey("org", "a-formula").hashCode())
                .isEqualTo(new PackageKey("org", "a-formula").hashCode());
    }
}
