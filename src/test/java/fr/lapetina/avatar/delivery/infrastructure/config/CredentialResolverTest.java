package fr.lapetina.avatar.delivery.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialResolverTest {

    private final CredentialResolver resolver = CredentialResolver.fromMap(Map.of(
            "DUIX_API_KEY", "duix-secret",
            "EMPTY_KEY", "  "
    ));

    @Test
    @DisplayName("should read env references from the environment")
    void shouldReadEnvReference() {
        assertThat(resolver.resolve("env:DUIX_API_KEY")).isEqualTo("duix-secret");
    }

    @Test
    @DisplayName("should treat unset or blank variables as no credential")
    void shouldTreatMissingAsNull() {
        assertThat(resolver.resolve("env:MISSING")).isNull();
        assertThat(resolver.resolve("env:EMPTY_KEY")).isNull();
    }

    @Test
    @DisplayName("should use other values literally and ignore blanks")
    void shouldUseLiteralValues() {
        assertThat(resolver.resolve("inline-token")).isEqualTo("inline-token");
        assertThat(resolver.resolve(null)).isNull();
        assertThat(resolver.resolve("")).isNull();
    }
}
