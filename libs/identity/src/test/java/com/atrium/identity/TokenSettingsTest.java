package com.atrium.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TokenSettings")
class TokenSettingsTest {

    private static final String SECRET = "test-signing-secret-0123456789-abcdef";

    @Test
    @DisplayName("applies defaults for optional fields")
    void defaults() {
        var settings = new TokenSettings(SECRET, null, null, null, null);

        assertThat(settings.issuer()).isEqualTo("atrium");
        assertThat(settings.accessTtl()).isEqualTo(Duration.ofMinutes(30));
        assertThat(settings.refreshTtl()).isEqualTo(Duration.ofDays(7));
        assertThat(settings.clockSkew()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("rejects short secrets")
    void shortSecret() {
        assertThatThrownBy(() -> new TokenSettings("too-short", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("32 bytes");
    }

    @Test
    @DisplayName("rejects a refresh lifetime not longer than the access lifetime")
    void refreshMustOutliveAccess() {
        assertThatThrownBy(() -> new TokenSettings(SECRET, null, Duration.ofHours(1), Duration.ofMinutes(30), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toString() never prints the secret")
    void hidesSecret() {
        assertThat(new TokenSettings(SECRET, null, null, null, null).toString()).doesNotContain(SECRET);
    }
}
