package com.grcplatform.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SensitiveDataRedactor}: top-level and nested redaction, case insensitivity
 * and custom patterns.
 */
@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Nested
    @DisplayName("Default patterns")
    class DefaultPatterns {

        @Test
        @DisplayName("redacts credential-like fields and keeps the rest")
        void redactsCredentials() {
            Map<String, Object> data = Map.of(
                    "name", "openai-prod",
                    "apiKey", "sk-live-123",
                    "client_secret", "s3cr3t");

            var result = redactor.redact(data);

            assertThat(result.get("name")).isEqualTo("openai-prod");
            assertThat(result.get("apiKey")).isEqualTo(SensitiveDataRedactor.REDACTED);
            assertThat(result.get("client_secret")).isEqualTo(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("matches key names case-insensitively")
        void caseInsensitive() {
            assertThat(redactor.isSensitive("AUTHORIZATION")).isTrue();
            assertThat(redactor.isSensitive("refreshToken")).isTrue();
            assertThat(redactor.isSensitive("tenant_id")).isFalse();
            assertThat(redactor.isSensitive(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Nested structures")
    class NestedStructures {

        @Test
        @DisplayName("redacts inside nested maps")
        void nestedMaps() {
            Map<String, Object> data = Map.of(
                    "connection", Map.of("host", "archer.local", "password", "pw"));

            var result = redactor.redact(data);

            @SuppressWarnings("unchecked")
            var connection = (Map<String, Object>) result.get("connection");
            assertThat(connection.get("host")).isEqualTo("archer.local");
            assertThat(connection.get("password")).isEqualTo(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("redacts maps inside lists")
        void mapsInsideLists() {
            Map<String, Object> data = Map.of(
                    "configs", List.of(Map.of("provider", "azure", "apiKey", "k1")));

            var result = redactor.redact(data);

            @SuppressWarnings("unchecked")
            var configs = (List<Map<String, Object>>) result.get("configs");
            assertThat(configs.get(0).get("provider")).isEqualTo("azure");
            assertThat(configs.get(0).get("apiKey")).isEqualTo(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("does not modify the input")
        void inputUntouched() {
            var inner = new java.util.HashMap<String, Object>();
            inner.put("token", "abc");
            Map<String, Object> data = Map.of("inner", inner);

            redactor.redact(data);

            assertThat(inner.get("token")).isEqualTo("abc");
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("null input returns empty map")
        void nullInput() {
            assertThat(redactor.redact(null)).isEmpty();
        }

        @Test
        @DisplayName("custom patterns replace the defaults")
        void customPatterns() {
            var custom = new SensitiveDataRedactor(Set.of("ssn"));

            var result = custom.redact(Map.of("ssn", "123-45-6789", "password", "visible"));

            assertThat(result.get("ssn")).isEqualTo(SensitiveDataRedactor.REDACTED);
            assertThat(result.get("password")).isEqualTo("visible");
        }

        @Test
        @DisplayName("rejects an empty pattern set")
        void rejectsEmptyPatterns() {
            assertThatThrownBy(() -> new SensitiveDataRedactor(Set.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
