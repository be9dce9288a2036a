package com.grcplatform.security.token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClaimSet")
class ClaimSetTest {

    private static ClaimSet withClaims(Map<String, Object> claims) {
        return new ClaimSet("sub-1", "iss", List.of("aud"), null, null, null, claims);
    }

    @Nested
    @DisplayName("email()")
    class Email {

        @Test
        @DisplayName("prefers the email claim")
        void prefersEmail() {
            var claims = withClaims(Map.of("email", "a@x.io", "emails", List.of("b@x.io")));
            assertThat(claims.email()).contains("a@x.io");
        }

        @Test
        @DisplayName("falls back to the first of emails, then preferred_username")
        void fallbacks() {
            assertThat(withClaims(Map.of("emails", List.of("b@x.io", "c@x.io"))).email()).contains("b@x.io");
            assertThat(withClaims(Map.of("preferred_username", "d@x.io")).email()).contains("d@x.io");
            assertThat(withClaims(Map.of()).email()).isEmpty();
        }
    }

    @Test
    @DisplayName("displayName() joins given and family name when name is absent")
    void displayName() {
        assertThat(withClaims(Map.of("name", "Ada Lovelace")).displayName()).contains("Ada Lovelace");
        assertThat(withClaims(Map.of("given_name", "Ada", "family_name", "Lovelace")).displayName())
                .contains("Ada Lovelace");
        assertThat(withClaims(Map.of("given_name", "Ada")).displayName()).contains("Ada");
        assertThat(withClaims(Map.of()).displayName()).isEmpty();
    }

    @Test
    @DisplayName("objectId() prefers oid over sub")
    void objectId() {
        assertThat(withClaims(Map.of("oid", "oid-9")).objectId()).isEqualTo("oid-9");
        assertThat(withClaims(Map.of()).objectId()).isEqualTo("sub-1");
    }
}
