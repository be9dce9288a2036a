package com.grcplatform.security.token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BearerTokenExtractor")
class BearerTokenExtractorTest {

    @Test
    @DisplayName("extracts the token after the scheme")
    void extracts() {
        assertThat(BearerTokenExtractor.extract("Bearer abc.def.ghi")).contains("abc.def.ghi");
    }

    @Test
    @DisplayName("scheme is case-insensitive and surrounding whitespace is ignored")
    void caseInsensitive() {
        assertThat(BearerTokenExtractor.extract("  bearer   abc.def.ghi  ")).contains("abc.def.ghi");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "Bearer", "Bearer   ", "Basic dXNlcjpwYXNz", "Bearerabc.def", "Bearer a b"})
    @DisplayName("rejects missing or malformed headers")
    void rejects(String header) {
        assertThat(BearerTokenExtractor.extract(header)).isEmpty();
    }
}
