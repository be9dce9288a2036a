package com.grcplatform.api;

import com.grcplatform.security.key.KeyResolver;
import com.grcplatform.security.testing.TestTokens;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Replaces key discovery with an in-process signing key.
 */
@TestConfiguration
public class TestKeysConfig {

    public static final TestTokens TOKENS = TestTokens.generate("grc-api-test-key");

    @Bean
    @Primary
    public KeyResolver testKeyResolver() {
        return TOKENS.keyResolver();
    }
}
