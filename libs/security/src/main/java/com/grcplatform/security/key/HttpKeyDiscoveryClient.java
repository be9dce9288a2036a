package com.grcplatform.security.key;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.util.DefaultResourceRetriever;
import com.nimbusds.jose.util.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.security.PublicKey;
import java.text.ParseException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a JSON Web Key Set over HTTPS.
 * <p>
 * Only signature keys with a key id are returned; encryption keys and keys of unsupported types
 * are skipped.
 */
public class HttpKeyDiscoveryClient implements KeyDiscoveryClient {

    private static final Logger log = LoggerFactory.getLogger(HttpKeyDiscoveryClient.class);

    /** Upper bound on the size of a key set document. */
    public static final int MAX_RESPONSE_BYTES = 256 * 1024;

    private final URL jwksUri;
    private final DefaultResourceRetriever retriever;

    public HttpKeyDiscoveryClient(URL jwksUri, Duration connectTimeout, Duration readTimeout) {
        if (jwksUri == null) {
            throw new IllegalArgumentException("jwksUri must not be null");
        }
        this.jwksUri = jwksUri;
        this.retriever = new DefaultResourceRetriever(
                (int) connectTimeout.toMillis(), (int) readTimeout.toMillis(), MAX_RESPONSE_BYTES);
    }

    @Override
    public Map<String, PublicKey> fetchKeys() {
        Resource resource;
        try {
            resource = retriever.retrieveResource(jwksUri);
        } catch (IOException e) {
            throw new DiscoveryUnavailableException("Failed to fetch key set from " + jwksUri, e);
        }

        JWKSet set;
        try {
            set = JWKSet.parse(resource.getContent());
        } catch (ParseException e) {
            throw new DiscoveryUnavailableException("Key set from " + jwksUri + " is not valid JWKS", e);
        }

        Map<String, PublicKey> keys = new LinkedHashMap<>();
        for (JWK jwk : set.getKeys()) {
            if (jwk.getKeyID() == null || KeyUse.ENCRYPTION.equals(jwk.getKeyUse())) {
                continue;
            }
            try {
                if (jwk instanceof RSAKey rsa) {
                    keys.put(jwk.getKeyID(), rsa.toRSAPublicKey());
                } else if (jwk instanceof ECKey ec) {
                    keys.put(jwk.getKeyID(), ec.toECPublicKey());
                }
            } catch (JOSEException e) {
                log.warn("Skipping unusable key kid={} from {}: {}", jwk.getKeyID(), jwksUri, e.getMessage());
            }
        }
        log.debug("Fetched {} signing keys from {}", keys.size(), jwksUri);
        return Collections.unmodifiableMap(keys);
    }
}
