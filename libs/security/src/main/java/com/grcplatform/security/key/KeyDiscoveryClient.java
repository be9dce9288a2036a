package com.grcplatform.security.key;

import java.security.PublicKey;
import java.util.Map;

/**
 * Fetches the identity provider's currently published signing keys.
 */
public interface KeyDiscoveryClient {

    /**
     * @return every published key by key id; may be empty
     * @throws DiscoveryUnavailableException if the endpoint cannot be read
     */
    Map<String, PublicKey> fetchKeys();
}
