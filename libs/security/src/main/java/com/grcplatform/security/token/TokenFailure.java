package com.grcplatform.security.token;

/**
 * Why a bearer token was rejected.
 */
public enum TokenFailure {

    MISSING_TOKEN,
    MALFORMED_TOKEN,
    UNSUPPORTED_ALGORITHM,
    UNKNOWN_SIGNING_KEY,
    KEY_DISCOVERY_UNAVAILABLE,
    SIGNATURE_INVALID,
    AUDIENCE_MISMATCH,
    ISSUER_MISMATCH,
    EXPIRED,
    NOT_YET_VALID
}
