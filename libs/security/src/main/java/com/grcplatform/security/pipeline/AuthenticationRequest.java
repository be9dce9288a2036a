package com.grcplatform.security.pipeline;

/**
 * The request headers the authentication pipeline reads.
 *
 * @param authorizationHeader raw {@code Authorization} header, may be null
 * @param tenantHeader        raw {@code X-Tenant-ID} header, may be null
 */
public record AuthenticationRequest(String authorizationHeader, String tenantHeader) {
}
