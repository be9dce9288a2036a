package com.grcplatform.security.tenant;

/**
 * Local user account linked to an identity provider subject.
 *
 * @param userId          local account id
 * @param providerSubject subject (object id) issued by the identity provider
 * @param email           primary email
 * @param name            display name
 * @param primaryTenantId the user's home tenant, may be null
 */
public record UserAccount(
        String userId,
        String providerSubject,
        String email,
        String name,
        String primaryTenantId) {

    public UserAccount {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
    }
}
