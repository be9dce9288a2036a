package com.grcplatform.security.tenant;

import java.util.Optional;

public enum SubscriptionTier {

    STARTER("starter"),
    PROFESSIONAL("professional"),
    ENTERPRISE("enterprise");

    private final String value;

    SubscriptionTier(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<SubscriptionTier> fromString(String value) {
        for (SubscriptionTier tier : values()) {
            if (tier.value.equalsIgnoreCase(value)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
