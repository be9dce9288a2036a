package com.grcplatform.security.quota;

import com.grcplatform.security.tenant.TenantQuota;

import java.util.Optional;

/**
 * Metered resources and the window each is counted over.
 */
public enum QuotaType {

    API_CALLS("api_calls", QuotaWindow.DAILY, "Daily API call quota exceeded"),
    TOKENS("tokens", QuotaWindow.MONTHLY, "Monthly token quota exceeded"),
    STORAGE("storage", QuotaWindow.NONE, "Storage quota exceeded");

    private final String value;
    private final QuotaWindow window;
    private final String exceededMessage;

    QuotaType(String value, QuotaWindow window, String exceededMessage) {
        this.value = value;
        this.window = window;
        this.exceededMessage = exceededMessage;
    }

    public String value() {
        return value;
    }

    public QuotaWindow window() {
        return window;
    }

    public String exceededMessage() {
        return exceededMessage;
    }

    /** The tenant's limit for this resource. */
    public long limitOf(TenantQuota quota) {
        return switch (this) {
            case API_CALLS -> quota.dailyApiCalls();
            case TOKENS -> quota.monthlyTokens();
            case STORAGE -> quota.storageGb();
        };
    }

    public static Optional<QuotaType> fromString(String value) {
        for (QuotaType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
