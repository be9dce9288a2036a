package com.grcplatform.security.tenant;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Helpers for tenant identifiers, which are UUID strings in 8-4-4-4-12 hex form.
 */
public final class TenantIds {

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$",
            Pattern.CASE_INSENSITIVE);

    private TenantIds() {
        // utility class
    }

    public static boolean isUuid(String value) {
        return value != null && UUID_PATTERN.matcher(value).matches();
    }

    /** Lower-cases a tenant id so comparisons are case-insensitive. */
    public static String normalize(String tenantId) {
        return tenantId == null ? null : tenantId.strip().toLowerCase(Locale.ROOT);
    }

    public static boolean sameTenant(String a, String b) {
        return a != null && b != null && a.strip().equalsIgnoreCase(b.strip());
    }
}
