package com.grcplatform.security.quota;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;

/**
 * Period over which a usage counter accumulates before resetting.
 */
public enum QuotaWindow {

    /** Resets at midnight in the store's zone. */
    DAILY,
    /** Resets on the first day of each month. */
    MONTHLY,
    /** Never resets. */
    NONE;

    /**
     * Identifies the window containing {@code now}; two instants share a window exactly when
     * their keys are equal.
     */
    public String windowKey(Instant now, ZoneId zone) {
        return switch (this) {
            case DAILY -> LocalDate.ofInstant(now, zone).toString();
            case MONTHLY -> YearMonth.from(now.atZone(zone)).toString();
            case NONE -> "all";
        };
    }
}
