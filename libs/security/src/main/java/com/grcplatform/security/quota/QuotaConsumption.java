package com.grcplatform.security.quota;

/**
 * Outcome of an atomic check-and-increment.
 *
 * @param granted true if the amount was charged
 * @param usage   usage after the call (unchanged when not granted)
 */
public record QuotaConsumption(boolean granted, long usage) {
}
