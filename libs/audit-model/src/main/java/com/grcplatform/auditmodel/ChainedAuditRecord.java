package com.grcplatform.auditmodel;

/**
 * An audit event linked into the tamper-evident trail.
 *
 * @param sequence     position in the chain, starting at 1
 * @param event        the recorded event
 * @param previousHash hash of the preceding record, or {@link AuditChain#GENESIS_HASH} for the first
 * @param hash         SHA-256 over {@code previousHash} and the canonical JSON of {@code event}
 */
public record ChainedAuditRecord(long sequence, AuditEvent event, String previousHash, String hash) {

    public ChainedAuditRecord {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1");
        }
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
    }
}
