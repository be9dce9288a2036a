package com.grcplatform.auditmodel;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Hash chain over audit events.
 * <p>
 * Each appended record stores the hash of its predecessor, so removing, reordering or editing a
 * record breaks every hash after it. {@link #verify(List)} recomputes the chain.
 * <p>
 * Instances are thread-safe; {@link #append(AuditEvent)} is serialized.
 */
public final class AuditChain {

    /** Previous-hash value of the first record in a chain. */
    public static final String GENESIS_HASH = "0".repeat(64);

    private static final HexFormat HEX = HexFormat.of();

    private long sequence;
    private String lastHash = GENESIS_HASH;

    /**
     * Links an event onto the end of the chain.
     */
    public synchronized ChainedAuditRecord append(AuditEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        String hash = hash(lastHash, event);
        ChainedAuditRecord record = new ChainedAuditRecord(++sequence, event, lastHash, hash);
        lastHash = hash;
        return record;
    }

    /** Hash of the most recently appended record. */
    public synchronized String head() {
        return lastHash;
    }

    /** Number of records appended so far. */
    public synchronized long size() {
        return sequence;
    }

    /**
     * Verifies an ordered list of records produced by a single chain.
     *
     * @return ok if every link and hash matches, otherwise the first break found
     */
    public static ValidationResult verify(List<ChainedAuditRecord> records) {
        String expectedPrevious = GENESIS_HASH;
        long expectedSequence = 1;
        List<String> errors = new ArrayList<>();
        for (ChainedAuditRecord record : records) {
            if (record.sequence() != expectedSequence) {
                errors.add("record " + expectedSequence + ": unexpected sequence " + record.sequence());
                break;
            }
            if (!expectedPrevious.equals(record.previousHash())) {
                errors.add("record " + record.sequence() + ": previous hash does not match");
                break;
            }
            if (!hash(record.previousHash(), record.event()).equals(record.hash())) {
                errors.add("record " + record.sequence() + ": content hash does not match");
                break;
            }
            expectedPrevious = record.hash();
            expectedSequence++;
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    static String hash(String previousHash, AuditEvent event) {
        MessageDigest digest = sha256();
        digest.update(previousHash.getBytes(StandardCharsets.UTF_8));
        digest.update(AuditEventSerializer.serialize(event).getBytes(StandardCharsets.UTF_8));
        return HEX.formatHex(digest.digest());
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
