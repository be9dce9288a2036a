package com.grcplatform.auditmodel;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AuditChain")
class AuditChainTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC);

    private static AuditEvent event(String userId) {
        return AuditEventFactory.create(AuditEventType.AUTHORIZATION_FAILURE, userId, "t-1",
                Map.of("requiredRoles", List.of("TenantAdmin")), null, CLOCK);
    }

    private static List<ChainedAuditRecord> chainOf(int n) {
        AuditChain chain = new AuditChain();
        List<ChainedAuditRecord> records = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            records.add(chain.append(event("u-" + i)));
        }
        return records;
    }

    @Test
    @DisplayName("first record links to the genesis hash")
    void firstRecordLinksGenesis() {
        ChainedAuditRecord first = chainOf(1).get(0);

        assertThat(first.sequence()).isEqualTo(1);
        assertThat(first.previousHash()).isEqualTo(AuditChain.GENESIS_HASH);
        assertThat(first.hash()).hasSize(64).isNotEqualTo(AuditChain.GENESIS_HASH);
    }

    @Test
    @DisplayName("each record links to its predecessor and head tracks the last hash")
    void recordsAreLinked() {
        AuditChain chain = new AuditChain();
        ChainedAuditRecord a = chain.append(event("a"));
        ChainedAuditRecord b = chain.append(event("b"));

        assertThat(b.previousHash()).isEqualTo(a.hash());
        assertThat(chain.head()).isEqualTo(b.hash());
        assertThat(chain.size()).isEqualTo(2);
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        @DisplayName("accepts an untouched chain")
        void acceptsIntactChain() {
            assertThat(AuditChain.verify(chainOf(5)).valid()).isTrue();
        }

        @Test
        @DisplayName("accepts an empty chain")
        void acceptsEmpty() {
            assertThat(AuditChain.verify(List.of()).valid()).isTrue();
        }

        @Test
        @DisplayName("detects an edited event")
        void detectsEdit() {
            List<ChainedAuditRecord> records = new ArrayList<>(chainOf(3));
            ChainedAuditRecord original = records.get(1);
            records.set(1, new ChainedAuditRecord(original.sequence(), event("mallory"),
                    original.previousHash(), original.hash()));

            var result = AuditChain.verify(records);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).anyMatch(e -> e.contains("record 2"));
        }

        @Test
        @DisplayName("detects a removed record")
        void detectsRemoval() {
            List<ChainedAuditRecord> records = new ArrayList<>(chainOf(3));
            records.remove(1);

            assertThat(AuditChain.verify(records).valid()).isFalse();
        }

        @Test
        @DisplayName("detects reordering")
        void detectsReorder() {
            List<ChainedAuditRecord> records = new ArrayList<>(chainOf(3));
            Collections.swap(records, 0, 2);

            assertThat(AuditChain.verify(records).valid()).isFalse();
        }
    }
}
