package com.grcplatform.security.key;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SingleFlight")
class SingleFlightTest {

    private final SingleFlight<String, String> flight = new SingleFlight<>();

    @Test
    @DisplayName("concurrent callers share one execution")
    void sharesExecution() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<String> work = new CompletableFuture<>();

        List<CompletableFuture<String>> waiters = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            waiters.add(flight.execute("k", () -> {
                calls.incrementAndGet();
                return work;
            }));
        }
        work.complete("v");

        assertThat(calls).hasValue(1);
        for (CompletableFuture<String> waiter : waiters) {
            assertThat(waiter.get()).isEqualTo("v");
        }
        assertThat(flight.inFlightCount()).isZero();
    }

    @Test
    @DisplayName("cancelling one waiter does not cancel the others")
    void cancelIsLocal() throws Exception {
        CompletableFuture<String> work = new CompletableFuture<>();
        CompletableFuture<String> first = flight.execute("k", () -> work);
        CompletableFuture<String> second = flight.execute("k", () -> work);

        first.cancel(true);
        work.complete("v");

        assertThat(work.isCancelled()).isFalse();
        assertThat(second.get()).isEqualTo("v");
    }

    @Test
    @DisplayName("failures reach every waiter and release the key")
    void failurePropagates() {
        CompletableFuture<String> work = new CompletableFuture<>();
        CompletableFuture<String> a = flight.execute("k", () -> work);
        CompletableFuture<String> b = flight.execute("k", () -> work);

        work.completeExceptionally(new KeyNotFoundException("x"));

        assertThatThrownBy(a::get).isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(KeyNotFoundException.class);
        assertThatThrownBy(b::get).isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(KeyNotFoundException.class);
        assertThat(flight.inFlightCount()).isZero();
    }

    @Test
    @DisplayName("a completed execution is not reused")
    void freshAfterCompletion() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        flight.execute("k", () -> CompletableFuture.completedFuture("a" + calls.incrementAndGet())).get();

        String second = flight.execute("k", () -> CompletableFuture.completedFuture("a" + calls.incrementAndGet())).get();

        assertThat(second).isEqualTo("a2");
    }

    @Test
    @DisplayName("a supplier that throws fails the call")
    void supplierThrows() {
        CompletableFuture<String> result = flight.execute("k", () -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(result::get).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(flight.inFlightCount()).isZero();
    }
}
