package com.ivamare.eventsourcing.testing;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DeferredRunTest {

    private final AtomicInteger starts = new AtomicInteger();

    @Nested
    class NotArmed {

        @Test
        void shouldCompleteImmediately() {
            DeferredRun run = new DeferredRun(() -> false);

            CompletableFuture<Void> result = run.await(() -> {
                starts.incrementAndGet();
                return CompletableFuture.completedFuture(null);
            });

            assertThat(result).isCompleted();
            assertThat(starts).hasValue(0);
        }

        @Test
        void shouldStartWhenWorkIsPending() {
            DeferredRun run = new DeferredRun(() -> true);

            run.await(() -> {
                starts.incrementAndGet();
                return CompletableFuture.completedFuture(null);
            });

            assertThat(starts).hasValue(1);
        }
    }

    @Nested
    class Armed {

        @Test
        void shouldStartChainOnceAndDisarm() {
            DeferredRun run = new DeferredRun(() -> false);
            run.arm();

            run.await(() -> {
                starts.incrementAndGet();
                return CompletableFuture.completedFuture(null);
            });
            CompletableFuture<Void> again = run.await(() -> {
                starts.incrementAndGet();
                return CompletableFuture.completedFuture(null);
            });

            assertThat(starts).hasValue(1);
            assertThat(again).isCompleted();
            assertThat(run.isArmed()).isFalse();
        }

        @Test
        void shouldShareChainInFlight() {
            DeferredRun run = new DeferredRun(() -> false);
            run.arm();
            CompletableFuture<Void> chain = new CompletableFuture<>();

            CompletableFuture<Void> first = run.await(() -> {
                starts.incrementAndGet();
                return chain;
            });
            CompletableFuture<Void> second = run.await(() -> {
                starts.incrementAndGet();
                return chain;
            });

            assertThat(second).isSameAs(first);
            assertThat(run.isRunning()).isTrue();
            chain.complete(null);
            assertThat(first).isCompleted();
            assertThat(run.isRunning()).isFalse();
            assertThat(starts).hasValue(1);
        }

        @Test
        void shouldFailWithOriginalError() {
            DeferredRun run = new DeferredRun(() -> false);
            run.arm();
            IllegalStateException boom = new IllegalStateException("boom");

            CompletableFuture<Void> result = run.await(() -> CompletableFuture.failedFuture(boom));

            ExecutionException failure = assertThrows(ExecutionException.class, result::get);
            assertThat(failure.getCause()).isSameAs(boom);
            assertThat(run.isArmed()).isFalse();
        }
    }
}
