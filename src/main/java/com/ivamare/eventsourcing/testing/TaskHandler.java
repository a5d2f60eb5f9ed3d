package com.ivamare.eventsourcing.testing;

import java.util.concurrent.CompletableFuture;

/**
 * Runs one task on behalf of the test bench.
 */
@FunctionalInterface
public interface TaskHandler {

    CompletableFuture<Void> handle(TestTask task);
}
