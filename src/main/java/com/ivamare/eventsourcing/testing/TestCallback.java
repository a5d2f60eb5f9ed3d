package com.ivamare.eventsourcing.testing;

/**
 * Free-form step body with access to the bench.
 */
@FunctionalInterface
public interface TestCallback {

    void accept(EventSourcingTestBench bench) throws Exception;
}
