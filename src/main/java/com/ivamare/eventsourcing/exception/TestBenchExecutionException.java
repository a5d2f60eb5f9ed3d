package com.ivamare.eventsourcing.exception;

/**
 * Carries a checked exception thrown by a task out of a blocking test bench run.
 */
public class TestBenchExecutionException extends TestBenchException {

    public TestBenchExecutionException(Throwable cause) {
        super(cause.getMessage(), cause);
    }
}
