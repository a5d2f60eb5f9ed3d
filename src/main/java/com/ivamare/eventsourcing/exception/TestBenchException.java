package com.ivamare.eventsourcing.exception;

/**
 * Thrown for invalid test bench configuration or misuse, such as an unparsable time.
 */
public class TestBenchException extends EventSourcingException {

    public TestBenchException(String message) {
        super(message);
    }

    public TestBenchException(String message, Throwable cause) {
        super(message, cause);
    }
}
