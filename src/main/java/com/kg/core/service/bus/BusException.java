package com.kg.core.service.bus;

/**
 * Exception thrown when the event bus cannot deliver or accept events.
 */
public class BusException extends RuntimeException {

    public BusException(String message) {
        super(message);
    }

    public BusException(String message, Throwable cause) {
        super(message, cause);
    }
}
