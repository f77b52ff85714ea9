package com.factmarrow.exception;

/**
 * Base class of the errors raised by the analysis subsystem.
 */
public class FactMarrowException extends RuntimeException {

    public FactMarrowException(String message) {
        super(message);
    }

    public FactMarrowException(String message, Throwable cause) {
        super(message, cause);
    }
}
