package com.factmarrow.exception;

/**
 * A configuration resource exists but does not have the expected shape.
 */
public class ConfigInvalidException extends FactMarrowException {

    public ConfigInvalidException(String message) {
        super(message);
    }

    public ConfigInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
