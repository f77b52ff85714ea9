package com.factmarrow.exception;

/**
 * A configuration resource required at startup does not exist.
 */
public class ConfigMissingException extends FactMarrowException {

    public ConfigMissingException(String location) {
        super("Config file not found: " + location);
    }
}
