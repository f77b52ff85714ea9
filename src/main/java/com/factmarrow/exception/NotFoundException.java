package com.factmarrow.exception;

/**
 * A named agent or executor is not registered.
 */
public class NotFoundException extends FactMarrowException {

    public NotFoundException(String kind, String name) {
        super(kind + " not found: " + name);
    }
}
