package com.fundflow.common.exception;

/**
 * Raised when raw market data is malformed or empty. Analysis fails fast and
 * produces no partial result.
 */
public class InvalidInputException extends RuntimeException {
    private final String component;

    public InvalidInputException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
