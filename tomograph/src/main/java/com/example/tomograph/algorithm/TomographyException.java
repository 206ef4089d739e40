package com.example.tomograph.algorithm;

/**
 * Base type for the recoverable errors raised by the projection engine.
 */
public abstract class TomographyException extends IllegalArgumentException {

    protected TomographyException(String message) {
        super(message);
    }

    public abstract String kind();
}
