package com.soletracker.sitesources;

/**
 * A payload, or one item of it, could not be parsed.
 */
public class NormalizationException extends Exception {

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
