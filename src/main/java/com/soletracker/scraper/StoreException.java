package com.soletracker.scraper;

/**
 * Failure of a storage collaborator, classified so callers can tell an authorization problem
 * (switch to the fallback path) from a missing target or an ordinary write error.
 */
public class StoreException extends Exception {
    private final ErrorKind kind;

    public StoreException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind == null ? ErrorKind.PERSISTENCE_ERROR : kind;
    }

    public StoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? ErrorKind.PERSISTENCE_ERROR : kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
