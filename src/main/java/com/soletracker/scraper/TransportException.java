package com.soletracker.scraper;

import java.io.IOException;

/**
 * Network-level failure (connection refused, timeout, render timeout) raised by a transport.
 */
public class TransportException extends IOException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
