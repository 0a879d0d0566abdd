package com.soletracker.scraper;

import java.time.Duration;

/**
 * Static retrieval collaborator: performs exactly one HTTP exchange, no retries, no pacing.
 */
public interface PageTransport {

    /**
     * Issues one request.
     * @param method HTTP method
     * @param url absolute URL
     * @param timeout request timeout
     * @return response of any status; only network failures raise
     * @throws TransportException on connection or timeout failures
     * @throws InterruptedException if the calling thread is interrupted
     */
    TransportResponse send(String method, String url, Duration timeout) throws TransportException, InterruptedException;
}
