package com.soletracker.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * {@link PageTransport} backed by {@code java.net.http.HttpClient}.
 * <p>
 * Sends browser-like Accept headers and the configured crawler User-Agent, follows redirects,
 * and returns every HTTP status to the caller; only connection and timeout failures raise.
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class HttpPageTransport implements PageTransport {
    private static final Logger logger = LoggerFactory.getLogger(HttpPageTransport.class);

    private final HttpClient client;
    private final String userAgent;

    public HttpPageTransport(String userAgent) {
        this(HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(15))
            .build(), userAgent);
    }

    public HttpPageTransport(HttpClient client, String userAgent) {
        this.client = client;
        this.userAgent = userAgent == null || userAgent.isBlank() ? PipelineConfig.DEFAULT_USER_AGENT : userAgent;
    }

    @Override
    public TransportResponse send(String method, String url, Duration timeout) throws TransportException, InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml,application/json;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid request URL '" + url + "': " + e.getMessage(), e);
        }
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            logger.debug("{} {} -> {}", method, url, response.statusCode());
            return new TransportResponse(response.statusCode(), response.body(), response.headers().map());
        } catch (HttpTimeoutException e) {
            throw new TransportException("Timed out after " + timeout.toMillis() + "ms fetching " + url, e);
        } catch (IOException e) {
            throw new TransportException("I/O error fetching " + url + ": " + e.getMessage(), e);
        }
    }
}
