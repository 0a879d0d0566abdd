package com.soletracker.scraper;

import java.time.Duration;

/**
 * Headless-render collaborator: returns the rendered HTML of a page after it settled.
 */
public interface RenderTransport {

    /**
     * Renders one page.
     * @param url absolute URL
     * @param waitSelector selector to await before extraction, or null to use the settle wait
     * @param timeout navigation timeout
     * @param scrollCycles number of scroll-and-wait cycles used to trigger lazy-loaded content
     * @return navigation status with the rendered document HTML as body
     * @throws TransportException when navigation or the selector wait times out
     */
    TransportResponse render(String url, String waitSelector, Duration timeout, int scrollCycles) throws TransportException;
}
