package com.soletracker.scraper;

/**
 * How a page is retrieved: a plain HTTP request or a headless-browser render.
 */
public enum FetchMode {
    STATIC,
    RENDERED
}
