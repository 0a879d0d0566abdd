package com.soletracker.scraper;

import com.microsoft.playwright.*;
import com.microsoft.playwright.options.LoadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;

/**
 * {@link RenderTransport} that renders JavaScript-heavy pages with headless Chromium via Playwright.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Launches the browser lazily on first use and reuses one context for the whole run.</li>
 *   <li>Navigates, waits for NETWORKIDLE and for the source's wait selector (or a fixed settle wait).</li>
 *   <li>Runs a bounded number of scroll-and-wait cycles so infinite-scroll grids load their lazy items.</li>
 *   <li>Returns the final {@code page.content()} with the navigation status.</li>
 * </ul>
 * Playwright objects are not thread-safe, so renders are serialized on this instance.
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class PlaywrightRenderer implements RenderTransport, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightRenderer.class);

    private static final int SELECTOR_WAIT_MS = 10_000;

    private final String userAgent;
    private final Duration settleWait;
    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;

    public PlaywrightRenderer(String userAgent, Duration settleWait) {
        this.userAgent = userAgent;
        this.settleWait = settleWait == null ? Duration.ofSeconds(2) : settleWait;
    }

    private BrowserType.LaunchOptions getDefaultLaunchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions();
        options.setHeadless(true);
        options.setArgs(Arrays.asList(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--lang=en-US"
        ));
        return options;
    }

    private void ensureBrowser() {
        if (context != null) return;
        playwright = Playwright.create();
        browser = playwright.chromium().launch(getDefaultLaunchOptions());
        Browser.NewContextOptions contextOptions = new Browser.NewContextOptions()
            .setViewportSize(1920, 1080)
            .setLocale("en-US");
        if (userAgent != null && !userAgent.isBlank()) contextOptions.setUserAgent(userAgent);
        context = browser.newContext(contextOptions);
        logger.info("Headless Chromium launched for rendered fetches.");
    }

    @Override
    public synchronized TransportResponse render(String url, String waitSelector, Duration timeout, int scrollCycles) throws TransportException {
        Page page = null;
        try {
            ensureBrowser();
            page = context.newPage();
            page.setDefaultTimeout(timeout.toMillis());
            page.setDefaultNavigationTimeout(timeout.toMillis());
            Response response = page.navigate(url);
            int status = response == null ? 200 : response.status();
            if (status >= 400) {
                return TransportResponse.of(status, "");
            }
            waitForPageReady(page, waitSelector);
            for (int i = 0; i < scrollCycles; i++) {
                page.evaluate("window.scrollTo(0, document.body.scrollHeight)");
                page.waitForTimeout(settleWait.toMillis());
            }
            return TransportResponse.of(status, page.content());
        } catch (TimeoutError e) {
            throw new TransportException("Render timed out for " + url + ": " + e.getMessage(), e);
        } catch (PlaywrightException e) {
            throw new TransportException("Render failed for " + url + ": " + e.getMessage(), e);
        } finally {
            if (page != null) {
                try {
                    page.close();
                } catch (PlaywrightException e) {
                    logger.debug("Failed to close page for {}: {}", url, e.getMessage());
                }
            }
        }
    }

    /**
     * Waits for NETWORKIDLE and then for the wait selector; without a selector, waits the settle time instead.
     * A missing selector raises a {@link TimeoutError}, which the caller reports as a transport failure.
     */
    private void waitForPageReady(Page page, String selector) {
        page.waitForLoadState(LoadState.NETWORKIDLE);
        if (selector != null && !selector.isBlank()) {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout(SELECTOR_WAIT_MS));
            logger.debug("Page ready: {} appeared after NETWORKIDLE", selector);
        } else {
            page.waitForTimeout(settleWait.toMillis());
        }
    }

    @Override
    public synchronized void close() {
        try {
            if (context != null) context.close();
            if (browser != null) browser.close();
            if (playwright != null) playwright.close();
        } catch (PlaywrightException e) {
            logger.warn("Failed to shut down headless browser cleanly: {}", e.getMessage());
        } finally {
            context = null;
            browser = null;
            playwright = null;
        }
    }
}
