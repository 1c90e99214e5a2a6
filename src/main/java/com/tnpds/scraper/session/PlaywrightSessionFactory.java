package com.tnpds.scraper.session;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.tnpds.scraper.PortalUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Launches Chromium through Playwright with a fixed window size and sandbox-friendly flags,
 * one browser per session.
 */
public class PlaywrightSessionFactory implements PortalSessionFactory {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightSessionFactory.class);

    private static final int VIEWPORT_WIDTH = 1920;
    private static final int VIEWPORT_HEIGHT = 1080;
    private static final List<String> CHROMIUM_ARGS = List.of(
        "--disable-gpu",
        "--no-sandbox",
        "--disable-dev-shm-usage",
        "--disable-extensions",
        "--disable-setuid-sandbox"
    );

    private final Duration actionTimeout;
    private final Duration initialPoll;

    public PlaywrightSessionFactory(Duration actionTimeout, Duration initialPoll) {
        this.actionTimeout = actionTimeout;
        this.initialPoll = initialPoll;
    }

    @Override
    public PortalSession open(boolean headless) {
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                .setHeadless(headless)
                .setArgs(CHROMIUM_ARGS));
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                .setViewportSize(VIEWPORT_WIDTH, VIEWPORT_HEIGHT));
            Page page = context.newPage();
            logger.info("Opened Chromium session (headless={}).", headless);
            return new PlaywrightPortalSession(playwright, browser, context, page, actionTimeout, initialPoll);
        } catch (PlaywrightException e) {
            logger.error("Failed to launch browser: {}", e.getMessage());
            if (playwright != null) {
                try {
                    playwright.close();
                } catch (PlaywrightException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw new PortalUnavailableException("Could not start a browser session: " + e.getMessage(), e);
        }
    }
}
