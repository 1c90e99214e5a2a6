package com.tnpds.scraper.session;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.SelectOption;
import com.tnpds.scraper.ElementNotFoundException;
import com.tnpds.scraper.ErrorKind;
import com.tnpds.scraper.PortalException;
import com.tnpds.scraper.SessionLostException;
import com.tnpds.scraper.WaitTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link PortalSession} backed by a Playwright Chromium page.
 * <p>
 * Playwright failures are translated at this boundary: a closed page or disconnected browser
 * becomes {@link SessionLostException}, a Playwright timeout becomes
 * {@link WaitTimeoutException}, anything else a {@link PortalException} of kind
 * {@link ErrorKind#UNKNOWN_FAILURE}.
 *
 * @author PDS Scraper Team
 * @since 1.0
 */
public class PlaywrightPortalSession implements PortalSession {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightPortalSession.class);

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final Duration actionTimeout;
    private final Duration initialPoll;

    PlaywrightPortalSession(Playwright playwright, Browser browser, BrowserContext context, Page page,
                            Duration actionTimeout, Duration initialPoll) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
        this.actionTimeout = actionTimeout;
        this.initialPoll = initialPoll;
        page.setDefaultTimeout(actionTimeout.toMillis());
        page.setDefaultNavigationTimeout(actionTimeout.toMillis());
    }

    private record PlaywrightElement(Locator locator, String selector) implements PortalElement {}

    @Override
    public void navigateTo(String url) {
        guard("navigate to " + url, () -> {
            page.navigate(url);
            page.waitForLoadState(LoadState.DOMCONTENTLOADED);
            logger.debug("Navigated to {}", url);
            return null;
        });
    }

    @Override
    public PortalElement findElement(String selector) {
        return findElement(selector, null);
    }

    @Override
    public PortalElement findElement(String selector, PortalElement within) {
        Locator matches = locate(selector, within);
        if (guard("count " + selector, matches::count) == 0) {
            throw new ElementNotFoundException(selector);
        }
        return new PlaywrightElement(matches.first(), selector);
    }

    @Override
    public List<PortalElement> findElements(String selector, PortalElement within) {
        Locator matches = locate(selector, within);
        int count = guard("count " + selector, matches::count);
        List<PortalElement> elements = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            elements.add(new PlaywrightElement(matches.nth(i), selector));
        }
        return elements;
    }

    @Override
    public List<String> readTexts(String selector, PortalElement within) {
        Locator matches = locate(selector, within);
        List<String> texts = new ArrayList<>();
        for (String text : guard("read " + selector, matches::allInnerTexts)) {
            texts.add(text == null ? "" : text.trim());
        }
        return texts;
    }

    @Override
    public void click(PortalElement element) {
        Locator locator = unwrap(element).locator();
        guard("click " + element.selector(), () -> {
            locator.scrollIntoViewIfNeeded();
            locator.click(new Locator.ClickOptions().setTimeout(actionTimeout.toMillis()));
            return null;
        });
    }

    @Override
    public String readText(PortalElement element) {
        Locator locator = unwrap(element).locator();
        String text = guard("read " + element.selector(), locator::innerText);
        return text == null ? "" : text.trim();
    }

    @Override
    public void selectOption(PortalElement select, String label) {
        Locator locator = unwrap(select).locator();
        guard("select '" + label + "' in " + select.selector(), () ->
            locator.selectOption(new SelectOption().setLabel(label),
                new Locator.SelectOptionOptions().setTimeout(actionTimeout.toMillis())));
    }

    @Override
    public <T> T waitUntil(String condition, Supplier<T> probe, Duration timeout) {
        return Waits.poll(condition, probe, timeout, initialPoll, ms -> {
            if (!isAlive()) {
                throw new SessionLostException("Browser went away while waiting for " + condition, null);
            }
            page.waitForTimeout(ms);
        });
    }

    @Override
    public String pageContent() {
        return guard("read page content", page::content);
    }

    @Override
    public void screenshot(Path path) {
        guard("screenshot " + path, () -> page.screenshot(new Page.ScreenshotOptions().setPath(path).setFullPage(true)));
    }

    @Override
    public boolean isAlive() {
        try {
            return browser.isConnected() && !page.isClosed();
        } catch (PlaywrightException e) {
            logger.debug("Liveness check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        try {
            context.close();
        } catch (PlaywrightException e) {
            logger.warn("Failed to close browser context: {}", e.getMessage());
        }
        try {
            browser.close();
        } catch (PlaywrightException e) {
            logger.warn("Failed to close browser: {}", e.getMessage());
        }
        try {
            playwright.close();
        } catch (PlaywrightException e) {
            logger.warn("Failed to close Playwright driver: {}", e.getMessage());
        }
        logger.info("Browser session closed.");
    }

    private Locator locate(String selector, PortalElement within) {
        return within == null ? page.locator(selector) : unwrap(within).locator().locator(selector);
    }

    private static PlaywrightElement unwrap(PortalElement element) {
        if (element instanceof PlaywrightElement pe) {
            return pe;
        }
        throw new IllegalArgumentException("Element does not belong to a Playwright session: " + element);
    }

    private <T> T guard(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (TimeoutError e) {
            throw new WaitTimeoutException(action, actionTimeout, e);
        } catch (PlaywrightException e) {
            if (!isAlive()) {
                throw new SessionLostException("Browser session lost during " + action, e);
            }
            throw new PortalException(ErrorKind.UNKNOWN_FAILURE, "Failed to " + action + ": " + e.getMessage(), e);
        }
    }
}
