package com.tnpds.scraper.session;

import com.tnpds.scraper.ElementNotFoundException;
import com.tnpds.scraper.SessionLostException;
import com.tnpds.scraper.WaitTimeoutException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * One browser session on the portal. Every call is synchronous; {@link #waitUntil} is the
 * only call that suspends. Other calls either succeed straight away or throw
 * {@link ElementNotFoundException}. Any call may throw {@link SessionLostException} once the
 * browser is gone.
 * <p>
 * A session is used by one pipeline invocation at a time and is not thread-safe.
 */
public interface PortalSession extends AutoCloseable {

    /**
     * Loads a page and waits for its DOM to be ready.
     */
    void navigateTo(String url);

    /**
     * First element matching {@code selector} on the page.
     * @throws ElementNotFoundException when nothing matches
     */
    PortalElement findElement(String selector);

    /**
     * First element matching {@code selector} inside {@code within}.
     * @throws ElementNotFoundException when nothing matches
     */
    PortalElement findElement(String selector, PortalElement within);

    /**
     * All matches in document order; empty when nothing matches.
     * @param within scope element, or {@code null} for the whole page
     */
    List<PortalElement> findElements(String selector, PortalElement within);

    /**
     * Rendered text of every match, trimmed, in document order, read in one round trip.
     * @param within scope element, or {@code null} for the whole page
     */
    List<String> readTexts(String selector, PortalElement within);

    void click(PortalElement element);

    /**
     * Rendered text of the element, trimmed; never {@code null}.
     */
    String readText(PortalElement element);

    /**
     * Picks the option with the given visible label in a dropdown control.
     */
    void selectOption(PortalElement select, String label);

    /**
     * Polls {@code probe} until it yields a non-null value (and not {@link Boolean#FALSE}).
     * A probe throwing {@link ElementNotFoundException} counts as "not yet".
     *
     * @param condition human-readable name of what is awaited, used in the timeout message
     * @return the probe's first ready value
     * @throws WaitTimeoutException when {@code timeout} elapses first
     */
    <T> T waitUntil(String condition, Supplier<T> probe, Duration timeout);

    /**
     * Rendered markup of the current page.
     */
    String pageContent();

    void screenshot(Path path);

    /**
     * False once the browser process or page has gone away.
     */
    boolean isAlive();

    @Override
    void close();
}
