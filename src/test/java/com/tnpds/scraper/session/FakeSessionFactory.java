package com.tnpds.scraper.session;

import com.tnpds.scraper.PortalUnavailableException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Hands out fake sessions, optionally refusing once a number of them have been opened.
 */
public class FakeSessionFactory implements PortalSessionFactory {
    private final IntFunction<FakePortalSession> sessions;
    private final List<FakePortalSession> opened = new ArrayList<>();
    private int available = Integer.MAX_VALUE;
    private Boolean lastHeadless;

    /**
     * @param sessions builds the n-th session (zero based)
     */
    public FakeSessionFactory(IntFunction<FakePortalSession> sessions) {
        this.sessions = sessions;
    }

    public FakeSessionFactory failAfter(int count) {
        this.available = count;
        return this;
    }

    @Override
    public PortalSession open(boolean headless) {
        lastHeadless = headless;
        if (opened.size() >= available) {
            throw new PortalUnavailableException("Failed to launch Chromium", new IllegalStateException("browser download missing"));
        }
        FakePortalSession session = sessions.apply(opened.size());
        opened.add(session);
        return session;
    }

    public List<FakePortalSession> opened() {
        return opened;
    }

    public Boolean lastHeadless() {
        return lastHeadless;
    }
}
