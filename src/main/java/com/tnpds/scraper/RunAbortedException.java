package com.tnpds.scraper;

/**
 * A lost session could not be replaced while a shop was in flight. Carries that shop's
 * final record, with the attempts actually made.
 */
public class RunAbortedException extends PortalUnavailableException {
    private final transient ShopRecord record;

    public RunAbortedException(ShopRecord record, PortalUnavailableException cause) {
        super(cause.getMessage(), cause);
        this.record = record;
    }

    public ShopRecord record() {
        return record;
    }
}
