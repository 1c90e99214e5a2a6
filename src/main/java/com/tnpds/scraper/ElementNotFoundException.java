package com.tnpds.scraper;

/**
 * A selector matched nothing on the current page.
 */
public class ElementNotFoundException extends PortalException {
    private final String selector;

    public ElementNotFoundException(String selector) {
        super(ErrorKind.ELEMENT_NOT_FOUND, "Element not found: " + selector);
        this.selector = selector;
    }

    public String selector() {
        return selector;
    }
}
