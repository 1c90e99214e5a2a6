package com.tnpds.scraper;

import com.tnpds.scraper.session.PortalSession;

/**
 * Reaches a shop's detail page through the district, taluk and shop dropdowns.
 */
public interface NavigationServiceInterface {

    /**
     * Leaves {@code session} on the detail page of {@code query}. Performs no retries.
     * @param session live portal session, owned by the caller
     * @param query shop to open
     * @throws ElementNotFoundException when a form control is missing
     * @throws WaitTimeoutException when a dropdown never offers the wanted value or the detail page never renders
     */
    void openShop(PortalSession session, ShopQuery query);
}
