package com.tnpds.scraper;

import com.tnpds.scraper.session.PortalSession;

/**
 * Reads the last transaction and its bill items from a shop's detail page.
 */
public interface TransactionExtractorInterface {

    /**
     * Opens the last-transaction dialog, reads it and closes it again.
     * @param session session positioned on a shop detail page
     * @return summary and bill rows in table order
     * @throws ExtractionTimeoutException when the dialog never fills within its timeout
     */
    TransactionDetails extract(PortalSession session);
}
