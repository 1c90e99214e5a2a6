package com.tnpds.scraper;

import com.tnpds.scraper.session.PortalSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the detail page's status indicator. A missing indicator or unrecognised text is
 * {@link ShopStatus#UNKNOWN}, never a failure.
 */
public class StatusClassifier {
    private static final Logger logger = LoggerFactory.getLogger(StatusClassifier.class);

    private final String indicatorSelector;
    private final StatusVocabulary vocabulary;

    public StatusClassifier(String indicatorSelector, StatusVocabulary vocabulary) {
        this.indicatorSelector = indicatorSelector;
        this.vocabulary = vocabulary;
    }

    public ShopStatus classify(PortalSession session) {
        String text;
        try {
            text = session.readText(session.findElement(indicatorSelector));
        } catch (ElementNotFoundException e) {
            logger.warn("No status indicator ({}) on the detail page; recording unknown", indicatorSelector);
            return ShopStatus.UNKNOWN;
        }
        ShopStatus status = vocabulary.classify(text);
        if (status == ShopStatus.UNKNOWN) {
            logger.warn("Unrecognised status text '{}'; recording unknown", text);
        }
        return status;
    }
}
