package com.tnpds.scraper;

import com.tnpds.scraper.session.PortalElement;
import com.tnpds.scraper.session.PortalSession;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the label/value rows of the shop detail panel (shop name, incharge, card
 * counts and so on) in page order. Rows with a blank label or value are skipped; the first
 * occurrence of a label wins.
 */
public class DetailPageReader {
    private final PortalSelectors selectors;

    public DetailPageReader(PortalSelectors selectors) {
        this.selectors = selectors;
    }

    public Map<String, String> readDetails(PortalSession session) {
        Map<String, String> details = new LinkedHashMap<>();
        for (PortalElement row : session.findElements(selectors.detailsRow(), null)) {
            String label = firstText(session, selectors.detailsLabel(), row);
            String value = firstText(session, selectors.detailsValue(), row);
            if (label.endsWith(":")) {
                label = label.substring(0, label.length() - 1).trim();
            }
            if (!label.isEmpty() && !value.isEmpty()) {
                details.putIfAbsent(label, value);
            }
        }
        return details;
    }

    private static String firstText(PortalSession session, String selector, PortalElement row) {
        List<PortalElement> matches = session.findElements(selector, row);
        return matches.isEmpty() ? "" : session.readText(matches.get(0));
    }
}
