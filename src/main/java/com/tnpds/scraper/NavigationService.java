package com.tnpds.scraper;

import com.tnpds.scraper.session.PortalElement;
import com.tnpds.scraper.session.PortalSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Drives the shop search form. The page is switched to English first, since registry names
 * are English. Each dropdown is repopulated over AJAX once its parent changes, so every
 * selection first waits until the target value is actually offered; there are no fixed sleeps.
 *
 * @author PDS Scraper Team
 * @since 1.0
 */
public class NavigationService implements NavigationServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(NavigationService.class);

    private final String searchUrl;
    private final PortalSelectors selectors;
    private final Timeouts timeouts;

    public NavigationService(String searchUrl, PortalSelectors selectors, Timeouts timeouts) {
        this.searchUrl = searchUrl;
        this.selectors = selectors;
        this.timeouts = timeouts;
    }

    /** A dropdown together with the exact label of the option to pick. */
    private record Choice(PortalElement select, String label) {}

    @Override
    public void openShop(PortalSession session, ShopQuery query) {
        logger.debug("Opening shop {} ({} / {})", query.id(), query.district(), query.taluk());
        session.navigateTo(searchUrl);
        ensureEnglish(session);

        Choice district = awaitOption(session, "district", selectors.districtSelect(), sameText(query.district()));
        session.selectOption(district.select(), district.label());

        Choice taluk = awaitOption(session, "taluk", selectors.talukSelect(), sameText(query.taluk()));
        session.selectOption(taluk.select(), taluk.label());

        Choice shop = awaitOption(session, "shop", selectors.shopSelect(), hasShopCode(query.id()));
        session.selectOption(shop.select(), shop.label());

        session.click(session.findElement(selectors.searchButton()));
        session.waitUntil("detail page of shop " + query.id(),
            () -> session.findElement(selectors.detailRoot()), timeouts.page());
        logger.debug("Detail page of shop {} is open", query.id());
    }

    private Choice awaitOption(PortalSession session, String what, String selectSelector, Predicate<String> wanted) {
        return session.waitUntil(what + " dropdown offering the requested value", () -> {
            PortalElement select = session.findElement(selectSelector);
            for (String label : session.readTexts(selectors.option(), select)) {
                if (wanted.test(label)) {
                    return new Choice(select, label);
                }
            }
            return null;
        }, timeouts.dropdown());
    }

    private static Predicate<String> sameText(String expected) {
        String target = expected.trim();
        return label -> label.trim().equalsIgnoreCase(target);
    }

    private void ensureEnglish(PortalSession session) {
        String marker = selectors.englishMarker();
        if (marker == null || marker.isBlank() || !session.findElements(marker, null).isEmpty()) {
            return;
        }
        logger.info("Portal is not in English; switching language");
        session.click(session.findElement(selectors.languageToggle()));
        session.waitUntil("portal language switched to English",
            () -> !session.findElements(marker, null).isEmpty(), timeouts.page());
    }

    // Shop options read "<code> - <name>"; the code must match exactly.
    static Predicate<String> hasShopCode(String shopId) {
        String target = shopId.trim();
        return label -> shopCode(label).equalsIgnoreCase(target);
    }

    static String shopCode(String label) {
        String trimmed = label.trim();
        int dash = trimmed.indexOf(" - ");
        String head = dash >= 0 ? trimmed.substring(0, dash) : trimmed;
        String[] tokens = head.trim().split("\\s+", 2);
        return tokens[0];
    }
}
