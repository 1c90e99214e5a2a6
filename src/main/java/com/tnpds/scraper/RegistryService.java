package com.tnpds.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the shop registry:
 * <pre>
 * {"shops": [{"id": "...", "district": "...", "taluk": "..."}, ...],
 *  "options": {"includeDetails": true, "headless": true}}
 * </pre>
 * {@code id}, {@code district} and {@code taluk} are required non-blank strings. Extra fields
 * are ignored. A missing {@code options} block, or a missing option, takes the default
 * ({@code true}); {@code include_details} is accepted for {@code includeDetails}.
 */
public class RegistryService {
    private static final Logger logger = LoggerFactory.getLogger(RegistryService.class);

    public ShopRegistry read(Path file) throws IOException {
        JsonNode root = ObjectMapperFactory.getDefaultMapper().readTree(Files.readString(file));
        ShopRegistry registry = parse(root);
        logger.info("Loaded {} shops from {}", registry.shops().size(), file);
        return registry;
    }

    public ShopRegistry parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Registry must be a JSON object with a 'shops' array");
        }
        JsonNode shopsNode = root.get("shops");
        if (shopsNode == null || !shopsNode.isArray()) {
            throw new IllegalArgumentException("Registry has no 'shops' array");
        }
        List<ShopQuery> shops = new ArrayList<>();
        for (int i = 0; i < shopsNode.size(); i++) {
            JsonNode shop = shopsNode.get(i);
            if (!shop.isObject()) {
                throw new IllegalArgumentException("shops[" + i + "] is not an object");
            }
            shops.add(new ShopQuery(
                requiredText(shop, "id", i),
                requiredText(shop, "district", i),
                requiredText(shop, "taluk", i)
            ));
        }
        return new ShopRegistry(shops, parseOptions(root.get("options")));
    }

    private static RunOptions parseOptions(JsonNode options) {
        if (options == null || options.isNull()) {
            return RunOptions.DEFAULTS;
        }
        boolean headless = flag(options, RunOptions.DEFAULTS.headless(), "headless");
        boolean includeDetails = flag(options, RunOptions.DEFAULTS.includeDetails(), "includeDetails", "include_details");
        return new RunOptions(headless, includeDetails);
    }

    private static boolean flag(JsonNode options, boolean defaultValue, String... names) {
        for (String name : names) {
            JsonNode value = options.get(name);
            if (value != null && !value.isNull()) {
                if (!value.isBoolean()) {
                    throw new IllegalArgumentException("options." + name + " must be true or false");
                }
                return value.booleanValue();
            }
        }
        return defaultValue;
    }

    private static String requiredText(JsonNode shop, String field, int index) {
        JsonNode value = shop.get(field);
        if (value == null || !value.isTextual() || value.textValue().isBlank()) {
            throw new IllegalArgumentException("shops[" + index + "]." + field + " is required and must be a non-empty string");
        }
        return value.textValue().trim();
    }
}
