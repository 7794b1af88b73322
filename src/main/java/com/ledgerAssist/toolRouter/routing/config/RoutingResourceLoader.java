package com.ledgerAssist.toolRouter.routing.config;

import com.ledgerAssist.toolRouter.routing.exception.RoutingConfigurationException;
import com.ledgerAssist.toolRouter.util.JsonFileLoader;

import java.io.IOException;
import java.util.List;

/**
 * Loads routing definitions from classpath JSON, failing startup on unreadable files.
 */
public final class RoutingResourceLoader {

    private RoutingResourceLoader() {}

    public static <T> List<T> load(String resourcePath, Class<T> type) {
        try {
            return JsonFileLoader.loadAsList(resourcePath, type);
        } catch (IOException e) {
            throw new RoutingConfigurationException("Failed to load routing resource: " + resourcePath, e);
        }
    }
}
