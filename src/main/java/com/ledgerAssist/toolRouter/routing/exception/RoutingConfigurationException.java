package com.ledgerAssist.toolRouter.routing.exception;

/**
 * Exception thrown when synonym, pattern or catalog configuration is malformed.
 * Only raised while the routing components are being built, never per query.
 */
public class RoutingConfigurationException extends RuntimeException {

    public RoutingConfigurationException(String message) {
        super(message);
    }

    public RoutingConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
