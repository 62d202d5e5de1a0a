package com.proposalmind.core.error;

/**
 * The classifier's output could not be read as a routing decision.
 * Always recovered inside the router by keyword fallback.
 */
public class RoutingParseException extends ProposalmindException {

    public RoutingParseException(String message) {
        super(message);
    }

    public RoutingParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
