package com.proposalmind.core.error;

/**
 * Root of the orchestration error hierarchy. All subclasses are unchecked.
 */
public class ProposalmindException extends RuntimeException {

    public ProposalmindException(String message) {
        super(message);
    }

    public ProposalmindException(String message, Throwable cause) {
        super(message, cause);
    }
}
