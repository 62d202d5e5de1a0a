package com.proposalmind.core.llm;

import com.proposalmind.core.error.ProposalmindException;

/**
 * Model output could not be parsed into the expected type.
 */
public class LlmParseException extends ProposalmindException {

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
