package com.proposalmind.core.llm;

import com.proposalmind.core.error.ProposalmindException;

/**
 * The generation backend returned null or blank content.
 */
public class LlmEmptyResponseException extends ProposalmindException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
