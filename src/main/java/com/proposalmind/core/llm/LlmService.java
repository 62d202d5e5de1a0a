package com.proposalmind.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Thin wrapper around Spring AI's {@link ChatClient}: the single blocking call
 * into the generation backend. Timeouts are the client's concern.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.chat.options.model:default}") String model) {
        this.chatClient = builder.build();
        log.info("LlmService initialized, model: {}", model);
    }

    /**
     * Sends a system + user prompt and returns the raw text of the response.
     *
     * @param systemPrompt instructions for the model's role
     * @param userPrompt   the task-specific prompt
     * @param purpose      short label used in logs (e.g. "routing", "business_analyst")
     * @return non-blank response content
     * @throws LlmEmptyResponseException if the model returns nothing
     */
    public String call(String systemPrompt, String userPrompt, String purpose) {
        log.info("LLM call started → {}", purpose);
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete → {} ({}s)", purpose, String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + purpose);
        }
        return response;
    }
}
