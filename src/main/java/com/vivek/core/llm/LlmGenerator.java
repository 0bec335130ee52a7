package com.vivek.core.llm;

import com.vivek.core.gateway.Generator;
import com.vivek.core.iteration.TransportException;
import com.vivek.core.model.SamplingParams;
import org.springframework.stereotype.Component;

/**
 * {@link Generator} backed by the configured chat model. Model failures and empty replies
 * surface as {@link TransportException} so the iteration loop can retry them.
 */
@Component
public class LlmGenerator implements Generator {

    private static final String SYSTEM_PROMPT = """
            You are a senior software engineer. Produce the complete content of the single file \
            described in the work item. Follow any review feedback listed under relevant history. \
            Reply with the file content only, without explanations.""";

    private final LlmService llmService;

    public LlmGenerator(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public String generate(String prompt, SamplingParams params) {
        try {
            return LlmService.stripFences(llmService.call(SYSTEM_PROMPT, prompt, params));
        } catch (LlmEmptyResponseException e) {
            throw new TransportException("Generator returned no content", e);
        } catch (RuntimeException e) {
            throw new TransportException("Generator call failed: " + e.getMessage(), e);
        }
    }
}
