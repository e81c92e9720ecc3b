package com.example.interview.service;

import com.example.interview.config.InterviewProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;

/**
 * {@link LlmClient} backed by a Spring AI {@link ChatClient}.
 * <p>
 * Transient failures (rate limiting, 5xx, connection errors, empty content) are retried
 * with exponential backoff; the retry only repeats this call. Permanent failures and an
 * exhausted budget surface as {@link LlmUnavailableException}.
 */
public class SpringAiLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiLlmClient.class);

    private final ChatClient chatClient;
    private final String name;
    private final InterviewProperties.Llm settings;

    public SpringAiLlmClient(ChatClient chatClient, String name, InterviewProperties.Llm settings) {
        this.chatClient = chatClient;
        this.name = name;
        this.settings = settings;
    }

    @Override
    public String call(String prompt, double temperature, int maxTokens) {
        int maxAttempts = settings.maxAttempts();
        long delay = settings.initialBackoffMs();
        RuntimeException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String content = invoke(prompt, temperature, maxTokens);
                if (content == null || content.isBlank()) {
                    throw new TransientAiException("Empty or null content in model response");
                }
                return content;
            } catch (RuntimeException e) {
                if (!isTransient(e)) {
                    throw new LlmUnavailableException(name + ": permanent model failure: " + rootCauseMessage(e), e);
                }
                lastError = e;
                if (attempt < maxAttempts) {
                    log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms...",
                            name, attempt, maxAttempts, rootCauseMessage(e), delay);
                    TokenUsageAccumulator acc = TokenUsageAccumulator.current();
                    if (acc != null) acc.addRetry();
                    try {
                        sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                    delay = Math.round(delay * settings.backoffMultiplier());
                }
            }
        }
        throw new LlmUnavailableException(name + ": model unavailable after " + maxAttempts
                + " attempts: " + (lastError != null ? rootCauseMessage(lastError) : "interrupted"), lastError);
    }

    /** Performs one provider call and returns the raw text. */
    protected String invoke(String prompt, double temperature, int maxTokens) {
        ChatResponse chatResponse = chatClient.prompt()
                .user(prompt)
                .options(ChatOptions.builder()
                        .temperature(temperature)
                        .maxTokens(maxTokens)
                        .build())
                .call()
                .chatResponse();

        captureTokenUsage(chatResponse);

        return (chatResponse != null && chatResponse.getResult() != null)
                ? chatResponse.getResult().getOutput().getText()
                : null;
    }

    protected void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }

    static boolean isTransient(Throwable e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof TransientAiException
                    || cause instanceof ResourceAccessException
                    || cause instanceof HttpServerErrorException
                    || cause instanceof HttpClientErrorException.TooManyRequests
                    || cause instanceof IOException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private void captureTokenUsage(ChatResponse chatResponse) {
        if (chatResponse == null || chatResponse.getMetadata() == null) return;
        var usage = chatResponse.getMetadata().getUsage();
        TokenUsageAccumulator acc = TokenUsageAccumulator.current();
        if (usage == null || acc == null) return;
        long prompt = usage.getPromptTokens() != null ? usage.getPromptTokens().longValue() : 0L;
        long completion = usage.getCompletionTokens() != null ? usage.getCompletionTokens().longValue() : 0L;
        acc.addCall(prompt, completion);
        log.debug("{}: +{} prompt / +{} completion tokens (model={})",
                name, prompt, completion, chatResponse.getMetadata().getModel());
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage();
        return msg != null && msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
