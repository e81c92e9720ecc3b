package com.example.interview.config;

import com.example.interview.service.LlmClient;
import com.example.interview.service.SpringAiLlmClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chat clients per model provider and the {@link LlmClient} wrappers the engine uses.
 * <p>
 * - evaluation (OpenAI): plan design, answer evaluation, follow-ups
 * - report (Anthropic): narrative overview of the final report
 */
@Configuration
public class AiConfig {

    @Bean("evaluationChatClient")
    public ChatClient evaluationChatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    @Bean("reportChatClient")
    public ChatClient reportChatClient(AnthropicChatModel anthropicChatModel) {
        return ChatClient.builder(anthropicChatModel).build();
    }

    @Bean("evaluationLlmClient")
    public LlmClient evaluationLlmClient(@Qualifier("evaluationChatClient") ChatClient chatClient,
                                         InterviewProperties properties) {
        return new SpringAiLlmClient(chatClient, "evaluation", properties.llm());
    }

    @Bean("reportLlmClient")
    public LlmClient reportLlmClient(@Qualifier("reportChatClient") ChatClient chatClient,
                                     InterviewProperties properties) {
        return new SpringAiLlmClient(chatClient, "report", properties.llm());
    }

    /**
     * Shared ObjectMapper for JSON serialization.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
