package com.xyznexus.agent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the active reasoning client based on the LLM_PROVIDER env var.
 * The pooled RestClient.Builder from HttpClientConfig carries the timeouts.
 */
@Configuration
@Slf4j
public class ReasoningClientConfig {

    @Value("${llm.provider:deepseek}")
    private String provider;

    // DeepSeek
    @Value("${deepseek.api-key:}") private String deepSeekKey;
    @Value("${deepseek.base-url}") private String deepSeekBaseUrl;
    @Value("${deepseek.model}")    private String deepSeekModel;
    @Value("${deepseek.max-tokens}") private int deepSeekMaxTokens;
    @Value("${deepseek.temperature}") private double deepSeekTemp;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url}") private String openAiBaseUrl;
    @Value("${openai.model}")    private String openAiModel;
    @Value("${openai.max-tokens}") private int openAiMaxTokens;
    @Value("${openai.temperature}") private double openAiTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Active reasoning provider : {}", provider.toUpperCase());
        log.info("  Model                     : {}", activeModel());
        log.info("================================================================");
    }

    /**
     * The raw provider client. ResilientReasoningClient wraps it with retry and
     * circuit breaker and is the @Primary bean everything else receives.
     */
    @Bean("activeReasoningClient")
    public ReasoningClient activeReasoningClient(
            ObjectMapper objectMapper,
            @Qualifier("reasoningRestClientBuilder") RestClient.Builder builder) {

        return switch (provider.toLowerCase()) {
            case "openai" -> {
                logKey("OPENAI", openAiKey, "OPENAI_API_KEY");
                yield new GenericReasoningClient(openAiProps(), objectMapper, "openai", builder.clone());
            }
            default -> { // deepseek
                logKey("DEEPSEEK", deepSeekKey, "DEEPSEEK_API_KEY");
                yield new GenericReasoningClient(deepSeekProps(), objectMapper, "deepseek", builder.clone());
            }
        };
    }

    private LlmProviderProperties deepSeekProps() {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(deepSeekKey); p.setBaseUrl(deepSeekBaseUrl); p.setModel(deepSeekModel);
        p.setMaxTokens(deepSeekMaxTokens); p.setTemperature(deepSeekTemp);
        return p;
    }

    private LlmProviderProperties openAiProps() {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(openAiKey); p.setBaseUrl(openAiBaseUrl); p.setModel(openAiModel);
        p.setMaxTokens(openAiMaxTokens); p.setTemperature(openAiTemp);
        return p;
    }

    private String activeModel() {
        return "openai".equalsIgnoreCase(provider) ? openAiModel : deepSeekModel;
    }

    private void logKey(String name, String key, String envVar) {
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}={your-key}", name, envVar);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
