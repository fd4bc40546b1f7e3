package com.eyelevel.bordereaux.service.suggestion.ai.openrouter;

import com.eyelevel.bordereaux.common.apiclient.authentication.Authentication;
import com.eyelevel.bordereaux.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.bordereaux.common.apiclient.model.HeaderConfig;
import com.eyelevel.bordereaux.common.json.JsonParser;
import com.eyelevel.bordereaux.config.BordereauxProcessingConfig;
import com.eyelevel.bordereaux.service.suggestion.ai.AiMappingClient;
import com.eyelevel.bordereaux.service.suggestion.ai.DisabledAiMappingClient;
import com.eyelevel.bordereaux.service.suggestion.ai.MappingPromptBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the AI mapping collaborator. The real client is used only when {@code app.processing.suggestion.ai.enabled}
 * is true and an API key is present; otherwise the disabled stand-in is registered.
 */
@Slf4j
@Configuration
public class OpenRouterClientConfiguration {

    @Value("${app.ai-client.baseurl}")
    private String baseUrl;

    @Value("${app.ai-client.endpoint.chat-completions}")
    private String chatCompletionsEndpoint;

    @Bean("aiWebClient")
    public WebClient aiWebClient(WebClient.Builder builder) {
        log.info("Initializing AI WebClient with base URL: {}", baseUrl);
        return builder.baseUrl(baseUrl).build();
    }

    @Bean("aiAuthentication")
    public Authentication aiAuthentication(BordereauxProcessingConfig processingConfig) {
        String apiKey = processingConfig.getSuggestion().getAi().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("AI API key is not configured. Mapping suggestions will use the heuristic only.");
        }
        return new BearerTokenAuthentication(apiKey);
    }

    @Bean
    public AiMappingClient aiMappingClient(@Qualifier("aiWebClient") WebClient webClient,
                                           @Qualifier("aiAuthentication") Authentication authentication,
                                           @Qualifier("openRouterHeader") HeaderConfig headerConfig,
                                           @Qualifier("jacksonJsonParser") JsonParser jsonParser,
                                           MappingPromptBuilder promptBuilder,
                                           BordereauxProcessingConfig processingConfig) {
        BordereauxProcessingConfig.Suggestion settings = processingConfig.getSuggestion();
        String apiKey = settings.getAi().getApiKey();
        if (!settings.getAi().isEnabled() || apiKey == null || apiKey.isBlank()) {
            log.info("AI mapping suggestions disabled.");
            return new DisabledAiMappingClient();
        }
        log.info("AI mapping suggestions enabled with model {}.", settings.getAi().getModel());
        return new OpenRouterAiMappingClient(webClient, authentication, headerConfig, jsonParser, promptBuilder,
                                             settings, chatCompletionsEndpoint);
    }
}
