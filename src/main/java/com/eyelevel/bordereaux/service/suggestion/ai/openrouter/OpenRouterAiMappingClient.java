package com.eyelevel.bordereaux.service.suggestion.ai.openrouter;

import com.eyelevel.bordereaux.common.apiclient.ApiClient;
import com.eyelevel.bordereaux.common.apiclient.authentication.Authentication;
import com.eyelevel.bordereaux.common.apiclient.model.ApiRequest;
import com.eyelevel.bordereaux.common.apiclient.model.ApiResponse;
import com.eyelevel.bordereaux.common.apiclient.model.HeaderConfig;
import com.eyelevel.bordereaux.common.json.JsonParser;
import com.eyelevel.bordereaux.config.BordereauxProcessingConfig;
import com.eyelevel.bordereaux.exception.SuggestionGenerationException;
import com.eyelevel.bordereaux.exception.apiclient.ApiException;
import com.eyelevel.bordereaux.exception.json.JsonParsingException;
import com.eyelevel.bordereaux.service.suggestion.SuggestionContext;
import com.eyelevel.bordereaux.service.suggestion.ai.AiMappingClient;
import com.eyelevel.bordereaux.service.suggestion.ai.AiMappingReply;
import com.eyelevel.bordereaux.service.suggestion.ai.AiMappingResponseSanitizer;
import com.eyelevel.bordereaux.service.suggestion.ai.MappingPromptBuilder;
import com.eyelevel.bordereaux.service.suggestion.ai.openrouter.dto.ChatCompletionRequest;
import com.eyelevel.bordereaux.service.suggestion.ai.openrouter.dto.ChatCompletionResponse;
import com.eyelevel.bordereaux.service.suggestion.ai.openrouter.dto.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Asks an OpenRouter (OpenAI-compatible) chat-completions endpoint for a header mapping. Registered by
 * {@link OpenRouterClientConfiguration} only when AI suggestions are enabled and a key is configured.
 */
@Slf4j
public class OpenRouterAiMappingClient extends ApiClient implements AiMappingClient {

    private final JsonParser jsonParser;
    private final MappingPromptBuilder promptBuilder;
    private final BordereauxProcessingConfig.Suggestion settings;
    private final String chatCompletionsEndpoint;

    public OpenRouterAiMappingClient(final WebClient webClient, final Authentication authentication,
                                     final HeaderConfig headerConfig, final JsonParser jsonParser,
                                     final MappingPromptBuilder promptBuilder,
                                     final BordereauxProcessingConfig.Suggestion settings,
                                     final String chatCompletionsEndpoint) {
        super(webClient, authentication, headerConfig);
        this.jsonParser = jsonParser;
        this.promptBuilder = promptBuilder;
        this.settings = settings;
        this.chatCompletionsEndpoint = chatCompletionsEndpoint;
    }

    @Override
    protected Duration timeout() {
        return settings.getAi().getTimeout();
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public AiMappingReply suggestMapping(final SuggestionContext context) {
        log.info("Requesting AI mapping suggestions for {} headers using {}", context.headers().size(),
                 settings.getAi().getModel());
        try {
            final ApiResponse apiResponse = call(prepareRequest(context));
            final ChatCompletionResponse completion = jsonParser.parseObject(apiResponse.getData(),
                                                                             ChatCompletionResponse.class);
            final String content = completion.firstContent()
                    .filter(text -> !text.isBlank())
                    .orElseThrow(() -> new SuggestionGenerationException("AI reply had no content"));
            log.debug("Raw AI reply ({} chars): {}", content.length(), content);
            return jsonParser.parseObject(AiMappingResponseSanitizer.stripCodeFences(content), AiMappingReply.class);
        } catch (ApiException e) {
            throw new SuggestionGenerationException("AI mapping request failed: " + e.getMessage(), e);
        } catch (JsonParsingException e) {
            throw new SuggestionGenerationException("AI reply was not valid JSON", e);
        }
    }

    private ApiRequest prepareRequest(final SuggestionContext context) {
        final ChatCompletionRequest body = ChatCompletionRequest.builder()
                .model(settings.getAi().getModel())
                .messages(List.of(ChatMessage.system(promptBuilder.systemPrompt()),
                                  ChatMessage.user(promptBuilder.userPrompt(context, settings.getSampleRows()))))
                .temperature(settings.getAi().getTemperature())
                .maxTokens(settings.getAi().getMaxTokens())
                .build();
        return ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(chatCompletionsEndpoint)
                .body(body)
                .contentType(MediaType.APPLICATION_JSON)
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build();
    }
}
