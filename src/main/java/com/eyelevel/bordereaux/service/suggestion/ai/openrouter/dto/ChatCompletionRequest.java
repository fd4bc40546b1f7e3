package com.eyelevel.bordereaux.service.suggestion.ai.openrouter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Body of an OpenAI-compatible {@code /chat/completions} call.
 */
@Data
@Builder
public class ChatCompletionRequest {

    private String model;
    private List<ChatMessage> messages;
    private Double temperature;

    @JsonProperty("max_tokens")
    private Integer maxTokens;
}
