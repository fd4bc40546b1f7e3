package com.eyelevel.bordereaux.service.suggestion.ai.openrouter.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatCompletionResponse {

    private String id;
    private String model;
    private List<Choice> choices;

    /**
     * Content of the first choice, if the reply has one.
     */
    public Optional<String> firstContent() {
        if (choices == null || choices.isEmpty() || choices.get(0).getMessage() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(choices.get(0).getMessage().getContent());
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        private Integer index;
        private ChatMessage message;
    }
}
