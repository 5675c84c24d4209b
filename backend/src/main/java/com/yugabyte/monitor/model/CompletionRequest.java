package com.yugabyte.monitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Wire body of an OpenAI-compatible chat completion call.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRequest {
    private String model;
    private List<CompletionMessage> messages;
    @JsonProperty("max_tokens")
    private Integer maxTokens;
    private Double temperature;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompletionMessage {
        private String role;
        private String content;
    }
}
