package com.yugabyte.monitor.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single language-model call: system instruction, user prompt and response constraints.
 */
@Value
@Builder
public class LlmRequest {
    String systemInstruction;
    String prompt;
    @Builder.Default
    int maxTokens = 500;
    @Builder.Default
    double temperature = 0.3;
}
