package com.deepansh.explorer.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LlmResponse {

    private String content;

    /** True when the content was produced by a resilience fallback instead of the provider */
    private boolean fallback;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;
}
