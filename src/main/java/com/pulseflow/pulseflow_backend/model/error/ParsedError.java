package com.pulseflow.pulseflow_backend.model.error;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Classified form of a node failure. {@code userMessage} is what the UI shows;
 * {@code technicalDetails} keeps the raw text for diagnostics.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParsedError(
        ErrorCategory category,
        boolean retryable,
        String userMessage,
        String technicalDetails,
        String code,
        String revertReason,
        String txHash
) {

    public static ParsedError of(ErrorCategory category, boolean retryable, String userMessage, String technicalDetails) {
        return new ParsedError(category, retryable, userMessage, technicalDetails, null, null, null);
    }
}
