package io.creatorpay.core.service;

import java.time.Instant;

public record ProcessResult(
    boolean success,
    String transactionId,
    String message,
    Instant processedAt
) {
    public ProcessResult {
        transactionId = transactionId == null ? "" : transactionId;
        message = message == null ? "" : message.trim();
        processedAt = processedAt == null ? Instant.EPOCH : processedAt;
    }

    static ProcessResult success(String transactionId, String message, Instant at) {
        return new ProcessResult(true, transactionId, message, at);
    }

    static ProcessResult failure(String transactionId, String message, Instant at) {
        return new ProcessResult(false, transactionId, message, at);
    }
}
