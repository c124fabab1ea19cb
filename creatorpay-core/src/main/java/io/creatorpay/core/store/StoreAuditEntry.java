package io.creatorpay.core.store;

import java.time.Instant;

public record StoreAuditEntry(
    Instant timestamp,
    StoreOperation operation,
    String paymentId,
    String detail
) {
    public StoreAuditEntry {
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        paymentId = paymentId == null ? "" : paymentId;
        detail = detail == null ? "" : detail.trim();
    }

    @Override
    public String toString() {
        String base = "[" + timestamp + "] " + operation + " " + paymentId;
        return detail.isEmpty() ? base : base + " - " + detail;
    }
}
