package io.creatorpay.core.analytics;

import io.creatorpay.core.store.StoreAuditEntry;
import java.math.BigDecimal;
import java.util.List;

public record SystemHealth(
    HealthStatus status,
    double failureRate,
    BigDecimal totalVolume,
    List<StoreAuditEntry> recentLogs
) {
    public SystemHealth {
        recentLogs = recentLogs == null ? List.of() : List.copyOf(recentLogs);
    }
}
