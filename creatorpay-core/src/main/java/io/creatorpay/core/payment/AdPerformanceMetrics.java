package io.creatorpay.core.payment;

public record AdPerformanceMetrics(
    long totalImpressions,
    long validImpressions,
    long estimatedClicks,
    double averageCpm,
    String platform
) {
}
