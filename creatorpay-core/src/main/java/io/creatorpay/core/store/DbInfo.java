package io.creatorpay.core.store;

public record DbInfo(
    String engine,
    String version,
    int maxCapacity,
    boolean supportsTransactions,
    boolean threadSafe
) {
}
