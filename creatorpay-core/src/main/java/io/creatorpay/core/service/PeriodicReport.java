package io.creatorpay.core.service;

import io.creatorpay.core.payment.PaymentKind;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record PeriodicReport(
    String channelId,
    String period,
    BigDecimal grossIncome,
    BigDecimal estimatedTax,
    BigDecimal netProjection,
    Map<PaymentKind, BigDecimal> breakdown,
    int transactionCount
) {
    public PeriodicReport {
        breakdown = breakdown == null || breakdown.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(breakdown));
    }
}
