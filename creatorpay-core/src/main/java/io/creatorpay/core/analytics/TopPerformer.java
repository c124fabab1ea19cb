package io.creatorpay.core.analytics;

import io.creatorpay.core.payment.PaymentKind;

public record TopPerformer(
    int rank,
    String paymentId,
    String channelId,
    double amount,
    String currency,
    PaymentKind kind
) {
}
