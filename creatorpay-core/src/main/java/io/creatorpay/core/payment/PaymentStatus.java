package io.creatorpay.core.payment;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum PaymentStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    ON_HOLD("on_hold"),
    CANCELLED("cancelled"),
    REFUNDED("refunded");

    private final String wireValue;

    PaymentStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<PaymentStatus> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(status -> status.wireValue.equals(normalized))
            .findFirst();
    }

    public static PaymentStatus fromValue(String value) {
        return find(value).orElseThrow(() -> new InvalidTransitionException(value));
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(PaymentStatus::wireValue).toList();
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
