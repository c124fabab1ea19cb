package io.creatorpay.core.payment;

public enum PaymentKind {
    AD_REVENUE("AdRevenue"),
    MEMBERSHIP("Membership"),
    SPONSORSHIP("Sponsorship");

    private final String label;

    PaymentKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
