package io.creatorpay.core.payment;

public final class CapacityExceededException extends PaymentException {
    private final int maxCapacity;

    public CapacityExceededException(int maxCapacity) {
        super("Store capacity of " + maxCapacity + " records reached.");
        this.maxCapacity = maxCapacity;
    }

    public int maxCapacity() {
        return maxCapacity;
    }
}
