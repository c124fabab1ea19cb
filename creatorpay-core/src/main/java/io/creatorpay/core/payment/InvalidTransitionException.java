package io.creatorpay.core.payment;

public final class InvalidTransitionException extends ValidationException {
    private final String requestedStatus;

    public InvalidTransitionException(String requestedStatus) {
        super("Invalid status: " + requestedStatus + ". Expected one of " + PaymentStatus.wireValues());
        this.requestedStatus = requestedStatus;
    }

    public String requestedStatus() {
        return requestedStatus;
    }
}
