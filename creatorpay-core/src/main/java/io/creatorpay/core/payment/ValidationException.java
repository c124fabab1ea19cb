package io.creatorpay.core.payment;

public class ValidationException extends PaymentException {
    public ValidationException(String message) {
        super(message);
    }
}
