package io.creatorpay.core.payment;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

public final class Money {

    private Money() {
    }

    public static double round2(double value) {
        return toAmount(value).doubleValue();
    }

    public static BigDecimal toAmount(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }

    public static String format(double amount, String currency) {
        return format(toAmount(amount), currency);
    }

    public static String format(BigDecimal amount, String currency) {
        String code = currency == null || currency.isBlank() ? "TRY" : currency.trim().toUpperCase(Locale.ROOT);
        return String.format(Locale.US, "%,.2f %s", amount.setScale(2, RoundingMode.HALF_UP), code);
    }
}
