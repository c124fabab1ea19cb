package io.creatorpay.core.payment;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class MembershipPayment extends PaymentRecord {
    public static final String OTHER_TIER = "Other";

    static final double PLATFORM_FEE_RATE = 0.30;
    static final double REFUND_RESERVE_RATE = 0.05;
    static final double WITHHOLDING_RATE = 0.20;

    private final int totalSubscribers;
    private final Map<String, Integer> tierBreakdown;

    public MembershipPayment(
        String channelId,
        double amount,
        String currency,
        String period,
        int totalSubscribers,
        Map<String, Integer> tierBreakdown
    ) {
        this(Clock.systemDefaultZone(), channelId, amount, currency, period, totalSubscribers, tierBreakdown);
    }

    public MembershipPayment(
        Clock clock,
        String channelId,
        double amount,
        String currency,
        String period,
        int totalSubscribers,
        Map<String, Integer> tierBreakdown
    ) {
        super(clock, channelId, amount, currency, period);
        this.totalSubscribers = validateSubscribers(totalSubscribers);
        this.tierBreakdown = reconcileTiers(tierBreakdown);
    }

    @Override
    public PaymentKind kind() {
        return PaymentKind.MEMBERSHIP;
    }

    public int totalSubscribers() {
        return totalSubscribers;
    }

    public Map<String, Integer> tierBreakdown() {
        return Collections.unmodifiableMap(tierBreakdown);
    }

    @Override
    public double computeTax() {
        double netAfterFee = amount() * (1 - PLATFORM_FEE_RATE);
        double taxBase = netAfterFee * (1 - REFUND_RESERVE_RATE);
        return Money.round2(taxBase * WITHHOLDING_RATE);
    }

    public double platformShare() {
        return Money.round2(amount() * PLATFORM_FEE_RATE);
    }

    public double refundReserve() {
        return Money.round2(amount() * REFUND_RESERVE_RATE);
    }

    public double averageRevenuePerUser() {
        if (totalSubscribers <= 0) {
            return 0.0;
        }
        return Money.round2(amount() / totalSubscribers);
    }

    public double forecastNextMonth(double churnRate) {
        if (Double.isNaN(churnRate) || churnRate < 0 || churnRate > 1) {
            throw new ValidationException("Churn rate must be between 0 and 1: " + churnRate);
        }
        double retained = totalSubscribers * (1 - churnRate);
        double forecast = Money.round2(retained * averageRevenuePerUser());
        addLog("Next month forecast (churn " + (churnRate * 100) + "%): " + forecast);
        return forecast;
    }

    @Override
    public Map<String, Object> details() {
        Map<String, Object> revenue = new LinkedHashMap<>();
        revenue.put("grossAmount", amount());
        revenue.put("platformFee", platformShare());
        revenue.put("refundReserve", refundReserve());
        revenue.put("tax", computeTax());

        Map<String, Object> subscribers = new LinkedHashMap<>();
        subscribers.put("totalCount", totalSubscribers);
        subscribers.put("arpu", averageRevenuePerUser());
        subscribers.put("activeTiers", List.copyOf(tierBreakdown.keySet()));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", kind().label());
        details.put("id", id());
        details.put("channel", channelId());
        details.put("revenueBreakdown", revenue);
        details.put("subscriberStats", subscribers);
        details.put("tiers", new LinkedHashMap<>(tierBreakdown));
        details.put("status", status().wireValue());
        return details;
    }

    private static int validateSubscribers(int value) {
        if (value < 0) {
            throw new ValidationException("Subscriber count must not be negative: " + value);
        }
        return value;
    }

    private Map<String, Integer> reconcileTiers(Map<String, Integer> tiers) {
        Map<String, Integer> reconciled = new LinkedHashMap<>();
        if (tiers != null) {
            tiers.forEach((tier, count) -> reconciled.put(tier, count == null ? 0 : count));
        }
        int sum = reconciled.values().stream().mapToInt(Integer::intValue).sum();
        int shortfall = totalSubscribers - sum;
        if (shortfall > 0) {
            reconciled.merge(OTHER_TIER, shortfall, Integer::sum);
        } else if (shortfall < 0) {
            // surplus is reported, not corrected
            warn("Tier breakdown (" + sum + ") exceeds total subscribers (" + totalSubscribers + ").");
        }
        return reconciled;
    }
}
