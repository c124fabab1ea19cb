package io.creatorpay.core.payment;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

public final class AdRevenuePayment extends PaymentRecord {
    public static final List<String> KNOWN_PLATFORMS = List.of(
        "Google AdSense",
        "Facebook Ads",
        "Unity Ads",
        "TikTok Business",
        "YouTube Partner"
    );
    public static final String DEFAULT_PLATFORM = "Google AdSense";

    static final double INVALID_TRAFFIC_RATE = 0.02;
    static final long BONUS_THRESHOLD = 1_000_000;
    static final double BONUS_RATE = 0.05;
    static final double TAX_RATE = 0.18;
    static final double CLICK_THROUGH_RATE = 0.015;
    static final double CPM_WARNING_LEVEL = 1_000.0;
    static final double FRAUD_RISK_LIMIT = 0.98;

    private final double cpmRate;
    private final String platform;
    private long impressions;
    private AdPerformanceMetrics metrics;

    public AdRevenuePayment(String channelId, double amount, String currency, String period, long impressions, double cpmRate) {
        this(Clock.systemDefaultZone(), channelId, amount, currency, period, impressions, cpmRate, DEFAULT_PLATFORM);
    }

    public AdRevenuePayment(
        String channelId,
        double amount,
        String currency,
        String period,
        long impressions,
        double cpmRate,
        String platform
    ) {
        this(Clock.systemDefaultZone(), channelId, amount, currency, period, impressions, cpmRate, platform);
    }

    public AdRevenuePayment(
        Clock clock,
        String channelId,
        double amount,
        String currency,
        String period,
        long impressions,
        double cpmRate,
        String platform
    ) {
        super(clock, channelId, amount, currency, period);
        this.impressions = validateImpressions(impressions);
        this.cpmRate = validateCpm(cpmRate);
        this.platform = resolvePlatform(platform);
        this.metrics = buildMetrics();
    }

    @Override
    public PaymentKind kind() {
        return PaymentKind.AD_REVENUE;
    }

    public synchronized long impressions() {
        return impressions;
    }

    public double cpmRate() {
        return cpmRate;
    }

    public String platform() {
        return platform;
    }

    public synchronized AdPerformanceMetrics performanceMetrics() {
        return metrics;
    }

    public synchronized boolean bonusApplied() {
        return impressions > BONUS_THRESHOLD;
    }

    public synchronized double netEarnings() {
        double raw = (impressions / 1000.0) * cpmRate;
        double deduction = raw * INVALID_TRAFFIC_RATE;
        double bonus = impressions > BONUS_THRESHOLD ? raw * BONUS_RATE : 0.0;
        return Money.round2(raw - deduction + bonus);
    }

    @Override
    public double computeTax() {
        return Money.round2(netEarnings() * TAX_RATE);
    }

    public synchronized void updateImpressions(long newCount) {
        long previous = impressions;
        impressions = validateImpressions(newCount);
        setAmount(netEarnings());
        metrics = buildMetrics();
        addLog("Impressions updated: " + previous + " -> " + newCount + ". New earnings: " + amount());
    }

    /**
     * Flags suspicious traffic. A risk draw above the limit puts the payment on hold.
     *
     * @return {@code true} when the traffic passed the check
     */
    public boolean screenForFraud(RandomGenerator random) {
        double riskScore = random.nextDouble();
        if (riskScore > FRAUD_RISK_LIMIT) {
            setStatus(PaymentStatus.ON_HOLD);
            addLog("High-risk traffic detected (score " + riskScore + "). Payment put on hold.");
            return false;
        }
        return true;
    }

    @Override
    public synchronized Map<String, Object> details() {
        double earnings = netEarnings();
        double tax = computeTax();

        Map<String, Object> financial = new LinkedHashMap<>();
        financial.put("grossInput", amount());
        financial.put("adjustedEarnings", earnings);
        financial.put("taxAmount", tax);
        financial.put("netPayout", Money.round2(earnings - tax));
        financial.put("currency", currency());

        Map<String, Object> adMetrics = new LinkedHashMap<>();
        adMetrics.put("totalImpressions", metrics.totalImpressions());
        adMetrics.put("validImpressions", metrics.validImpressions());
        adMetrics.put("estimatedClicks", metrics.estimatedClicks());
        adMetrics.put("cpm", cpmRate);
        adMetrics.put("platform", platform);
        adMetrics.put("bonusApplied", bonusApplied());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", kind().label());
        details.put("id", id());
        details.put("channel", channelId());
        details.put("financialData", financial);
        details.put("adMetrics", adMetrics);
        details.put("status", status().wireValue());
        return details;
    }

    private AdPerformanceMetrics buildMetrics() {
        return new AdPerformanceMetrics(
            impressions,
            (long) (impressions * (1 - INVALID_TRAFFIC_RATE)),
            (long) (impressions * CLICK_THROUGH_RATE),
            cpmRate,
            platform
        );
    }

    private static long validateImpressions(long value) {
        if (value < 0) {
            throw new ValidationException("Impression count must not be negative: " + value);
        }
        return value;
    }

    private double validateCpm(double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new ValidationException("CPM rate must be a finite, non-negative number: " + value);
        }
        if (value > CPM_WARNING_LEVEL) {
            warn("Abnormally high CPM rate detected: " + value);
        }
        return value;
    }

    private String resolvePlatform(String value) {
        String candidate = value == null ? "" : value.trim();
        if (!KNOWN_PLATFORMS.contains(candidate)) {
            warn("Unknown platform '" + value + "'. Defaulted to " + DEFAULT_PLATFORM);
            return DEFAULT_PLATFORM;
        }
        return candidate;
    }
}
