package io.creatorpay.core.payment;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single revenue payment owed to a channel.
 *
 * <p>Identity, channel, currency and period are fixed at construction. Amount and status change only
 * through {@link #setAmount(double)} and {@link #setStatus(PaymentStatus)}, and every such change is
 * appended to the record's audit log. Malformed currency and period input is corrected with a warning
 * instead of rejected.
 */
public abstract sealed class PaymentRecord permits AdRevenuePayment, MembershipPayment, SponsorshipPayment {
    private static final Logger LOG = LoggerFactory.getLogger(PaymentRecord.class);

    public static final String DEFAULT_CURRENCY = "TRY";
    public static final int MIN_CHANNEL_ID_LENGTH = 3;
    public static final double ESCALATION_THRESHOLD = 50_000;

    private static final Pattern PERIOD_PATTERN = Pattern.compile("^\\d{4}-(0[1-9]|1[0-2])$");
    private static final Pattern CURRENCY_PATTERN = Pattern.compile("^[A-Z]{3,}$");
    private static final DateTimeFormatter LOG_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String id;
    private final Clock clock;
    private final Instant createdAt;
    private final String channelId;
    private final String currency;
    private final String period;
    private final List<String> auditLog = new ArrayList<>();

    private Instant updatedAt;
    private double amount;
    private PaymentStatus status;
    private int priorityLevel;

    protected PaymentRecord(Clock clock, String channelId, double amount, String currency, String period) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.id = UUID.randomUUID().toString();
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
        this.channelId = validateChannelId(channelId);
        this.amount = validateAmount(amount);
        this.currency = normalizeCurrency(currency);
        this.period = normalizePeriod(period);
        this.status = PaymentStatus.PENDING;
        this.priorityLevel = priorityFor(amount);
        addLog("Payment created. ID: " + id + ", amount: " + amount + " " + this.currency);
    }

    public abstract PaymentKind kind();

    public abstract double computeTax();

    public abstract Map<String, Object> details();

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized Instant updatedAt() {
        return updatedAt;
    }

    public String channelId() {
        return channelId;
    }

    public String currency() {
        return currency;
    }

    public String period() {
        return period;
    }

    public synchronized double amount() {
        return amount;
    }

    public synchronized PaymentStatus status() {
        return status;
    }

    public synchronized int priorityLevel() {
        return priorityLevel;
    }

    public synchronized void setAmount(double value) {
        double validated = validateAmount(value);
        double previous = amount;
        amount = validated;
        updatedAt = clock.instant();
        if (validated > ESCALATION_THRESHOLD) {
            priorityLevel = 1;
        }
        addLog("Amount updated: " + previous + " -> " + validated);
    }

    public synchronized void setStatus(PaymentStatus newStatus) {
        if (newStatus == null) {
            throw new InvalidTransitionException(null);
        }
        status = newStatus;
        updatedAt = clock.instant();
        addLog("Status updated: " + newStatus.wireValue());
    }

    public void setStatus(String newStatus) {
        setStatus(PaymentStatus.fromValue(newStatus));
    }

    public synchronized boolean isPayable() {
        return (status == PaymentStatus.PENDING || status == PaymentStatus.ON_HOLD) && amount > 0;
    }

    public synchronized void addLog(String message) {
        String timestamp = LOG_TIMESTAMP.format(clock.instant().atZone(clock.getZone()));
        auditLog.add("[" + timestamp + "] " + message);
    }

    public synchronized List<String> getLogs() {
        return List.copyOf(auditLog);
    }

    protected Clock clock() {
        return clock;
    }

    protected void warn(String message) {
        LOG.warn("Payment {} ({}): {}", id, channelId, message);
        addLog("Warning: " + message);
    }

    static int priorityFor(double amount) {
        if (amount > 100_000) {
            return 1;
        }
        if (amount > 10_000) {
            return 2;
        }
        if (amount > 1_000) {
            return 3;
        }
        return 4;
    }

    private static String validateChannelId(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.length() < MIN_CHANNEL_ID_LENGTH) {
            throw new ValidationException("Channel id must be at least " + MIN_CHANNEL_ID_LENGTH + " characters: '" + trimmed + "'");
        }
        return trimmed;
    }

    private static double validateAmount(double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new ValidationException("Amount must be a finite, non-negative number: " + value);
        }
        return value;
    }

    private String normalizeCurrency(String value) {
        String candidate = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        if (candidate.length() == 3 && CURRENCY_PATTERN.matcher(candidate).matches()) {
            return candidate;
        }
        if (CURRENCY_PATTERN.matcher(candidate).matches()) {
            String truncated = candidate.substring(0, 3);
            warn("Currency '" + value + "' truncated to " + truncated);
            return truncated;
        }
        warn("Invalid currency '" + value + "'. Defaulted to " + DEFAULT_CURRENCY);
        return DEFAULT_CURRENCY;
    }

    private String normalizePeriod(String value) {
        String candidate = value == null ? "" : value.trim();
        if (PERIOD_PATTERN.matcher(candidate).matches()) {
            return candidate;
        }
        String fallback = YearMonth.now(clock).toString();
        warn("Invalid period '" + value + "'. Defaulted to " + fallback);
        return fallback;
    }

    @Override
    public String toString() {
        return kind().label() + "(id=" + id + ", channel=" + channelId + ", amount=" + amount()
            + " " + currency + ", status=" + status() + ")";
    }
}
