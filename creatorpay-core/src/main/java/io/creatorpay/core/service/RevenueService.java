package io.creatorpay.core.service;

import io.creatorpay.core.config.model.ProcessingConfig;
import io.creatorpay.core.config.model.RulesConfig;
import io.creatorpay.core.payment.AdRevenuePayment;
import io.creatorpay.core.payment.PaymentException;
import io.creatorpay.core.payment.PaymentKind;
import io.creatorpay.core.payment.PaymentRecord;
import io.creatorpay.core.payment.PaymentStatus;
import io.creatorpay.core.payment.SponsorshipPayment;
import io.creatorpay.core.payment.ValidationException;
import io.creatorpay.core.store.PaymentStore;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RevenueService {
    private static final Logger LOG = LoggerFactory.getLogger(RevenueService.class);

    private final PaymentStore store;
    private final ProcessingConfig processing;
    private final RulesConfig rules;
    private final RandomGenerator random;
    private final Clock clock;

    public RevenueService(PaymentStore store, RandomGenerator random) {
        this(store, ProcessingConfig.defaults(), RulesConfig.defaults(), random, Clock.systemUTC());
    }

    public RevenueService(
        PaymentStore store,
        ProcessingConfig processing,
        RulesConfig rules,
        RandomGenerator random,
        Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.processing = Objects.requireNonNull(processing, "processing must not be null");
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public PaymentStore store() {
        return store;
    }

    public ProcessResult createPaymentRecord(PaymentRecord record) {
        Instant now = clock.instant();
        if (record == null) {
            return ProcessResult.failure("", "Payment record is required.", now);
        }
        if (!record.isPayable()) {
            return ProcessResult.failure("", "Amount must be greater than zero and status pending or on_hold.", now);
        }
        if (!store.supportsCurrency(record.currency())) {
            return ProcessResult.failure("", "Unsupported currency: " + record.currency(), now);
        }
        try {
            store.save(record);
        } catch (PaymentException e) {
            LOG.warn("Payment record {} rejected: {}", record.id(), e.getMessage());
            return ProcessResult.failure("", e.getMessage(), now);
        }
        LOG.info("Created {} payment {} for channel {}", record.kind().label(), record.id(), record.channelId());
        return ProcessResult.success(record.id(), "Payment record created.", now);
    }

    public Optional<PaymentRecord> findPayment(String id) {
        return store.findById(id);
    }

    public ProcessResult simulatePaymentProcessing(String id) {
        Instant now = clock.instant();
        AtomicReference<ProcessResult> outcome = new AtomicReference<>();
        try {
            Optional<PaymentRecord> found = store.update(id, record -> outcome.set(process(record, now)));
            if (found.isEmpty()) {
                return ProcessResult.failure("", "Payment not found.", now);
            }
            return outcome.get();
        } catch (PaymentException e) {
            LOG.warn("Processing of payment {} failed: {}", id, e.getMessage());
            return ProcessResult.failure(id, e.getMessage(), now);
        }
    }

    public PeriodicReport generatePeriodicReport(String channelId, String period) {
        String channel = channelId == null ? "" : channelId.trim();
        String targetPeriod = period == null ? "" : period.trim();
        List<PaymentRecord> matching = store.findAllByChannel(channel).stream()
            .filter(record -> record.period().equals(targetPeriod))
            .toList();

        Map<PaymentKind, BigDecimal> breakdown = new EnumMap<>(PaymentKind.class);
        for (PaymentKind kind : PaymentKind.values()) {
            breakdown.put(kind, BigDecimal.ZERO);
        }
        BigDecimal tax = BigDecimal.ZERO;
        for (PaymentRecord record : matching) {
            breakdown.merge(record.kind(), BigDecimal.valueOf(record.amount()), BigDecimal::add);
            tax = tax.add(BigDecimal.valueOf(record.computeTax()));
        }
        breakdown.replaceAll((kind, value) -> value.setScale(2, RoundingMode.HALF_UP));

        BigDecimal gross = breakdown.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal estimatedTax = tax.setScale(2, RoundingMode.HALF_UP);
        return new PeriodicReport(
            channel,
            targetPeriod,
            gross,
            estimatedTax,
            gross.subtract(estimatedTax),
            breakdown,
            matching.size()
        );
    }

    public int holdLowPayments() {
        return holdLowPayments(rules.holdThreshold());
    }

    public int holdLowPayments(double threshold) {
        AtomicInteger moved = new AtomicInteger();
        for (PaymentRecord candidate : store.findByStatus(PaymentStatus.PENDING)) {
            store.update(candidate.id(), record -> {
                if (record.status() == PaymentStatus.PENDING && record.amount() > 0 && record.amount() <= threshold) {
                    record.setStatus(PaymentStatus.ON_HOLD);
                    record.addLog("Put on hold: below minimum payout threshold (" + threshold + ").");
                    moved.incrementAndGet();
                }
            });
        }
        LOG.info("{} payments moved to on_hold (threshold {})", moved.get(), threshold);
        return moved.get();
    }

    public List<PaymentRecord> filterPaymentsByStatus(String channelId, PaymentStatus status) {
        return store.findAllByChannel(channelId).stream()
            .filter(record -> record.status() == status)
            .toList();
    }

    public List<PaymentRecord> filterPaymentsByStatus(String channelId, String status) {
        return PaymentStatus.find(status)
            .map(resolved -> filterPaymentsByStatus(channelId, resolved))
            .orElse(List.of());
    }

    public int bulkStatusUpdate(Collection<String> ids, String newStatus) {
        Optional<PaymentStatus> status = PaymentStatus.find(newStatus);
        if (status.isEmpty()) {
            LOG.warn("Bulk update skipped: invalid status '{}'", newStatus);
            return 0;
        }
        return bulkStatusUpdate(ids, status.get());
    }

    public int bulkStatusUpdate(Collection<String> ids, PaymentStatus newStatus) {
        if (ids == null || newStatus == null) {
            return 0;
        }
        int updated = 0;
        for (String id : ids) {
            try {
                if (store.update(id, record -> record.setStatus(newStatus)).isPresent()) {
                    updated++;
                }
            } catch (PaymentException e) {
                LOG.debug("Bulk update skipped payment {}: {}", id, e.getMessage());
            }
        }
        return updated;
    }

    public BigDecimal calculateTotalTaxLiability(Collection<? extends PaymentRecord> records) {
        if (records == null) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return records.stream()
            .map(record -> BigDecimal.valueOf(record.computeTax()))
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.HALF_UP);
    }

    public ProcessResult updateImpressions(String id, long impressions) {
        return mutate(id, "Impressions updated.", record -> {
            if (!(record instanceof AdRevenuePayment ad)) {
                throw new ValidationException("Payment " + id + " is not ad revenue.");
            }
            ad.updateImpressions(impressions);
        });
    }

    public ProcessResult markInvoiceSent(String id) {
        return mutate(id, "Invoice marked as sent.", record -> {
            if (!(record instanceof SponsorshipPayment sponsorship)) {
                throw new ValidationException("Payment " + id + " is not a sponsorship.");
            }
            sponsorship.markInvoiceSent(random);
        });
    }

    public ProcessResult screenAdTraffic(String id) {
        Instant now = clock.instant();
        AtomicReference<Boolean> passed = new AtomicReference<>(Boolean.TRUE);
        ProcessResult result = mutate(id, "Traffic screening completed.", record -> {
            if (!(record instanceof AdRevenuePayment ad)) {
                throw new ValidationException("Payment " + id + " is not ad revenue.");
            }
            passed.set(ad.screenForFraud(random));
        });
        if (result.success() && !passed.get()) {
            LOG.warn("Payment {} put on hold after traffic screening", id);
            return ProcessResult.failure(id, "High-risk traffic detected. Payment put on hold.", now);
        }
        return result;
    }

    public ProcessResult deletePaymentRecord(String id) {
        Instant now = clock.instant();
        if (!store.delete(id)) {
            return ProcessResult.failure("", "Payment not found.", now);
        }
        return ProcessResult.success(id, "Payment record deleted.", now);
    }

    private ProcessResult process(PaymentRecord record, Instant now) {
        if (record.status() == PaymentStatus.COMPLETED) {
            return ProcessResult.failure(record.id(), "Payment already completed.", now);
        }
        if (record.amount() > processing.manualReviewThreshold() && record.status() != PaymentStatus.PROCESSING) {
            record.setStatus(PaymentStatus.PROCESSING);
            record.addLog("Amount above " + processing.manualReviewThreshold() + ". Routed to manual review.");
            LOG.info("Payment {} routed to manual review", record.id());
            return ProcessResult.success(record.id(), "Payment routed to manual review.", now);
        }

        boolean approved = random.nextDouble() < processing.successProbability();
        if (approved) {
            record.setStatus(PaymentStatus.COMPLETED);
            record.addLog("Bank approval received. Transfer completed.");
            LOG.info("Simulated bank response for {}: approved", record.id());
            return ProcessResult.success(record.id(), "Transfer succeeded.", now);
        }
        record.setStatus(PaymentStatus.FAILED);
        record.addLog("Bank rejection: insufficient balance or technical error.");
        LOG.info("Simulated bank response for {}: rejected", record.id());
        return ProcessResult.failure(record.id(), "Transfer failed.", now);
    }

    private ProcessResult mutate(String id, String okMessage, Consumer<PaymentRecord> mutation) {
        Instant now = clock.instant();
        try {
            if (store.update(id, mutation).isEmpty()) {
                return ProcessResult.failure("", "Payment not found.", now);
            }
            return ProcessResult.success(id, okMessage, now);
        } catch (PaymentException e) {
            LOG.warn("Update of payment {} rejected: {}", id, e.getMessage());
            return ProcessResult.failure(id, e.getMessage(), now);
        }
    }
}
