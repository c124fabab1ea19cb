package io.creatorpay.core.analytics;

import io.creatorpay.core.config.model.RulesConfig;
import io.creatorpay.core.payment.Money;
import io.creatorpay.core.payment.PaymentRecord;
import io.creatorpay.core.payment.PaymentStatus;
import io.creatorpay.core.service.PeriodicReport;
import io.creatorpay.core.store.PaymentStore;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public final class AnalyticsService {
    private final PaymentStore store;
    private final RulesConfig rules;

    public AnalyticsService(PaymentStore store) {
        this(store, RulesConfig.defaults());
    }

    public AnalyticsService(PaymentStore store, RulesConfig rules) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    public PeriodComparison comparePeriods(PeriodicReport previous, PeriodicReport current) {
        BigDecimal oldValue = previous == null ? BigDecimal.ZERO : previous.grossIncome();
        BigDecimal newValue = current == null ? BigDecimal.ZERO : current.grossIncome();
        if (oldValue.signum() == 0) {
            return PeriodComparison.noPriorData();
        }
        double growth = newValue.subtract(oldValue)
            .multiply(BigDecimal.valueOf(100))
            .divide(oldValue, 2, RoundingMode.HALF_UP)
            .doubleValue();
        return new PeriodComparison(true, growth, String.format(Locale.US, "Growth rate: %.2f%%", growth));
    }

    public SystemHealth analyzeSystemHealth() {
        Map<PaymentStatus, Integer> distribution = store.getStatusDistribution();
        int failed = distribution.getOrDefault(PaymentStatus.FAILED, 0);
        int settled = failed + distribution.getOrDefault(PaymentStatus.COMPLETED, 0);
        double failureRate = settled == 0 ? 0.0 : Money.round2(failed * 100.0 / settled);
        HealthStatus status = failureRate < rules.healthWarningFailureRate() ? HealthStatus.HEALTHY : HealthStatus.WARNING;
        return new SystemHealth(
            status,
            failureRate,
            store.getTotalVolume(),
            store.getAuditLogs(rules.recentLogCount())
        );
    }

    public List<TopPerformer> getTopPerformers(int limit) {
        List<TopPerformer> ranked = new ArrayList<>();
        int rank = 1;
        for (PaymentRecord record : store.getTopPayments(limit)) {
            ranked.add(new TopPerformer(
                rank++,
                record.id(),
                record.channelId(),
                record.amount(),
                record.currency(),
                record.kind()
            ));
        }
        return List.copyOf(ranked);
    }
}
