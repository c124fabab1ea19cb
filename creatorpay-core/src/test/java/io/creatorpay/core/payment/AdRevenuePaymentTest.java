package io.creatorpay.core.payment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.random.RandomGenerator;
import org.junit.jupiter.api.Test;

class AdRevenuePaymentTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-21T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldComputeTaxOnEarningsAfterInvalidTrafficDeduction() {
        AdRevenuePayment payment = new AdRevenuePayment(CLOCK, "GameShip", 1_500, "TRY", "2026-01", 100_000, 15.0, "YouTube Partner");

        assertThat(payment.netEarnings()).isEqualTo(1_470.0);
        assertThat(payment.computeTax()).isEqualTo(Money.round2(1_470.0 * 0.18));
        assertThat(payment.computeTax()).isEqualTo(264.6);
        assertThat(payment.bonusApplied()).isFalse();
    }

    @Test
    void shouldAddPerformanceBonusAboveImpressionThreshold() {
        AdRevenuePayment payment = new AdRevenuePayment(CLOCK, "GameShip", 20_000, "TRY", "2026-01", 2_000_000, 10.0, "Unity Ads");

        assertThat(payment.netEarnings()).isEqualTo(20_600.0);
        assertThat(payment.computeTax()).isEqualTo(3_708.0);
        assertThat(payment.bonusApplied()).isTrue();
    }

    @Test
    void shouldDefaultUnknownPlatformAndWarnOnHighCpm() {
        AdRevenuePayment payment = new AdRevenuePayment(CLOCK, "GameShip", 10, "TRY", "2026-01", 1_000, 1_500.0, "MySpace Ads");

        assertThat(payment.platform()).isEqualTo(AdRevenuePayment.DEFAULT_PLATFORM);
        assertThat(payment.getLogs())
            .anyMatch(line -> line.contains("Unknown platform"))
            .anyMatch(line -> line.contains("high CPM"));
    }

    @Test
    void shouldRejectNegativeImpressionsAndCpm() {
        assertThatThrownBy(() -> new AdRevenuePayment(CLOCK, "GameShip", 10, "TRY", "2026-01", -1, 5.0, "Unity Ads"))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new AdRevenuePayment(CLOCK, "GameShip", 10, "TRY", "2026-01", 10, -5.0, "Unity Ads"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectNonFiniteCpm() {
        assertThatThrownBy(() -> new AdRevenuePayment(
            CLOCK, "GameShip", 10, "TRY", "2026-01", 10, Double.POSITIVE_INFINITY, "Unity Ads"
        ))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("CPM");
        assertThatThrownBy(() -> new AdRevenuePayment(CLOCK, "GameShip", 10, "TRY", "2026-01", 10, Double.NaN, "Unity Ads"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRecomputeAmountAndMetricsWhenImpressionsChange() {
        AdRevenuePayment payment = new AdRevenuePayment(CLOCK, "GameShip", 100, "TRY", "2026-01", 10_000, 10.0, "Unity Ads");

        payment.updateImpressions(200_000);

        assertThat(payment.impressions()).isEqualTo(200_000);
        assertThat(payment.amount()).isEqualTo(1_960.0);
        assertThat(payment.performanceMetrics().totalImpressions()).isEqualTo(200_000);
        assertThat(payment.performanceMetrics().validImpressions()).isEqualTo(196_000);
        assertThat(payment.performanceMetrics().estimatedClicks()).isEqualTo(3_000);
        assertThat(payment.getLogs()).anyMatch(line -> line.contains("10000 -> 200000"));
        assertThatThrownBy(() -> payment.updateImpressions(-3)).isInstanceOf(ValidationException.class);
        assertThat(payment.impressions()).isEqualTo(200_000);
    }

    @Test
    void shouldEscalatePriorityWhenRecomputedAmountIsLarge() {
        AdRevenuePayment payment = new AdRevenuePayment(CLOCK, "GameShip", 100, "TRY", "2026-01", 10_000, 20.0, "Unity Ads");

        payment.updateImpressions(5_000_000);

        assertThat(payment.amount()).isGreaterThan(50_000);
        assertThat(payment.priorityLevel()).isEqualTo(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldExposeFinancialAndAdMetricsInDetails() {
        AdRevenuePayment payment = new AdRevenuePayment(CLOCK, "GameShip", 1_500, "USD", "2026-01", 100_000, 15.0, "Facebook Ads");

        Map<String, Object> details = payment.details();

        assertThat(details).containsEntry("type", "AdRevenue").containsEntry("status", "pending");
        Map<String, Object> financial = (Map<String, Object>) details.get("financialData");
        assertThat(financial)
            .containsEntry("adjustedEarnings", 1_470.0)
            .containsEntry("taxAmount", 264.6)
            .containsEntry("netPayout", 1_205.4)
            .containsEntry("currency", "USD");
        Map<String, Object> metrics = (Map<String, Object>) details.get("adMetrics");
        assertThat(metrics).containsEntry("platform", "Facebook Ads").containsEntry("bonusApplied", false);
    }

    @Test
    void shouldHoldPaymentWhenFraudScreeningFlagsTraffic() {
        AdRevenuePayment payment = new AdRevenuePayment(CLOCK, "GameShip", 100, "TRY", "2026-01", 10_000, 10.0, "Unity Ads");

        assertThat(payment.screenForFraud(draw(0.5))).isTrue();
        assertThat(payment.status()).isEqualTo(PaymentStatus.PENDING);

        assertThat(payment.screenForFraud(draw(0.99))).isFalse();
        assertThat(payment.status()).isEqualTo(PaymentStatus.ON_HOLD);
    }

    private static RandomGenerator draw(double value) {
        return new RandomGenerator() {
            @Override
            public long nextLong() {
                return 0L;
            }

            @Override
            public double nextDouble() {
                return value;
            }
        };
    }
}
