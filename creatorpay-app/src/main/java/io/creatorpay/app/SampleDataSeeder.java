package io.creatorpay.app;

import io.creatorpay.core.payment.AdRevenuePayment;
import io.creatorpay.core.payment.MembershipPayment;
import io.creatorpay.core.payment.PaymentRecord;
import io.creatorpay.core.payment.SponsorshipPayment;
import io.creatorpay.core.service.ProcessResult;
import io.creatorpay.core.service.RevenueService;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SampleDataSeeder {
    private static final Logger LOG = LoggerFactory.getLogger(SampleDataSeeder.class);

    static final List<String> CHANNELS = List.of("UlasDemir", "PythonLessons", "GameShip", "MusicBox", "VlogTr");
    static final List<String> PERIODS = List.of("2025-01", "2025-02", "2025-03");
    static final double PROCESSING_SHARE = 0.3;

    private final RevenueService revenueService;
    private final RandomGenerator random;
    private final Clock clock;

    public SampleDataSeeder(RevenueService revenueService, RandomGenerator random, Clock clock) {
        this.revenueService = Objects.requireNonNull(revenueService, "revenueService must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public int seed(int count) {
        int created = 0;
        for (int i = 0; i < count; i++) {
            PaymentRecord record = next();
            ProcessResult result = revenueService.createPaymentRecord(record);
            if (!result.success()) {
                LOG.warn("Sample record for {} skipped: {}", record.channelId(), result.message());
                continue;
            }
            created++;
            if (random.nextDouble() < PROCESSING_SHARE) {
                revenueService.simulatePaymentProcessing(record.id());
            }
        }
        LOG.info("Seeded {} sample payment records", created);
        return created;
    }

    private PaymentRecord next() {
        String channel = CHANNELS.get(random.nextInt(CHANNELS.size()));
        String period = PERIODS.get(random.nextInt(PERIODS.size()));
        return switch (random.nextInt(3)) {
            case 0 -> {
                long impressions = random.nextLong(1_000, 500_001);
                double cpm = random.nextDouble(5.0, 25.0);
                yield new AdRevenuePayment(
                    clock, channel, impressions / 1000.0 * cpm, "TRY", period, impressions, cpm, AdRevenuePayment.DEFAULT_PLATFORM
                );
            }
            case 1 -> {
                int subscribers = random.nextInt(10, 5_001);
                yield new MembershipPayment(
                    clock,
                    channel,
                    subscribers * 15.0,
                    "TRY",
                    period,
                    subscribers,
                    Map.of("Gold", (int) (subscribers * 0.1), "Silver", (int) (subscribers * 0.9))
                );
            }
            default -> new SponsorshipPayment(
                clock,
                channel,
                random.nextDouble(5_000, 100_000),
                "TRY",
                period,
                "Sponsor_" + random.nextInt(1, 21),
                "CNT-" + random.nextInt(1_000, 10_000)
            );
        };
    }
}
