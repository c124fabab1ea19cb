package io.creatorpay.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.creatorpay.core.analytics.AnalyticsService;
import io.creatorpay.core.config.ConfigService;
import io.creatorpay.core.config.model.StoreConfig;
import io.creatorpay.core.payment.AdRevenuePayment;
import io.creatorpay.core.payment.SponsorshipPayment;
import io.creatorpay.core.service.RevenueService;
import io.creatorpay.core.store.InMemoryPaymentStore;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ReportCommandTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-21T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private CliContext context;

    @BeforeEach
    void setUp() {
        InMemoryPaymentStore store = new InMemoryPaymentStore(StoreConfig.defaults(), CLOCK);
        RevenueService revenueService = new RevenueService(store, new Random(7));
        revenueService.createPaymentRecord(
            new AdRevenuePayment(CLOCK, "MusicBox", 1500, "TRY", "2025-04", 100_000, 15.0, "Google AdSense")
        );
        revenueService.createPaymentRecord(
            new SponsorshipPayment(CLOCK, "MusicBox", 50_000, "TRY", "2025-04", "TechCorp", "CNT-4411")
        );
        revenueService.createPaymentRecord(
            new SponsorshipPayment(CLOCK, "MusicBox", 40_000, "TRY", "2025-03", "TechCorp", "CNT-4410")
        );
        context = new CliContext(revenueService, new AnalyticsService(store), new ConfigService(), tempDir.resolve("config.json"));
        System.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void shouldPrintReportWithBreakdown() {
        int exitCode = new CommandLine(new ReportCommand(context)).execute("--channel", "MusicBox", "--period", "2025-04");

        String text = output.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(text).contains("Revenue report: MusicBox / 2025-04");
        assertThat(text).contains("Transactions: 2");
        assertThat(text).contains("Gross income: 51,500.00 TRY");
        assertThat(text).contains("AdRevenue: 1,500.00 TRY");
        assertThat(text).contains("Sponsorship: 50,000.00 TRY");
        assertThat(text).doesNotContain("Membership:");
    }

    @Test
    void shouldReportEmptyPeriod() {
        int exitCode = new CommandLine(new ReportCommand(context)).execute("--channel", "MusicBox", "--period", "2024-12");

        String text = output.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(text).contains("Transactions: 0");
        assertThat(text).contains("Gross income: 0.00 TRY");
        assertThat(text).contains("No records found for this period.");
    }

    @Test
    void shouldPrintReportAsJson() {
        int exitCode = new CommandLine(new ReportCommand(context))
            .execute("--channel", "MusicBox", "--period", "2025-04", "--json");

        String text = output.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(text).contains("\"channelId\" : \"MusicBox\"");
        assertThat(text).contains("\"transactionCount\" : 2");
        assertThat(text).contains("\"SPONSORSHIP\"");
    }

    @Test
    void shouldCompareTwoPeriods() {
        int exitCode = new CommandLine(new CompareCommand(context))
            .execute("--channel", "MusicBox", "--from", "2025-03", "--to", "2025-04");

        assertThat(exitCode).isZero();
        assertThat(output.toString(StandardCharsets.UTF_8)).contains("2025-03 -> 2025-04: Growth rate: 28.75%");
    }

    @Test
    void shouldRequireChannelOption() {
        int exitCode = new CommandLine(new ReportCommand(context)).execute("--period", "2025-04");

        assertThat(exitCode).isNotZero();
    }
}
