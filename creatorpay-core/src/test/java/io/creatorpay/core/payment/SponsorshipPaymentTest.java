package io.creatorpay.core.payment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;
import org.junit.jupiter.api.Test;

class SponsorshipPaymentTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-21T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldComputeCorporateTaxPlusStampDuty() {
        SponsorshipPayment payment = sponsorship(10_000, "Acme Corp", "SP-2026-01");

        assertThat(payment.computeTax()).isEqualTo(2_094.8);
        assertThat(payment.contractId()).isEqualTo("SP-2026-01");
        assertThat(payment.sponsorName()).isEqualTo("Acme Corp");
    }

    @Test
    void shouldReplaceMalformedContractIdAndShortSponsorName() {
        SponsorshipPayment payment = sponsorship(10_000, " A ", "2026-77");

        assertThat(payment.sponsorName()).isEqualTo(SponsorshipPayment.UNKNOWN_SPONSOR);
        assertThat(payment.contractId()).matches("CNT-[0-9A-F]{6}");
        assertThat(payment.getLogs()).anyMatch(line -> line.contains("Malformed contract id"));
    }

    @Test
    void shouldMarkInvoiceSentOnlyOnce() {
        SponsorshipPayment payment = sponsorship(10_000, "Acme Corp", "CNT-1");

        payment.markInvoiceSent();
        payment.markInvoiceSent();

        assertThat(payment.invoiceSent()).isTrue();
        assertThat(payment.getLogs()).filteredOn(line -> line.contains("INV-20260221-")).hasSize(1);
        assertThat(payment.getLogs()).anyMatch(line -> line.contains("Invoice already sent"));
    }

    @Test
    void shouldBuildInstallmentPlan() {
        SponsorshipPayment payment = sponsorship(10_000, "Acme Corp", "CNT-1");

        payment.buildInstallmentPlan(3);

        assertThat(payment.installmentCount()).isEqualTo(3);
        assertThat(payment.installmentAmount()).isEqualTo(3_333.33);
        assertThatThrownBy(() -> payment.buildInstallmentPlan(0)).isInstanceOf(ValidationException.class);
        assertThat(payment.installmentCount()).isEqualTo(3);
    }

    @Test
    void shouldReportDeliveryStateInDetails() {
        SponsorshipPayment payment = sponsorship(10_000, "Acme Corp", "CNT-1");
        payment.confirmDelivery();

        assertThat(payment.deliveryConfirmed()).isTrue();
        assertThat(payment.details()).containsEntry("type", "Sponsorship");
        assertThat(payment.details().get("contractInfo").toString()).contains("deliverablesStatus=approved");
    }

    @Test
    void shouldDrawInvoiceNumberFromSuppliedGenerator() {
        SponsorshipPayment first = sponsorship(10_000, "Acme Corp", "CNT-1");
        SponsorshipPayment second = sponsorship(10_000, "Acme Corp", "CNT-2");
        int expected = new Random(11).nextInt(1000, 10_000);

        first.markInvoiceSent(new Random(11));
        second.markInvoiceSent(new Random(11));

        assertThat(first.getLogs()).anyMatch(line -> line.contains("Invoice INV-20260221-" + expected + " issued and sent to Acme Corp."));
        assertThat(lastLine(first)).isEqualTo(lastLine(second));
    }

    private static String lastLine(SponsorshipPayment payment) {
        return payment.getLogs().get(payment.getLogs().size() - 1);
    }

    private static SponsorshipPayment sponsorship(double amount, String sponsor, String contractId) {
        return new SponsorshipPayment(CLOCK, "VlogDaily", amount, "TRY", "2026-01", sponsor, contractId);
    }
}
