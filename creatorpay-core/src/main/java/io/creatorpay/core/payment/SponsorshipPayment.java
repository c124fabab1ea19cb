package io.creatorpay.core.payment;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

public final class SponsorshipPayment extends PaymentRecord {
    public static final String UNKNOWN_SPONSOR = "Unknown Sponsor";

    static final double CORPORATE_TAX_RATE = 0.20;
    static final double STAMP_DUTY_RATE = 0.00948;

    private static final DateTimeFormatter INVOICE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final String sponsorName;
    private final String contractId;
    private int installmentCount = 1;
    private boolean invoiceSent;
    private boolean deliveryConfirmed;

    public SponsorshipPayment(String channelId, double amount, String currency, String period, String sponsorName, String contractId) {
        this(Clock.systemDefaultZone(), channelId, amount, currency, period, sponsorName, contractId);
    }

    public SponsorshipPayment(
        Clock clock,
        String channelId,
        double amount,
        String currency,
        String period,
        String sponsorName,
        String contractId
    ) {
        super(clock, channelId, amount, currency, period);
        this.sponsorName = normalizeSponsor(sponsorName);
        this.contractId = resolveContractId(contractId);
    }

    @Override
    public PaymentKind kind() {
        return PaymentKind.SPONSORSHIP;
    }

    public String sponsorName() {
        return sponsorName;
    }

    public String contractId() {
        return contractId;
    }

    public synchronized int installmentCount() {
        return installmentCount;
    }

    public synchronized boolean invoiceSent() {
        return invoiceSent;
    }

    public synchronized boolean deliveryConfirmed() {
        return deliveryConfirmed;
    }

    @Override
    public double computeTax() {
        return Money.round2(amount() * (CORPORATE_TAX_RATE + STAMP_DUTY_RATE));
    }

    public void markInvoiceSent() {
        markInvoiceSent(ThreadLocalRandom.current());
    }

    public synchronized void markInvoiceSent(RandomGenerator random) {
        Objects.requireNonNull(random, "random must not be null");
        if (invoiceSent) {
            addLog("Invoice already sent.");
            return;
        }
        invoiceSent = true;
        String invoiceNumber = "INV-" + INVOICE_DATE.format(clock().instant().atZone(clock().getZone()))
            + "-" + random.nextInt(1000, 10_000);
        addLog("Invoice " + invoiceNumber + " issued and sent to " + sponsorName + ".");
    }

    public synchronized void buildInstallmentPlan(int installments) {
        if (installments < 1) {
            throw new ValidationException("Installment count must be at least 1: " + installments);
        }
        installmentCount = installments;
        addLog("Payment plan updated to " + installments + " installments.");
    }

    public synchronized double installmentAmount() {
        return Money.round2(amount() / installmentCount);
    }

    public synchronized void confirmDelivery() {
        deliveryConfirmed = true;
        addLog("Sponsored deliverables marked as completed.");
    }

    @Override
    public synchronized Map<String, Object> details() {
        Map<String, Object> contract = new LinkedHashMap<>();
        contract.put("sponsor", sponsorName);
        contract.put("contractId", contractId);
        contract.put("deliverablesStatus", deliveryConfirmed ? "approved" : "pending");

        Map<String, Object> payment = new LinkedHashMap<>();
        payment.put("totalAmount", amount());
        payment.put("installmentsCount", installmentCount);
        payment.put("amountPerInstallment", installmentAmount());
        payment.put("invoiceSent", invoiceSent);
        payment.put("tax", computeTax());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", kind().label());
        details.put("id", id());
        details.put("channel", channelId());
        details.put("contractInfo", contract);
        details.put("paymentInfo", payment);
        details.put("status", status().wireValue());
        return details;
    }

    private static String normalizeSponsor(String value) {
        if (value == null || value.trim().length() < 2) {
            return UNKNOWN_SPONSOR;
        }
        return value.trim();
    }

    private String resolveContractId(String value) {
        if (value != null && (value.startsWith("CNT-") || value.startsWith("SP-"))) {
            return value;
        }
        String generated = "CNT-" + UUID.randomUUID().toString().replace("-", "").substring(0, 6).toUpperCase(Locale.ROOT);
        warn("Malformed contract id '" + value + "'. Assigned " + generated);
        return generated;
    }
}
