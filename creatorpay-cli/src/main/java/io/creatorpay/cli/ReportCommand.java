package io.creatorpay.cli;

import io.creatorpay.core.payment.Money;
import io.creatorpay.core.payment.PaymentKind;
import io.creatorpay.core.service.PeriodicReport;
import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "report", description = "Show the periodic revenue report of a channel")
public final class ReportCommand implements Callable<Integer> {
    private static final String CURRENCY = "TRY";

    private final CliContext context;

    @Option(names = "--channel", required = true, description = "Channel id")
    String channelId;

    @Option(names = "--period", required = true, description = "Period as YYYY-MM")
    String period;

    @Option(names = "--json", description = "Print the report as JSON")
    boolean json;

    public ReportCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (channelId.isBlank() || period.isBlank()) {
            System.err.println("Channel id and period must not be blank.");
            return 1;
        }
        try {
            PeriodicReport report = context.revenueService().generatePeriodicReport(channelId, period);
            if (json) {
                System.out.println(JsonOutput.pretty(report));
                return 0;
            }
            System.out.println("Revenue report: " + report.channelId() + " / " + report.period());
            System.out.println("Transactions: " + report.transactionCount());
            System.out.println("Gross income: " + Money.format(report.grossIncome(), CURRENCY));
            System.out.println("Estimated tax: " + Money.format(report.estimatedTax(), CURRENCY));
            System.out.println("Net projection: " + Money.format(report.netProjection(), CURRENCY));
            if (report.transactionCount() == 0) {
                System.out.println("No records found for this period.");
                return 0;
            }
            System.out.println("Breakdown:");
            for (Map.Entry<PaymentKind, BigDecimal> entry : report.breakdown().entrySet()) {
                if (entry.getValue().signum() > 0) {
                    System.out.println("  " + entry.getKey().label() + ": " + Money.format(entry.getValue(), CURRENCY));
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Report failed: " + e.getMessage());
            return 1;
        }
    }
}
