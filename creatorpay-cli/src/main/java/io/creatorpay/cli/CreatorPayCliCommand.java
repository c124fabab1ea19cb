package io.creatorpay.cli;

import io.creatorpay.core.payment.PaymentStatus;
import java.util.Map;
import picocli.CommandLine.Command;

@Command(name = "creatorpay", mixinStandardHelpOptions = true, description = "Creator revenue payment tracking")
public final class CreatorPayCliCommand implements Runnable {
    private final CliContext context;

    public CreatorPayCliCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public void run() {
        // Without a subcommand, summarize what the store holds.
        System.out.println("Payment records: " + context.store().count());
        for (Map.Entry<PaymentStatus, Integer> entry : context.store().getStatusDistribution().entrySet()) {
            if (entry.getValue() > 0) {
                System.out.println("  " + entry.getKey().wireValue() + ": " + entry.getValue());
            }
        }
        System.out.println("Run with --help to list commands.");
    }
}
