package io.creatorpay.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "hold", description = "Put pending payments at or below a threshold on hold")
public final class HoldCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--threshold", description = "Minimum payout threshold (defaults to the configured value)")
    Double threshold;

    public HoldCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (threshold != null && threshold < 0) {
            System.err.println("Threshold must not be negative.");
            return 1;
        }
        int moved = threshold == null
            ? context.revenueService().holdLowPayments()
            : context.revenueService().holdLowPayments(threshold);
        System.out.println("Payments moved to on_hold: " + moved);
        return 0;
    }
}
