package io.creatorpay.cli;

import io.creatorpay.core.analytics.TopPerformer;
import io.creatorpay.core.payment.Money;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "top", description = "List the highest value payments")
public final class TopCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--limit", defaultValue = "5", description = "Number of payments to list")
    int limit;

    public TopCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        List<TopPerformer> top = context.analyticsService().getTopPerformers(limit);
        if (top.isEmpty()) {
            System.out.println("No payments recorded.");
            return 0;
        }
        for (TopPerformer performer : top) {
            System.out.println(performer.rank() + ". " + performer.channelId()
                + " " + Money.format(performer.amount(), performer.currency())
                + " (" + performer.kind().label() + ")");
        }
        return 0;
    }
}
