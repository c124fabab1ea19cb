package io.creatorpay.cli;

import io.creatorpay.core.analytics.PeriodComparison;
import io.creatorpay.core.service.PeriodicReport;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "compare", description = "Compare gross income of a channel between two periods")
public final class CompareCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--channel", required = true, description = "Channel id")
    String channelId;

    @Option(names = "--from", required = true, description = "Baseline period as YYYY-MM")
    String from;

    @Option(names = "--to", required = true, description = "Compared period as YYYY-MM")
    String to;

    public CompareCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        PeriodicReport baseline = context.revenueService().generatePeriodicReport(channelId, from);
        PeriodicReport current = context.revenueService().generatePeriodicReport(channelId, to);
        PeriodComparison comparison = context.analyticsService().comparePeriods(baseline, current);
        System.out.println(from + " -> " + to + ": " + comparison.summary());
        return 0;
    }
}
