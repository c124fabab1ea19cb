package io.creatorpay.cli;

import io.creatorpay.core.analytics.SystemHealth;
import io.creatorpay.core.payment.Money;
import io.creatorpay.core.store.StoreAuditEntry;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "health", description = "Analyze payment processing health")
public final class HealthCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--json", description = "Print the analysis as JSON")
    boolean json;

    public HealthCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            SystemHealth health = context.analyticsService().analyzeSystemHealth();
            if (json) {
                System.out.println(JsonOutput.pretty(health));
                return 0;
            }
            System.out.println("Status: " + health.status().label());
            System.out.println("Failure rate: " + health.failureRate() + "%");
            System.out.println("Total volume: " + Money.format(health.totalVolume(), "TRY"));
            System.out.println("Recent activity:");
            for (StoreAuditEntry entry : health.recentLogs()) {
                System.out.println("  " + entry);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Health analysis failed: " + e.getMessage());
            return 1;
        }
    }
}
