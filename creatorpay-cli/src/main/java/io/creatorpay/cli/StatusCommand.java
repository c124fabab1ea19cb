package io.creatorpay.cli;

import io.creatorpay.core.config.model.CreatorPayConfig;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CreatorPayConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Store capacity: " + config.store().maxCapacity());
            System.out.println("Success probability: " + config.processing().successProbability());
            System.out.println("Manual review threshold: " + config.processing().manualReviewThreshold());
            System.out.println("Hold threshold: " + config.rules().holdThreshold());
            System.out.println("Sample data: " + (config.sampleData().enabled() ? config.sampleData().count() + " records" : "disabled"));
            List<String> problems = context.configService().validate(config);
            if (problems.isEmpty()) {
                System.out.println("Config check: ok");
            } else {
                problems.forEach(problem -> System.out.println("Config check: " + problem));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
