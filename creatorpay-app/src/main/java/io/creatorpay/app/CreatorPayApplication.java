package io.creatorpay.app;

import io.creatorpay.cli.CliContext;
import io.creatorpay.cli.CompareCommand;
import io.creatorpay.cli.CreatorPayCliCommand;
import io.creatorpay.cli.CurrencyCommand;
import io.creatorpay.cli.HealthCommand;
import io.creatorpay.cli.HoldCommand;
import io.creatorpay.cli.InfoCommand;
import io.creatorpay.cli.OnboardCommand;
import io.creatorpay.cli.ProcessCommand;
import io.creatorpay.cli.ReportCommand;
import io.creatorpay.cli.StatusCommand;
import io.creatorpay.cli.TopCommand;
import io.creatorpay.core.analytics.AnalyticsService;
import io.creatorpay.core.config.ConfigPaths;
import io.creatorpay.core.config.ConfigService;
import io.creatorpay.core.config.model.CreatorPayConfig;
import io.creatorpay.core.config.model.SampleDataConfig;
import io.creatorpay.core.service.RevenueService;
import io.creatorpay.core.store.InMemoryPaymentStore;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class CreatorPayApplication {
    private static final Logger LOG = LoggerFactory.getLogger(CreatorPayApplication.class);

    private CreatorPayApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        CreatorPayConfig config = loadConfig(configService, configPath);

        CliContext context = buildContext(config, configService, configPath, Clock.systemUTC());
        int exitCode = buildCommandLine(context).execute(args);
        System.exit(exitCode);
    }

    static CliContext buildContext(CreatorPayConfig config, ConfigService configService, Path configPath, Clock clock) {
        InMemoryPaymentStore store = new InMemoryPaymentStore(config.store(), clock);
        Long seed = config.processing().randomSeed();
        RevenueService revenueService = new RevenueService(
            store,
            config.processing(),
            config.rules(),
            seed == null ? new Random() : new Random(seed),
            clock
        );

        SampleDataConfig sampleData = config.sampleData();
        if (sampleData.enabled() && sampleData.count() > 0) {
            new SampleDataSeeder(revenueService, new Random(sampleData.seed()), clock).seed(sampleData.count());
        }

        return new CliContext(
            revenueService,
            new AnalyticsService(store, config.rules()),
            configService,
            configPath
        );
    }

    static CommandLine buildCommandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new CreatorPayCliCommand(context));
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("report", new ReportCommand(context));
        commandLine.addSubcommand("hold", new HoldCommand(context));
        commandLine.addSubcommand("health", new HealthCommand(context));
        commandLine.addSubcommand("top", new TopCommand(context));
        commandLine.addSubcommand("info", new InfoCommand(context));
        commandLine.addSubcommand("currency", new CurrencyCommand(context));
        commandLine.addSubcommand("compare", new CompareCommand(context));
        commandLine.addSubcommand("process", new ProcessCommand(context));
        return commandLine;
    }

    private static CreatorPayConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not load config from {}, using defaults: {}", configPath, e.getMessage());
            return CreatorPayConfig.defaults();
        }
    }
}
