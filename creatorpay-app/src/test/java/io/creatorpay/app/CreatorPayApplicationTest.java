package io.creatorpay.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.creatorpay.cli.CliContext;
import io.creatorpay.core.config.ConfigService;
import io.creatorpay.core.config.model.CreatorPayConfig;
import io.creatorpay.core.config.model.SampleDataConfig;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CreatorPayApplicationTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-21T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void shouldSeedStoreFromConfig() {
        CliContext context = CreatorPayApplication.buildContext(
            CreatorPayConfig.defaults(), new ConfigService(), tempDir.resolve("config.json"), CLOCK
        );

        assertThat(context.store().count()).isEqualTo(30);
    }

    @Test
    void shouldStartEmptyWhenSampleDataDisabled() {
        CreatorPayConfig defaults = CreatorPayConfig.defaults();
        CreatorPayConfig config = new CreatorPayConfig(
            defaults.store(),
            defaults.processing(),
            defaults.rules(),
            new SampleDataConfig(false, 30, 42L)
        );

        CliContext context = CreatorPayApplication.buildContext(config, new ConfigService(), tempDir.resolve("config.json"), CLOCK);

        assertThat(context.store().count()).isZero();
    }

    @Test
    void shouldRegisterAllSubcommands() {
        CliContext context = CreatorPayApplication.buildContext(
            CreatorPayConfig.defaults(), new ConfigService(), tempDir.resolve("config.json"), CLOCK
        );

        CommandLine commandLine = CreatorPayApplication.buildCommandLine(context);

        assertThat(commandLine.getSubcommands().keySet()).containsExactlyInAnyOrder(
            "onboard", "status", "report", "hold", "health", "top", "info", "currency", "compare", "process"
        );
    }
}
