package io.creatorpay.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.creatorpay.core.config.model.CreatorPayConfig;
import io.creatorpay.core.config.model.SampleDataConfig;
import io.creatorpay.core.config.model.StoreConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        CreatorPayConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.store().maxCapacity()).isEqualTo(10_000);
        assertThat(config.processing().successProbability()).isEqualTo(0.85);
        assertThat(config.processing().manualReviewThreshold()).isEqualTo(50_000);
        assertThat(config.processing().randomSeed()).isNull();
        assertThat(config.rules().holdThreshold()).isEqualTo(100.0);
        assertThat(config.rules().healthWarningFailureRate()).isEqualTo(5.0);
    }

    @Test
    void shouldMergeExistingValuesOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "store": {
                "maxCapacity": 250
              },
              "processing": {
                "successProbability": 0.5,
                "randomSeed": 99
              },
              "unknownSection": true
            }
            """);

        CreatorPayConfig config = service.load(configPath);

        assertThat(config.store().maxCapacity()).isEqualTo(250);
        assertThat(config.store().auditLogLimit()).isEqualTo(10_000);
        assertThat(config.processing().successProbability()).isEqualTo(0.5);
        assertThat(config.processing().randomSeed()).isEqualTo(99L);
        assertThat(config.processing().manualReviewThreshold()).isEqualTo(50_000);
        assertThat(config.sampleData().count()).isEqualTo(30);
    }

    @Test
    void shouldClampOutOfRangeProbability() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "processing": { "successProbability": 3.0 } }
            """);

        assertThat(service.load(configPath).processing().successProbability()).isEqualTo(1.0);
    }

    @Test
    void onboardShouldWriteDefaultsOnceAndOverwriteOnRequest() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".creatorpay/config.json");

        OnboardResult created = service.onboard(configPath, false);
        OnboardResult refreshed = service.onboard(configPath, false);
        OnboardResult overwritten = service.onboard(configPath, true);

        assertThat(created.createdConfig()).isTrue();
        assertThat(refreshed.createdConfig()).isFalse();
        assertThat(refreshed.overwrittenConfig()).isFalse();
        assertThat(overwritten.overwrittenConfig()).isTrue();
        assertThat(Files.readString(configPath)).contains("\"maxCapacity\" : 10000");
    }

    @Test
    void shouldFlagSettingsThatCannotBeHonoured() {
        ConfigService service = new ConfigService();
        CreatorPayConfig defaults = CreatorPayConfig.defaults();
        CreatorPayConfig config = new CreatorPayConfig(
            new StoreConfig(20, 0),
            defaults.processing(),
            defaults.rules(),
            new SampleDataConfig(true, 50, 42L)
        );

        assertThat(service.validate(defaults)).isEmpty();
        assertThat(service.validate(config)).containsExactly(
            "store.auditLogLimit must be at least 1, was 0",
            "sampleData.count 50 exceeds store.maxCapacity 20"
        );
    }
}
