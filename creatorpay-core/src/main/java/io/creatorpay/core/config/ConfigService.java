package io.creatorpay.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.creatorpay.core.config.model.CreatorPayConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public CreatorPayConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return CreatorPayConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(CreatorPayConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        CreatorPayConfig config = mapper.treeToValue(merged, CreatorPayConfig.class);
        for (String problem : validate(config)) {
            LOG.warn("Config {}: {}", configPath, problem);
        }
        return config;
    }

    /**
     * Lists settings that load fine but cannot be honoured as written. The store and services clamp
     * these values at construction, so none of them is fatal.
     */
    public List<String> validate(CreatorPayConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        List<String> problems = new ArrayList<>();
        if (config.store().maxCapacity() < 1) {
            problems.add("store.maxCapacity must be at least 1, was " + config.store().maxCapacity());
        }
        if (config.store().auditLogLimit() < 1) {
            problems.add("store.auditLogLimit must be at least 1, was " + config.store().auditLogLimit());
        }
        if (config.processing().manualReviewThreshold() <= 0) {
            problems.add("processing.manualReviewThreshold must be positive, every payment would need review");
        }
        if (config.rules().healthWarningFailureRate() <= 0 || config.rules().healthWarningFailureRate() > 100) {
            problems.add("rules.healthWarningFailureRate must be within (0, 100], was "
                + config.rules().healthWarningFailureRate());
        }
        if (config.sampleData().enabled() && config.sampleData().count() > config.store().maxCapacity()) {
            problems.add("sampleData.count " + config.sampleData().count()
                + " exceeds store.maxCapacity " + config.store().maxCapacity());
        }
        return List.copyOf(problems);
    }

    public void save(Path configPath, CreatorPayConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        CreatorPayConfig config = created || overwrite ? CreatorPayConfig.defaults() : load(configPath);
        save(configPath, config);
        return new OnboardResult(configPath, created, !created && overwrite);
    }

    public String toPrettyJson(CreatorPayConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull() && base.isObject()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
