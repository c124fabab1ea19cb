package io.creatorpay.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RulesConfig(
    double holdThreshold,
    double healthWarningFailureRate,
    int recentLogCount
) {

    public RulesConfig {
        holdThreshold = Math.max(0.0, holdThreshold);
        recentLogCount = Math.max(0, recentLogCount);
    }

    public static RulesConfig defaults() {
        return new RulesConfig(100.0, 5.0, 5);
    }
}
