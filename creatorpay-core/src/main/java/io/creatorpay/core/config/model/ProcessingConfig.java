package io.creatorpay.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProcessingConfig(
    double successProbability,
    double manualReviewThreshold,
    Long randomSeed
) {

    public ProcessingConfig {
        successProbability = Math.max(0.0, Math.min(1.0, successProbability));
        manualReviewThreshold = Math.max(0.0, manualReviewThreshold);
    }

    public static ProcessingConfig defaults() {
        return new ProcessingConfig(0.85, 50_000, null);
    }
}
