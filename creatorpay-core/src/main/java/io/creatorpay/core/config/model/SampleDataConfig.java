package io.creatorpay.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SampleDataConfig(
    boolean enabled,
    int count,
    long seed
) {

    public static SampleDataConfig defaults() {
        return new SampleDataConfig(true, 30, 42L);
    }
}
