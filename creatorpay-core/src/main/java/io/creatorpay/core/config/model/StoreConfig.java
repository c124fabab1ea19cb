package io.creatorpay.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(
    int maxCapacity,
    int auditLogLimit
) {

    public static StoreConfig defaults() {
        return new StoreConfig(10_000, 10_000);
    }
}
