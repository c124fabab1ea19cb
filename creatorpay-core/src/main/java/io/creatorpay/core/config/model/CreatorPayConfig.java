package io.creatorpay.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CreatorPayConfig(
    StoreConfig store,
    ProcessingConfig processing,
    RulesConfig rules,
    SampleDataConfig sampleData
) {

    public static CreatorPayConfig defaults() {
        return new CreatorPayConfig(
            StoreConfig.defaults(),
            ProcessingConfig.defaults(),
            RulesConfig.defaults(),
            SampleDataConfig.defaults()
        );
    }
}
