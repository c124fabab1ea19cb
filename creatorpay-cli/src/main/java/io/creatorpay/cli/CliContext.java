package io.creatorpay.cli;

import io.creatorpay.core.analytics.AnalyticsService;
import io.creatorpay.core.config.ConfigService;
import io.creatorpay.core.service.RevenueService;
import io.creatorpay.core.store.PaymentStore;
import java.nio.file.Path;

public record CliContext(
    RevenueService revenueService,
    AnalyticsService analyticsService,
    ConfigService configService,
    Path configPath
) {
    public PaymentStore store() {
        return revenueService.store();
    }
}
