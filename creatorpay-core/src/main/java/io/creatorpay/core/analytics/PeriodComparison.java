package io.creatorpay.core.analytics;

public record PeriodComparison(
    boolean baselineAvailable,
    double growthPercent,
    String summary
) {
    public static final String NO_PRIOR_DATA = "No prior period data.";

    static PeriodComparison noPriorData() {
        return new PeriodComparison(false, 0.0, NO_PRIOR_DATA);
    }
}
