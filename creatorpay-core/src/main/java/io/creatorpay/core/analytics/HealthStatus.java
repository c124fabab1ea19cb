package io.creatorpay.core.analytics;

public enum HealthStatus {
    HEALTHY("Healthy"),
    WARNING("Warning");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
