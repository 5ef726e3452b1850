package net.hourglass.core.retry;

public enum RetryReason {
    RATE_LIMIT_429(3.0),
    FORBIDDEN_403(2.0),
    NETWORK_ERROR(1.0),
    TIMEOUT(1.5),
    SERVER_ERROR_5XX(2.0),
    UNKNOWN(1.0);

    private final double multiplier;

    RetryReason(double multiplier) {
        this.multiplier = multiplier;
    }

    /** 사유별 지연 배수 */
    public double multiplier() {
        return multiplier;
    }
}
