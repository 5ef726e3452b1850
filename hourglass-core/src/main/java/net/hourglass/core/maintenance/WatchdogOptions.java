package net.hourglass.core.maintenance;

import java.time.Duration;

public record WatchdogOptions(
        boolean enabled,
        Duration jobTimeout,
        double stuckMultiplier,
        int maxConsecutiveFailures
) {
    public WatchdogOptions {
        if (jobTimeout == null || jobTimeout.isNegative() || jobTimeout.isZero()) {
            throw new IllegalArgumentException("jobTimeout must be positive");
        }
        if (stuckMultiplier <= 0) throw new IllegalArgumentException("stuckMultiplier must be > 0");
        if (maxConsecutiveFailures < 1) throw new IllegalArgumentException("maxConsecutiveFailures must be >= 1");
    }

    public static WatchdogOptions defaults() {
        return new WatchdogOptions(true, Duration.ofMinutes(30), 1.5, 3);
    }

    /** RUNNING 유지가 이 시간을 넘으면 stuck */
    public Duration stuckThreshold() {
        return Duration.ofMillis(Math.round(jobTimeout.toMillis() * stuckMultiplier));
    }
}
