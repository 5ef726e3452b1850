package net.hourglass.core.retry;

import java.time.Duration;
import java.util.List;

final class ScheduleRetryPolicy implements RetryPolicy {
    private final List<Duration> delays;

    ScheduleRetryPolicy(List<Duration> delays) {
        if (delays.isEmpty()) throw new IllegalArgumentException("at least one delay required");
        this.delays = List.copyOf(delays);
    }

    @Override
    public Duration nextBackoff(long attempt) {
        int i = (int) Math.min(Math.max(attempt, 0), delays.size() - 1);
        return delays.get(i);
    }
}
