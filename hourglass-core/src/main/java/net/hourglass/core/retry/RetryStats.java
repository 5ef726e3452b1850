package net.hourglass.core.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** 재시도 진단 정보 */
public final class RetryStats {

    public record AttemptError(int attempt, RetryReason reason, String message) {
    }

    private int totalAttempts;
    private Duration totalDelay = Duration.ZERO;
    private boolean success;
    private final List<AttemptError> errors = new ArrayList<>();

    void recordError(int attempt, RetryReason reason, String message) {
        errors.add(new AttemptError(attempt, reason, message));
    }

    void addDelay(Duration d) {
        totalDelay = totalDelay.plus(d);
    }

    void finish(int attempts, boolean ok) {
        this.totalAttempts = attempts;
        this.success = ok;
    }

    public int totalAttempts() { return totalAttempts; }
    public Duration totalDelay() { return totalDelay; }
    public boolean success() { return success; }
    public List<AttemptError> errors() { return Collections.unmodifiableList(errors); }

    @Override public String toString() {
        return "RetryStats{" +
                "totalAttempts=" + totalAttempts +
                ", totalDelay=" + totalDelay +
                ", success=" + success +
                ", errors=" + errors +
                '}';
    }
}
