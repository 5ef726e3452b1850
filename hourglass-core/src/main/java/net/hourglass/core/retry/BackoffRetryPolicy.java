package net.hourglass.core.retry;

import net.hourglass.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 사유별 배수를 적용한 지수 백오프.
 * delay = min(maxDelay, base * expBase^attempt * multiplier * jitter), jitter ∈ [0.8, 1.2]
 */
public final class BackoffRetryPolicy implements RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(BackoffRetryPolicy.class);

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double exponentialBase;
    private final boolean jitter;
    private final ErrorClassifier classifier;
    private final Sleeper sleeper;

    public BackoffRetryPolicy(int maxRetries,
                              Duration baseDelay,
                              Duration maxDelay,
                              double exponentialBase,
                              boolean jitter,
                              ErrorClassifier classifier,
                              Sleeper sleeper) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.exponentialBase = exponentialBase;
        this.jitter = jitter;
        this.classifier = classifier;
        this.sleeper = sleeper;
    }

    public static BackoffRetryPolicy defaults() {
        return new BackoffRetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(300), 2.0, true,
                ErrorClassifier.defaults(), Sleeper.system());
    }

    public Duration delay(int attempt, RetryReason reason) {
        double seconds = baseDelay.toMillis() / 1000.0
                * Math.pow(exponentialBase, attempt)
                * reason.multiplier();
        if (jitter) {
            seconds *= ThreadLocalRandom.current().nextDouble(0.8, 1.2);
        }
        double capped = Math.min(seconds, maxDelay.toMillis() / 1000.0);
        return Duration.ofMillis(Math.round(capped * 1000));
    }

    public boolean shouldRetry(int attempt, RetryReason reason) {
        if (attempt >= maxRetries) return false;
        // 403은 최대 2회까지만
        if (reason == RetryReason.FORBIDDEN_403 && attempt >= 2) return false;
        return true;
    }

    @Override
    public Duration nextBackoff(long attempt) {
        return delay((int) attempt, RetryReason.UNKNOWN);
    }

    public <T> RetryOutcome<T> executeWithRetry(Callable<T> fn) throws RetryAbortedException, InterruptedException {
        return executeWithRetry(fn, classifier);
    }

    public <T> RetryOutcome<T> executeWithRetry(Callable<T> fn, ErrorClassifier errorClassifier)
            throws RetryAbortedException, InterruptedException {
        RetryStats stats = new RetryStats();
        int attempt = 0;
        while (true) {
            try {
                T result = fn.call();
                stats.finish(attempt + 1, true);
                if (attempt > 0) {
                    log.info("Succeeded after {} retries (total delay {})", attempt, stats.totalDelay());
                }
                return new RetryOutcome<>(result, stats);
            } catch (InterruptedException ie) {
                stats.finish(attempt + 1, false);
                throw ie;
            } catch (Exception e) {
                RetryReason reason = errorClassifier.classify(e);
                stats.recordError(attempt, reason, String.valueOf(e.getMessage()));

                if (!shouldRetry(attempt, reason)) {
                    stats.finish(attempt + 1, false);
                    log.error("Giving up after {} attempt(s): {}", attempt + 1, reason);
                    throw new RetryAbortedException(reason, stats, e);
                }

                Duration d = delay(attempt, reason);
                stats.addDelay(d);
                log.warn("Attempt {}/{} failed ({}), retrying in {}: {}",
                        attempt + 1, maxRetries, reason, d, e.getMessage());
                sleeper.sleep(d);
                attempt++;
            }
        }
    }

    public int maxRetries() { return maxRetries; }
    public Duration maxDelay() { return maxDelay; }
}
