package net.hourglass.core.retry;

/** 재시도 불가 판정으로 포기. cause = 마지막 실패 */
public class RetryAbortedException extends Exception {
    private final transient RetryStats stats;
    private final RetryReason reason;

    public RetryAbortedException(RetryReason reason, RetryStats stats, Throwable cause) {
        super("retry aborted after " + stats.totalAttempts() + " attempt(s) (" + reason + "): "
                + (cause == null ? "" : cause.getMessage()), cause);
        this.reason = reason;
        this.stats = stats;
    }

    public RetryStats stats() { return stats; }

    public RetryReason reason() { return reason; }
}
