package net.hourglass.core.retry;

public record RetryOutcome<T>(T result, RetryStats stats) {
}
