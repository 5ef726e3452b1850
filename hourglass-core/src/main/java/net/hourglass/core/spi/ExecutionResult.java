package net.hourglass.core.spi;

public record ExecutionResult(String runDir) {
    public static ExecutionResult of(String runDir) {
        return new ExecutionResult(runDir == null ? "" : runDir);
    }
}
