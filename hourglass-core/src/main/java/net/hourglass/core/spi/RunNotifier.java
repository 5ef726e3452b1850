package net.hourglass.core.spi;

import java.util.Map;

@FunctionalInterface
public interface RunNotifier {
    String JOB_FINISHED = "job_finished";
    String JOB_FAILED = "job_failed";

    void notify(String event, Map<String, Object> payload) throws Exception;

    static RunNotifier noop() {
        return (event, payload) -> { };
    }
}
