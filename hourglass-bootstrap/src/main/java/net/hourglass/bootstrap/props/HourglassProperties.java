package net.hourglass.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("hourglass")
public class HourglassProperties {
    private String zone = "UTC";
    private Catalog catalog = new Catalog();
    private Scheduler scheduler = new Scheduler();
    private Watchdog watchdog = new Watchdog();
    private Retry retry = new Retry();

    public String getZone() { return zone; }
    public void setZone(String zone) { this.zone = zone; }

    public Catalog getCatalog() { return catalog; }
    public void setCatalog(Catalog catalog) { this.catalog = catalog; }

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }

    public Watchdog getWatchdog() { return watchdog; }
    public void setWatchdog(Watchdog watchdog) { this.watchdog = watchdog; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public List<JobDef> getJobs() { return jobs; }
        public void setJobs(List<JobDef> jobs) { this.jobs = jobs; }
    }

    public static class JobDef {
        private String name;
        private boolean enabled = true;
        private String frequency;                 // HOURLY | DAILY | WEEKLY
        private int byHour;
        private int byMinute;
        private Integer weekday;                  // 0=월 .. 6=일
        private int jitterSec = 90;
        private String sourceUrl;
        private String outputRoot = "out";
        private List<String> preferredLangs = new ArrayList<>(List.of("zh", "en"));
        private boolean download = true;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getFrequency() { return frequency; }
        public void setFrequency(String frequency) { this.frequency = frequency; }

        public int getByHour() { return byHour; }
        public void setByHour(int byHour) { this.byHour = byHour; }

        public int getByMinute() { return byMinute; }
        public void setByMinute(int byMinute) { this.byMinute = byMinute; }

        public Integer getWeekday() { return weekday; }
        public void setWeekday(Integer weekday) { this.weekday = weekday; }

        public int getJitterSec() { return jitterSec; }
        public void setJitterSec(int jitterSec) { this.jitterSec = jitterSec; }

        public String getSourceUrl() { return sourceUrl; }
        public void setSourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; }

        public String getOutputRoot() { return outputRoot; }
        public void setOutputRoot(String outputRoot) { this.outputRoot = outputRoot; }

        public List<String> getPreferredLangs() { return preferredLangs; }
        public void setPreferredLangs(List<String> preferredLangs) { this.preferredLangs = preferredLangs; }

        public boolean isDownload() { return download; }
        public void setDownload(boolean download) { this.download = download; }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", frequency=" + frequency +
                    ", byHour=" + byHour +
                    ", byMinute=" + byMinute +
                    ", weekday=" + weekday +
                    ", enabled=" + enabled +
                    '}';
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private boolean autoStart = true;
        private Duration tickInterval = Duration.ofSeconds(60);
        private int maxConcurrency = 2;
        private Duration lockTtl = Duration.ofHours(1);
        private int keepRuns = 100;
        private int maxRetries = 3;
        private List<Duration> retryDelays = new ArrayList<>(List.of(
                Duration.ofSeconds(60), Duration.ofSeconds(120), Duration.ofSeconds(240)));
        private Duration stopTimeout = Duration.ofSeconds(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isAutoStart() { return autoStart; }
        public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }

        public Duration getTickInterval() { return tickInterval; }
        public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

        public Duration getLockTtl() { return lockTtl; }
        public void setLockTtl(Duration lockTtl) { this.lockTtl = lockTtl; }

        public int getKeepRuns() { return keepRuns; }
        public void setKeepRuns(int keepRuns) { this.keepRuns = keepRuns; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public List<Duration> getRetryDelays() { return retryDelays; }
        public void setRetryDelays(List<Duration> retryDelays) { this.retryDelays = retryDelays; }

        public Duration getStopTimeout() { return stopTimeout; }
        public void setStopTimeout(Duration stopTimeout) { this.stopTimeout = stopTimeout; }
    }

    public static class Watchdog {
        private boolean enabled = true;
        private long intervalMs = 60000;
        private Duration jobTimeout = Duration.ofMinutes(30);
        private double stuckMultiplier = 1.5;
        private int maxConsecutiveFailures = 3;
        private String eventLog = "logs/watchdog_events.jsonl";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public Duration getJobTimeout() { return jobTimeout; }
        public void setJobTimeout(Duration jobTimeout) { this.jobTimeout = jobTimeout; }

        public double getStuckMultiplier() { return stuckMultiplier; }
        public void setStuckMultiplier(double stuckMultiplier) { this.stuckMultiplier = stuckMultiplier; }

        public int getMaxConsecutiveFailures() { return maxConsecutiveFailures; }
        public void setMaxConsecutiveFailures(int maxConsecutiveFailures) { this.maxConsecutiveFailures = maxConsecutiveFailures; }

        public String getEventLog() { return eventLog; }
        public void setEventLog(String eventLog) { this.eventLog = eventLog; }
    }

    /** 범용 백오프 정책 (BackoffRetryPolicy) */
    public static class Retry {
        private int maxRetries = 5;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(300);
        private double exponentialBase = 2.0;
        private boolean jitter = true;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }

        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }

        public double getExponentialBase() { return exponentialBase; }
        public void setExponentialBase(double exponentialBase) { this.exponentialBase = exponentialBase; }

        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }
    }
}
