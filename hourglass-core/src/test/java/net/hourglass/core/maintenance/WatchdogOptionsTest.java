package net.hourglass.core.maintenance;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WatchdogOptionsTest {

    @Test
    void defaults_stuckThresholdIs45Minutes() {
        assertEquals(Duration.ofMinutes(45), WatchdogOptions.defaults().stuckThreshold());
    }

    @Test
    void failureLimitBelowOne_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new WatchdogOptions(true, Duration.ofMinutes(30), 1.5, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new WatchdogOptions(true, Duration.ofMinutes(30), 1.5, -1));
    }

    @Test
    void nonPositiveTimeoutOrMultiplier_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new WatchdogOptions(true, Duration.ZERO, 1.5, 3));
        assertThrows(IllegalArgumentException.class, () -> new WatchdogOptions(true, null, 1.5, 3));
        assertThrows(IllegalArgumentException.class,
                () -> new WatchdogOptions(true, Duration.ofMinutes(30), 0, 3));
    }

    @Test
    void disabledOptions_stillValidated() {
        assertFalse(new WatchdogOptions(false, Duration.ofMinutes(1), 1.0, 1).enabled());
    }
}
