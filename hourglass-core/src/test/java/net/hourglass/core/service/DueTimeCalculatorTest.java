package net.hourglass.core.service;

import net.hourglass.core.model.Job;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DueTimeCalculatorTest {

    private final DueTimeCalculator utc = new DueTimeCalculator(ZoneOffset.UTC);

    // 2025-01-06 = 월요일
    private static Instant at(String iso) { return Instant.parse(iso); }

    @Test
    void hourly_withinToleranceReturnsCurrentHourSlot() {
        Job job = Job.hourly("h", 0);
        assertEquals(at("2025-01-06T12:00:00Z"), utc.nextDue(job, at("2025-01-06T12:00:05Z")));
        assertEquals(at("2025-01-06T12:00:00Z"), utc.nextDue(job, at("2025-01-06T12:10:00Z")));
    }

    @Test
    void hourly_pastToleranceRollsToNextHour() {
        Job job = Job.hourly("h", 0);
        assertEquals(at("2025-01-06T13:00:00Z"), utc.nextDue(job, at("2025-01-06T12:10:01Z")));
    }

    @Test
    void hourly_futureMinuteStaysInCurrentHour() {
        Job job = Job.hourly("h", 30);
        assertEquals(at("2025-01-06T12:30:00Z"), utc.nextDue(job, at("2025-01-06T12:00:05Z")));
    }

    @Test
    void daily_toleranceIsOneHour() {
        Job job = Job.daily("d", 9, 30);
        assertEquals(at("2025-01-06T09:30:00Z"), utc.nextDue(job, at("2025-01-06T08:00:00Z")));
        assertEquals(at("2025-01-06T09:30:00Z"), utc.nextDue(job, at("2025-01-06T10:30:00Z")));
        assertEquals(at("2025-01-07T09:30:00Z"), utc.nextDue(job, at("2025-01-06T10:30:01Z")));
    }

    @Test
    void daily_respectsZone() {
        var seoul = new DueTimeCalculator(ZoneId.of("Asia/Seoul"));
        Job job = Job.daily("d", 9, 0);
        // 09:00 KST = 00:00 UTC
        assertEquals(at("2025-01-06T00:00:00Z"), seoul.nextDue(job, at("2025-01-05T23:00:00Z")));
    }

    @Test
    void weekly_nextOccurrenceOfWeekday() {
        Job wed10 = Job.weekly("w", 2, 10, 0);
        assertEquals(at("2025-01-08T10:00:00Z"), utc.nextDue(wed10, at("2025-01-06T12:00:00Z")));  // 월 → 수
        assertEquals(at("2025-01-15T10:00:00Z"), utc.nextDue(wed10, at("2025-01-09T08:00:00Z")));  // 목 → 다음 주 수
    }

    @Test
    void weekly_sameDayCutoffIsSlotPlusSixtyMinutes() {
        Job wed10 = Job.weekly("w", 2, 10, 0);
        assertEquals(at("2025-01-08T10:00:00Z"), utc.nextDue(wed10, at("2025-01-08T10:30:00Z")));
        assertEquals(at("2025-01-15T10:00:00Z"), utc.nextDue(wed10, at("2025-01-08T11:00:00Z")));
    }

    @Test
    void weekly_withoutWeekdayReturnsNull() {
        Job broken = new Job(1L, "w", true, Job.Frequency.WEEKLY, 10, 0, null, 0, null, null, null);
        assertNull(utc.nextDue(broken, at("2025-01-08T10:00:00Z")));
    }

    @Test
    @DisplayName("WEEKLY: 항상 지정 요일, now 이전이면 같은 날 허용 오차 안")
    void weekly_alwaysOnWeekdayAndNeverStale() {
        for (int weekday = 0; weekday < 7; weekday++) {
            Job job = Job.weekly("w", weekday, 7, 45);
            Instant now = at("2025-01-06T00:00:00Z");
            Instant end = at("2025-01-27T00:00:00Z");
            while (now.isBefore(end)) {
                Instant due = utc.nextDue(job, now);
                assertEquals(DayOfWeek.of(weekday + 1), due.atZone(ZoneOffset.UTC).getDayOfWeek());
                if (due.isBefore(now)) {
                    assertTrue(Duration.between(due, now).compareTo(Duration.ofMinutes(60)) < 0,
                            "stale slot " + due + " at " + now);
                } else {
                    assertTrue(Duration.between(now, due).compareTo(Duration.ofDays(7)) <= 0);
                }
                now = now.plus(Duration.ofMinutes(37));
            }
        }
    }
}
