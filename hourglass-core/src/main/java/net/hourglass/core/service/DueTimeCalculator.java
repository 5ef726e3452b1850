package net.hourglass.core.service;

import net.hourglass.core.model.Job;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * 잡의 "현재 주기" 실행 시각 계산.
 * 폴링 방식이므로 허용 오차 안에서는 이미 지난 시각을 그대로 돌려주고(즉시 실행 대상),
 * 허용 오차를 넘긴 슬롯은 건너뛰고 다음 주기로 넘긴다.
 */
public final class DueTimeCalculator {
    public static final Duration HOURLY_TOLERANCE = Duration.ofMinutes(10);
    public static final Duration DAILY_TOLERANCE = Duration.ofMinutes(60);
    public static final Duration WEEKLY_TOLERANCE = Duration.ofMinutes(60);

    private final ZoneId zone;

    public DueTimeCalculator(ZoneId zone) {
        this.zone = zone;
    }

    /** WEEKLY인데 weekday가 없으면 null */
    public Instant nextDue(Job job, Instant now) {
        ZonedDateTime local = now.atZone(zone);
        switch (job.frequency()) {
            case HOURLY: {
                ZonedDateTime slot = local.truncatedTo(ChronoUnit.HOURS).withMinute(job.byMinute());
                if (Duration.between(slot, local).compareTo(HOURLY_TOLERANCE) > 0) slot = slot.plusHours(1);
                return slot.toInstant();
            }
            case DAILY: {
                ZonedDateTime slot = atTime(local, job);
                if (Duration.between(slot, local).compareTo(DAILY_TOLERANCE) > 0) slot = slot.plusDays(1);
                return slot.toInstant();
            }
            case WEEKLY: {
                if (job.weekday() == null) return null;
                int today = local.getDayOfWeek().getValue() - 1; // 월=0
                int daysAhead = job.weekday() - today;
                int nowMinutes = local.getHour() * 60 + local.getMinute();
                int slotMinutes = job.byHour() * 60 + job.byMinute();
                if (daysAhead < 0 || (daysAhead == 0 && nowMinutes >= slotMinutes + WEEKLY_TOLERANCE.toMinutes())) {
                    daysAhead += 7;
                }
                return atTime(local.plusDays(daysAhead), job).toInstant();
            }
            default:
                return null;
        }
    }

    private static ZonedDateTime atTime(ZonedDateTime day, Job job) {
        return day.withHour(job.byHour()).withMinute(job.byMinute()).withSecond(0).withNano(0);
    }

    public ZoneId zone() {
        return zone;
    }
}
