package in.zonecast.service.zone;

import in.zonecast.domain.zone.Market;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Session Clock - market session boundaries in America/New_York.
 *
 * NY regular session: 09:30 - 16:00 ET
 * Liquidity windows relative to a trading day T:
 *   NEW_YORK: prior trading day 09:30 - 16:00
 *   ASIA:     T-1 18:00 - T 02:00
 *   LONDON:   T 03:00 - 09:30
 */
public final class SessionClock {
    public static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private static final LocalTime SESSION_START = LocalTime.of(9, 30);
    private static final LocalTime SESSION_END = LocalTime.of(16, 0);
    private static final LocalTime ASIA_START = LocalTime.of(18, 0);
    private static final LocalTime ASIA_END = LocalTime.of(2, 0);
    private static final LocalTime LONDON_START = LocalTime.of(3, 0);
    private static final LocalTime BLACKOUT_START = LocalTime.of(10, 0);
    private static final LocalTime BLACKOUT_END = LocalTime.of(12, 0);
    private static final long NEAR_CLOSE_MILLIS = 10 * 60 * 1000L;

    /**
     * Inclusive [startMs, endMs] window.
     */
    public record SessionWindow(long startMs, long endMs) {
        public boolean contains(long timestamp) {
            return startMs <= timestamp && timestamp <= endMs;
        }
    }

    public static Instant getSessionStart(LocalDate date) {
        return ZonedDateTime.of(date, SESSION_START, NEW_YORK).toInstant();
    }

    public static Instant getSessionEnd(LocalDate date) {
        return ZonedDateTime.of(date, SESSION_END, NEW_YORK).toInstant();
    }

    public static long at(LocalDate date, LocalTime time) {
        return ZonedDateTime.of(date, time, NEW_YORK).toInstant().toEpochMilli();
    }

    /**
     * Liquidity window of a market for the given trading day.
     */
    public static SessionWindow window(Market market, LocalDate tradingDay) {
        return switch (market) {
            case NEW_YORK -> {
                LocalDate prior = MarketCalendar.tradingDaysBack(tradingDay, 1);
                yield new SessionWindow(at(prior, SESSION_START), at(prior, SESSION_END));
            }
            case ASIA -> new SessionWindow(at(tradingDay.minusDays(1), ASIA_START), at(tradingDay, ASIA_END));
            case LONDON -> new SessionWindow(at(tradingDay, LONDON_START), at(tradingDay, SESSION_START));
        };
    }

    public static LocalDate toNewYorkDate(long timestamp) {
        return Instant.ofEpochMilli(timestamp).atZone(NEW_YORK).toLocalDate();
    }

    public static LocalTime toNewYorkTime(long timestamp) {
        return Instant.ofEpochMilli(timestamp).atZone(NEW_YORK).toLocalTime();
    }

    /**
     * Trading day a candle belongs to: the evening session from 18:00 counts toward the next day,
     * and non-trading days roll forward.
     */
    public static LocalDate tradingDateOf(long timestamp) {
        LocalDateTime local = Instant.ofEpochMilli(timestamp).atZone(NEW_YORK).toLocalDateTime();
        LocalDate date = local.toLocalTime().isBefore(ASIA_START) ? local.toLocalDate() : local.toLocalDate().plusDays(1);
        return MarketCalendar.onOrAfter(date);
    }

    public static boolean isWithinSession(long timestamp) {
        LocalDate date = toNewYorkDate(timestamp);
        return getSessionStart(date).toEpochMilli() <= timestamp && timestamp <= getSessionEnd(date).toEpochMilli();
    }

    /**
     * Within ten minutes of the 16:00 close, or after it.
     */
    public static boolean isNearClose(long timestamp) {
        LocalDate date = toNewYorkDate(timestamp);
        return timestamp >= getSessionEnd(date).toEpochMilli() - NEAR_CLOSE_MILLIS;
    }

    /**
     * 10:00 - 12:00 ET, no new entries.
     */
    public static boolean isInBlackout(long timestamp) {
        LocalTime time = toNewYorkTime(timestamp);
        return !time.isBefore(BLACKOUT_START) && time.isBefore(BLACKOUT_END);
    }

    public static String formatNewYork(long timestamp) {
        return Instant.ofEpochMilli(timestamp).atZone(NEW_YORK).toString();
    }

    private SessionClock() {}
}
