package in.zonecast.service.zone;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Set;

/**
 * US futures trading calendar.
 *
 * Holidays: New Year's Day, MLK Day, Presidents Day, Good Friday, Memorial Day,
 * Juneteenth, Independence Day, Labor Day, Thanksgiving, Christmas.
 * Fixed-date holidays falling on a weekend are observed the following Monday.
 */
public final class MarketCalendar {

    public static boolean isTradingDay(LocalDate date) {
        return !isWeekend(date) && !isMarketHoliday(date);
    }

    public static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    public static boolean isMarketHoliday(LocalDate date) {
        return holidays(date.getYear()).contains(date);
    }

    /**
     * Day before Independence Day, Thanksgiving and Christmas, when that day is a weekday.
     */
    public static boolean isEarlyCloseDay(LocalDate date) {
        if (isWeekend(date)) return false;

        int year = date.getYear();
        LocalDate thanksgiving = nthWeekdayOfMonth(year, 11, DayOfWeek.THURSDAY, 4);
        return date.equals(LocalDate.of(year, 7, 4).minusDays(1))
            || date.equals(thanksgiving.minusDays(1))
            || date.equals(LocalDate.of(year, 12, 25).minusDays(1));
    }

    /**
     * The date {@code tradingDays} trading days before {@code date}, counting from the day before.
     */
    public static LocalDate tradingDaysBack(LocalDate date, int tradingDays) {
        if (tradingDays <= 0) {
            throw new IllegalArgumentException("tradingDays must be positive: " + tradingDays);
        }

        LocalDate current = date.minusDays(1);
        int count = 0;
        while (true) {
            if (isTradingDay(current)) {
                count++;
                if (count == tradingDays) return current;
            }
            current = current.minusDays(1);
        }
    }

    /**
     * {@code date} itself when it trades, otherwise the next trading day.
     */
    public static LocalDate onOrAfter(LocalDate date) {
        LocalDate current = date;
        while (!isTradingDay(current)) {
            current = current.plusDays(1);
        }
        return current;
    }

    static Set<LocalDate> holidays(int year) {
        return Set.of(
            observed(LocalDate.of(year, 1, 1)),
            nthWeekdayOfMonth(year, 1, DayOfWeek.MONDAY, 3),
            nthWeekdayOfMonth(year, 2, DayOfWeek.MONDAY, 3),
            goodFriday(year),
            LocalDate.of(year, 5, 1).with(TemporalAdjusters.lastInMonth(DayOfWeek.MONDAY)),
            observed(LocalDate.of(year, 6, 19)),
            observed(LocalDate.of(year, 7, 4)),
            nthWeekdayOfMonth(year, 9, DayOfWeek.MONDAY, 1),
            nthWeekdayOfMonth(year, 11, DayOfWeek.THURSDAY, 4),
            observed(LocalDate.of(year, 12, 25))
        );
    }

    private static LocalDate observed(LocalDate date) {
        return switch (date.getDayOfWeek()) {
            case SATURDAY -> date.plusDays(2);
            case SUNDAY -> date.plusDays(1);
            default -> date;
        };
    }

    private static LocalDate nthWeekdayOfMonth(int year, int month, DayOfWeek dayOfWeek, int n) {
        return LocalDate.of(year, month, 1).with(TemporalAdjusters.dayOfWeekInMonth(n, dayOfWeek));
    }

    /**
     * Two days before Easter Sunday (anonymous Gregorian computus).
     */
    static LocalDate goodFriday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = (h + l - 7 * m + 114) % 31 + 1;
        return LocalDate.of(year, month, day).minusDays(2);
    }

    private MarketCalendar() {}
}
