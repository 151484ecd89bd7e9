package in.zonecast.service.zone;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class MarketCalendarTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "2024-01-01", "2024-01-15", "2024-02-19", "2024-03-29", "2024-05-27",
        "2024-06-19", "2024-07-04", "2024-09-02", "2024-11-28", "2024-12-25"
    })
    @DisplayName("2024 exchange holidays are not trading days")
    void testHolidays2024(String date) {
        LocalDate day = LocalDate.parse(date);

        assertTrue(MarketCalendar.isMarketHoliday(day), date + " should be a holiday");
        assertFalse(MarketCalendar.isTradingDay(day));
    }

    @Test
    @DisplayName("Fixed-date holidays on a weekend are observed on the Monday")
    void testObservedHolidays() {
        assertTrue(MarketCalendar.isMarketHoliday(LocalDate.of(2022, 12, 26)), "Christmas 2022 fell on a Sunday");
        assertTrue(MarketCalendar.isMarketHoliday(LocalDate.of(2021, 7, 5)), "July 4th 2021 fell on a Sunday");
        assertTrue(MarketCalendar.isMarketHoliday(LocalDate.of(2022, 6, 20)), "Juneteenth 2022 fell on a Sunday");
    }

    @Test
    void testGoodFriday() {
        assertEquals(LocalDate.of(2024, 3, 29), MarketCalendar.goodFriday(2024));
        assertEquals(LocalDate.of(2025, 4, 18), MarketCalendar.goodFriday(2025));
        assertEquals(LocalDate.of(2023, 4, 7), MarketCalendar.goodFriday(2023));
    }

    @Test
    void testWeekends() {
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2024, 3, 9)));
        assertFalse(MarketCalendar.isTradingDay(LocalDate.of(2024, 3, 10)));
        assertTrue(MarketCalendar.isTradingDay(LocalDate.of(2024, 3, 11)));
    }

    @Test
    @DisplayName("tradingDaysBack skips weekends and holidays")
    void testTradingDaysBack() {
        assertEquals(LocalDate.of(2024, 3, 4), MarketCalendar.tradingDaysBack(LocalDate.of(2024, 3, 5), 1));
        assertEquals(LocalDate.of(2024, 3, 1), MarketCalendar.tradingDaysBack(LocalDate.of(2024, 3, 5), 2));
        assertEquals(LocalDate.of(2024, 3, 28), MarketCalendar.tradingDaysBack(LocalDate.of(2024, 4, 1), 1),
            "Good Friday is skipped");
        assertThrows(IllegalArgumentException.class, () -> MarketCalendar.tradingDaysBack(LocalDate.of(2024, 3, 5), 0));
    }

    @Test
    void testOnOrAfter() {
        assertEquals(LocalDate.of(2024, 3, 11), MarketCalendar.onOrAfter(LocalDate.of(2024, 3, 9)));
        assertEquals(LocalDate.of(2024, 3, 5), MarketCalendar.onOrAfter(LocalDate.of(2024, 3, 5)));
        assertEquals(LocalDate.of(2024, 1, 2), MarketCalendar.onOrAfter(LocalDate.of(2024, 1, 1)));
    }

    @Test
    void testEarlyClose() {
        assertTrue(MarketCalendar.isEarlyCloseDay(LocalDate.of(2024, 7, 3)));
        assertTrue(MarketCalendar.isEarlyCloseDay(LocalDate.of(2024, 11, 27)));
        assertTrue(MarketCalendar.isEarlyCloseDay(LocalDate.of(2024, 12, 24)));
        assertFalse(MarketCalendar.isEarlyCloseDay(LocalDate.of(2024, 3, 5)));
    }
}
