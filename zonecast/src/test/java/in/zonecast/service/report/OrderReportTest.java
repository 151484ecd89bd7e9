package in.zonecast.service.report;

import in.zonecast.domain.order.CancelReason;
import in.zonecast.domain.order.Order;
import in.zonecast.domain.order.OrderType;
import in.zonecast.support.TestCandles;
import in.zonecast.support.TestOrders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderReportTest {

    private static final String TREND = "Adaptive-TrendRiding-Score80-84";
    private static final String BREAKOUT = "Adaptive-Breakout-Score85-89";

    private static final long T1 = TestCandles.at(LocalTime.of(13, 0));
    private static final long T2 = TestCandles.at(LocalTime.of(13, 30));
    private static final long T3 = TestCandles.at(LocalTime.of(14, 0));

    @Test
    @DisplayName("Mixed day: averages, drawdown and win rates per strategy")
    void testMixedDay() {
        // Arrange
        Order winA = TestOrders.win("A", OrderType.LONG, TREND, "MES", 2, T1);
        Order lossB = TestOrders.loss("B", OrderType.SHORT, BREAKOUT, "ES", 1, T2);
        Order winC = TestOrders.win("C", OrderType.LONG, TREND, "MES", 2, T3);
        Order cancelled = TestOrders.planned("D", OrderType.LONG, TREND, "MES", 1, T1)
            .cancelled(T1, CancelReason.END_OF_DAY);

        // Act
        OrderReport report = OrderReport.of(List.of(winC, cancelled, lossB, winA));

        // Assert
        assertEquals(4, report.orders().size());
        assertEquals(2, report.winning());
        assertEquals(1, report.losing());
        assertEquals(250.0, report.averageWinDollars(), 1e-9);
        assertEquals(500.0, report.averageLossDollars(), 1e-9);
        assertEquals(4.0 / 3.0, report.averageR(), 1e-9);
        assertEquals(500.0, report.maxDrawdownDollars(), 1e-9);
        assertEquals(0.0, report.totalPnL(), 1e-9);
        assertNull(report.profitable());

        assertEquals(2, report.winRates().size());
        assertEquals(TREND, report.winRates().get(0).entryStrategy());
        assertEquals(1.0, report.winRates().get(0).winRate());
        assertEquals(0.0, report.winRates().get(1).winRate());
    }

    @Test
    void testProfitableDay() {
        OrderReport report = OrderReport.of(List.of(TestOrders.win("A", OrderType.SHORT, TREND, "ES", 1, T1)));

        assertEquals(1250.0, report.totalPnL(), 1e-9);
        assertEquals(Boolean.TRUE, report.profitable());
        assertEquals(0.0, report.maxDrawdownDollars());
    }

    @Test
    void testEmptyDay() {
        OrderReport report = OrderReport.of(List.of());

        assertEquals(0, report.winning());
        assertEquals(0.0, report.averageR());
        assertTrue(report.winRates().isEmpty());
        assertNull(report.profitable());
    }
}
