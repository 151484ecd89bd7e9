package in.zonecast.infrastructure.persistence;

import in.zonecast.application.port.input.CandleStream;
import in.zonecast.domain.data.Candle;
import in.zonecast.domain.data.Resolution;
import in.zonecast.support.TestCandles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PostgresCandleSourceTest {

    private static final long START = TestCandles.at(LocalTime.of(9, 30));

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;
    @Mock
    private ResultSet rows;

    private PostgresCandleSource source;

    @BeforeEach
    void setUp() {
        source = new PostgresCandleSource(dataSource, Duration.ofMillis(1));
    }

    private void stubOneRow() throws SQLException {
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(rows);
        when(rows.next()).thenReturn(true, false);
        when(rows.getLong("ts")).thenReturn(START);
        when(rows.getDouble("open")).thenReturn(5000.0);
        when(rows.getDouble("high")).thenReturn(5002.0);
        when(rows.getDouble("low")).thenReturn(4999.0);
        when(rows.getDouble("close")).thenReturn(5001.0);
        when(rows.getLong("volume")).thenReturn(120L);
    }

    @Test
    @DisplayName("A failed live poll is retried and the stream keeps delivering")
    void testLivePollingSurvivesDatabaseError() throws Exception {
        // Arrange
        when(dataSource.getConnection())
            .thenThrow(new SQLException("connection refused"))
            .thenReturn(connection);
        stubOneRow();

        // Act
        Candle candle;
        try (CandleStream stream = source.live(START)) {
            assertTrue(stream.hasNext());
            candle = stream.next();
        }

        // Assert
        assertEquals(new Candle(START, 5000.0, 5002.0, 4999.0, 5001.0, 120L), candle);
        verify(dataSource, times(2)).getConnection();
        verify(statement).setLong(1, START);
        verify(statement).setLong(2, Long.MAX_VALUE);
    }

    @Test
    void testCloseEndsLiveStream() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        stubOneRow();

        try (CandleStream stream = source.live(START)) {
            assertTrue(stream.hasNext());
            stream.next();
            stream.close();
            assertFalse(stream.hasNext());
        }

        verify(statement).setLong(1, START);
    }

    @Test
    @DisplayName("Backfill queries fail fast")
    void testBackfillErrorPropagates() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        RuntimeException e = assertThrows(RuntimeException.class,
            () -> source.stream(START, START + TestCandles.MINUTE, Resolution.ONE_MINUTE));

        assertInstanceOf(SQLException.class, e.getCause());
    }
}
