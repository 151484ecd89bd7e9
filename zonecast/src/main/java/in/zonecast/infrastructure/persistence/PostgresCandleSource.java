package in.zonecast.infrastructure.persistence;

import in.zonecast.application.port.input.CandleSource;
import in.zonecast.application.port.input.CandleStream;
import in.zonecast.domain.data.Candle;
import in.zonecast.domain.data.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Reads one-minute candles from the {@code candles_1m} table (ts in epoch ms).
 *
 * Coarser resolutions are aggregated in memory. Live streams poll for new rows and keep
 * polling through database errors.
 */
public final class PostgresCandleSource implements CandleSource {
    private static final Logger log = LoggerFactory.getLogger(PostgresCandleSource.class);

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(5);

    private final DataSource dataSource;
    private final Duration pollInterval;

    public PostgresCandleSource(DataSource dataSource) {
        this(dataSource, POLL_INTERVAL);
    }

    public PostgresCandleSource(DataSource dataSource, Duration pollInterval) {
        this.dataSource = dataSource;
        this.pollInterval = pollInterval;
    }

    @Override
    public CandleStream stream(long fromMs, long toMs, Resolution resolution) {
        List<Candle> rows = query(fromMs, toMs);
        log.info("[CANDLES] Loaded {} one-minute candles for [{}, {})", rows.size(), fromMs, toMs);
        return new BufferedStream(CandleAggregator.aggregate(rows, resolution));
    }

    @Override
    public CandleStream live(long fromMs) {
        return new PollingStream(fromMs);
    }

    @Override
    public void close() {
        if (dataSource instanceof AutoCloseable) {
            try {
                ((AutoCloseable) dataSource).close();
            } catch (Exception e) {
                log.warn("[CANDLES] Failed to close data source: {}", e.getMessage());
            }
        }
    }

    private List<Candle> query(long fromMs, long toMs) {
        try {
            return select(fromMs, toMs);
        } catch (SQLException e) {
            log.error("[CANDLES] Query [{}, {}) failed: {}", fromMs, toMs, e.getMessage(), e);
            throw new RuntimeException("Failed to load candles", e);
        }
    }

    private List<Candle> select(long fromMs, long toMs) throws SQLException {
        String sql = """
                SELECT ts, open, high, low, close, volume
                FROM candles_1m
                WHERE ts >= ? AND ts < ?
                ORDER BY ts ASC
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, fromMs);
            ps.setLong(2, toMs);

            List<Candle> result = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new Candle(
                        rs.getLong("ts"),
                        rs.getDouble("open"),
                        rs.getDouble("high"),
                        rs.getDouble("low"),
                        rs.getDouble("close"),
                        rs.getLong("volume")
                    ));
                }
            }
            return result;
        }
    }

    private static final class BufferedStream implements CandleStream {
        private final Deque<Candle> buffer;

        BufferedStream(List<Candle> candles) {
            this.buffer = new ArrayDeque<>(candles);
        }

        @Override
        public boolean hasNext() {
            return !buffer.isEmpty();
        }

        @Override
        public Candle next() {
            Candle c = buffer.poll();
            if (c == null) throw new NoSuchElementException();
            return c;
        }

        @Override
        public void close() {
            buffer.clear();
        }
    }

    private final class PollingStream implements CandleStream {
        private final Deque<Candle> buffer = new ArrayDeque<>();
        private long cursor;
        private volatile boolean closed;

        PollingStream(long fromMs) {
            this.cursor = fromMs;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !closed) {
                List<Candle> rows = poll();
                if (!rows.isEmpty()) {
                    buffer.addAll(rows);
                    cursor = rows.get(rows.size() - 1).timestamp() + 1;
                    break;
                }
                try {
                    Thread.sleep(pollInterval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    closed = true;
                }
            }
            return !buffer.isEmpty();
        }

        @Override
        public Candle next() {
            if (!hasNext()) throw new NoSuchElementException();
            return buffer.poll();
        }

        // A failed poll is retried after the poll interval; only close() ends the stream.
        private List<Candle> poll() {
            try {
                return select(cursor, Long.MAX_VALUE);
            } catch (SQLException e) {
                log.warn("[CANDLES] Live poll from {} failed, retrying in {} ms: {}",
                    cursor, pollInterval.toMillis(), e.getMessage());
                return List.of();
            }
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
