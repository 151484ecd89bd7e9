package in.zonecast.infrastructure.persistence;

import in.zonecast.application.port.output.EventStore;
import in.zonecast.domain.common.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of EventStore.
 *
 * Tables: phase_events (seq, trading_date, phase, payload jsonb) and
 * phase_runs (trading_date, phase, completed_at).
 */
public final class PostgresEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresEventStore.class);

    private final DataSource dataSource;

    public PostgresEventStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void append(LocalDate tradingDate, Phase phase, String eventJson) {
        String sql = """
                INSERT INTO phase_events (trading_date, phase, payload)
                VALUES (?, ?, ?::jsonb)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setDate(1, Date.valueOf(tradingDate));
            ps.setString(2, phase.wireName());
            ps.setString(3, eventJson);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("[EVENTSTORE] Failed to append {} event for {}: {}", phase, tradingDate, e.getMessage(), e);
            throw new RuntimeException("Failed to append event", e);
        }
    }

    @Override
    public List<String> events(LocalDate tradingDate, Phase phase) {
        String sql = """
                SELECT payload::text AS payload
                FROM phase_events
                WHERE trading_date = ? AND phase = ?
                ORDER BY seq ASC
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setDate(1, Date.valueOf(tradingDate));
            ps.setString(2, phase.wireName());

            List<String> result = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getString("payload"));
                }
            }
            return result;
        } catch (SQLException e) {
            log.error("[EVENTSTORE] Failed to list {} events for {}: {}", phase, tradingDate, e.getMessage(), e);
            throw new RuntimeException("Failed to list events", e);
        }
    }

    @Override
    public void markComplete(LocalDate tradingDate, Phase phase) {
        String sql = """
                INSERT INTO phase_runs (trading_date, phase, completed_at)
                VALUES (?, ?, now())
                ON CONFLICT (trading_date, phase) DO UPDATE SET completed_at = now()
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setDate(1, Date.valueOf(tradingDate));
            ps.setString(2, phase.wireName());
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("[EVENTSTORE] Failed to mark {} complete for {}: {}", phase, tradingDate, e.getMessage(), e);
            throw new RuntimeException("Failed to mark phase complete", e);
        }
    }

    @Override
    public boolean isComplete(LocalDate tradingDate, Phase phase) {
        String sql = "SELECT 1 FROM phase_runs WHERE trading_date = ? AND phase = ? AND completed_at IS NOT NULL";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setDate(1, Date.valueOf(tradingDate));
            ps.setString(2, phase.wireName());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.error("[EVENTSTORE] Failed to read completion for {} {}: {}", phase, tradingDate, e.getMessage(), e);
            throw new RuntimeException("Failed to read phase completion", e);
        }
    }

    @Override
    public void clear(LocalDate tradingDate, Phase phase) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement events = conn.prepareStatement(
                        "DELETE FROM phase_events WHERE trading_date = ? AND phase = ?");
                    PreparedStatement runs = conn.prepareStatement(
                        "DELETE FROM phase_runs WHERE trading_date = ? AND phase = ?")) {
                for (PreparedStatement ps : List.of(events, runs)) {
                    ps.setDate(1, Date.valueOf(tradingDate));
                    ps.setString(2, phase.wireName());
                    ps.executeUpdate();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("[EVENTSTORE] Failed to clear {} for {}: {}", phase, tradingDate, e.getMessage(), e);
            throw new RuntimeException("Failed to clear phase events", e);
        }
    }
}
