package in.zonecast.service.zone;

import in.zonecast.domain.data.Candle;
import in.zonecast.domain.event.PlanZoneEvent;
import in.zonecast.domain.zone.PlanZone;
import in.zonecast.domain.zone.PlanZoneKind;
import in.zonecast.domain.zone.SwingPoint;
import in.zonecast.domain.zone.ZoneChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives supply and demand zones from the last swing high and swing low.
 *
 * Per candle:
 * 1. Build: SUPPLY when the low swing precedes the high swing and both sit above the close,
 *    DEMAND when the high swing precedes the low swing and both sit below the close.
 *    Zones are deduplicated by start timestamp; the start never decreases since both swings only move forward.
 * 2. Close: SUPPLY on a close above the band, DEMAND on a close below it.
 * 3. Merge: older active zones of the same kind engulfed by the newest active zone
 *    close at the newer zone's start.
 *
 * One CREATED and at most one CLOSED event per zone id. Only active zones are tracked;
 * closed ones are kept in a short history.
 */
public class PlanZoneTracker {
    private static final Logger log = LoggerFactory.getLogger(PlanZoneTracker.class);

    private static final int MAX_CLOSED_HISTORY = 200;

    private final Map<String, PlanZone> zones = new LinkedHashMap<>();
    private final List<PlanZone> closed = new ArrayList<>();
    private long lastStart = Long.MIN_VALUE;

    public List<PlanZoneEvent> onCandle(Candle candle, List<SwingPoint> swings) {
        List<PlanZoneEvent> events = new ArrayList<>();
        long ts = candle.timestamp();

        build(candle, swings, events);
        close(candle, events);
        merge(ts, events);

        return events;
    }

    private void build(Candle candle, List<SwingPoint> swings, List<PlanZoneEvent> events) {
        SwingPoint lastHigh = null;
        SwingPoint lastLow = null;
        for (int i = swings.size() - 1; i >= 0 && (lastHigh == null || lastLow == null); i--) {
            SwingPoint swing = swings.get(i);
            if (swing.isHigh() && lastHigh == null) lastHigh = swing;
            if (swing.isLow() && lastLow == null) lastLow = swing;
        }
        if (lastHigh == null || lastLow == null || lastLow.price() >= lastHigh.price()) {
            return;
        }

        PlanZoneKind kind;
        if (lastLow.timestamp() < lastHigh.timestamp() && lastLow.price() > candle.close()) {
            kind = PlanZoneKind.SUPPLY;
        } else if (lastLow.timestamp() > lastHigh.timestamp() && lastHigh.price() < candle.close()) {
            kind = PlanZoneKind.DEMAND;
        } else {
            return;
        }

        long start = Math.min(lastLow.timestamp(), lastHigh.timestamp());
        if (start <= lastStart) {
            return;
        }
        lastStart = start;

        PlanZone zone = PlanZone.open(kind, lastLow.price(), lastHigh.price(), start);
        zones.put(zone.id(), zone);
        events.add(new PlanZoneEvent(zone, ZoneChange.CREATED, candle.timestamp()));
        log.debug("[PLANZONE] Created {} [{} - {}]", zone.id(), zone.low(), zone.high());
    }

    private void close(Candle candle, List<PlanZoneEvent> events) {
        for (PlanZone zone : new ArrayList<>(zones.values())) {
            if (zone.isActive() && zone.isInvalidatedBy(candle.close())) {
                PlanZone done = zone.closedAt(candle.timestamp());
                retire(done);
                events.add(new PlanZoneEvent(done, ZoneChange.CLOSED, candle.timestamp()));
            }
        }
    }

    private void merge(long ts, List<PlanZoneEvent> events) {
        List<PlanZone> active = new ArrayList<>();
        for (PlanZone zone : zones.values()) {
            if (zone.isActive()) active.add(zone);
        }
        if (active.size() <= 1) return;

        active.sort(Comparator.comparingLong(PlanZone::startTimestamp));
        PlanZone newest = active.remove(active.size() - 1);

        // Engulfed zones close at the newer zone's start
        for (int i = active.size() - 1; i >= 0; i--) {
            PlanZone candidate = active.get(i);
            if (!newest.engulfs(candidate)) continue;

            PlanZone absorbed = candidate.closedAt(newest.startTimestamp());
            retire(absorbed);
            events.add(new PlanZoneEvent(absorbed, ZoneChange.CLOSED, ts));
            log.debug("[PLANZONE] Merged {} into {}", candidate.id(), newest.id());
        }
    }

    public List<PlanZone> activeZones() {
        return List.copyOf(zones.values());
    }

    /**
     * Recently closed zones followed by the active ones.
     */
    public List<PlanZone> allZones() {
        List<PlanZone> result = new ArrayList<>(closed);
        result.addAll(zones.values());
        return result;
    }

    private void retire(PlanZone done) {
        zones.remove(done.id());
        closed.add(done);
        if (closed.size() > MAX_CLOSED_HISTORY) {
            closed.remove(0);
        }
    }
}
