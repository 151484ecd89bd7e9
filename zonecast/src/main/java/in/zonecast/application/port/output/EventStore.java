package in.zonecast.application.port.output;

import in.zonecast.domain.common.Phase;

import java.time.LocalDate;
import java.util.List;

/**
 * Serialized events per (trading date, phase), with a completion flag per phase run.
 */
public interface EventStore {

    void append(LocalDate tradingDate, Phase phase, String eventJson);

    List<String> events(LocalDate tradingDate, Phase phase);

    void markComplete(LocalDate tradingDate, Phase phase);

    boolean isComplete(LocalDate tradingDate, Phase phase);

    /**
     * Drops stored events and the completion flag, before a phase is re-run.
     */
    void clear(LocalDate tradingDate, Phase phase);
}
