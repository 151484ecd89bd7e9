package in.zonecast.infrastructure.persistence;

import in.zonecast.application.port.output.EventStore;
import in.zonecast.domain.common.Phase;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEventStore implements EventStore {

    private record Key(LocalDate tradingDate, Phase phase) {
    }

    private final Map<Key, List<String>> events = new ConcurrentHashMap<>();
    private final Set<Key> complete = ConcurrentHashMap.newKeySet();

    @Override
    public void append(LocalDate tradingDate, Phase phase, String eventJson) {
        List<String> list = events.computeIfAbsent(new Key(tradingDate, phase), k -> new ArrayList<>());
        synchronized (list) {
            list.add(eventJson);
        }
    }

    @Override
    public List<String> events(LocalDate tradingDate, Phase phase) {
        List<String> list = events.get(new Key(tradingDate, phase));
        if (list == null) return List.of();
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    @Override
    public void markComplete(LocalDate tradingDate, Phase phase) {
        complete.add(new Key(tradingDate, phase));
    }

    @Override
    public boolean isComplete(LocalDate tradingDate, Phase phase) {
        return complete.contains(new Key(tradingDate, phase));
    }

    @Override
    public void clear(LocalDate tradingDate, Phase phase) {
        Key key = new Key(tradingDate, phase);
        events.remove(key);
        complete.remove(key);
    }
}
