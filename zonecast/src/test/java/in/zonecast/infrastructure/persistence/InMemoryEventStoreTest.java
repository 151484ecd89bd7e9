package in.zonecast.infrastructure.persistence;

import in.zonecast.domain.common.Phase;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventStoreTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 5);

    @Test
    void testAppendKeepsOrderPerPhase() {
        InMemoryEventStore store = new InMemoryEventStore();

        store.append(DAY, Phase.PLANNING, "{\"n\":1}");
        store.append(DAY, Phase.PLANNING, "{\"n\":2}");
        store.append(DAY, Phase.TRADING, "{\"n\":3}");

        assertEquals(List.of("{\"n\":1}", "{\"n\":2}"), store.events(DAY, Phase.PLANNING));
        assertEquals(List.of("{\"n\":3}"), store.events(DAY, Phase.TRADING));
        assertTrue(store.events(DAY.plusDays(1), Phase.PLANNING).isEmpty());
    }

    @Test
    void testCompletionAndClear() {
        InMemoryEventStore store = new InMemoryEventStore();
        store.append(DAY, Phase.PREPARING, "{}");
        store.markComplete(DAY, Phase.PREPARING);

        assertTrue(store.isComplete(DAY, Phase.PREPARING));
        assertFalse(store.isComplete(DAY, Phase.PLANNING));

        store.clear(DAY, Phase.PREPARING);

        assertFalse(store.isComplete(DAY, Phase.PREPARING));
        assertTrue(store.events(DAY, Phase.PREPARING).isEmpty());
    }

    @Test
    void testReturnedListIsSnapshot() {
        InMemoryEventStore store = new InMemoryEventStore();
        store.append(DAY, Phase.TRADING, "a");
        List<String> before = store.events(DAY, Phase.TRADING);

        store.append(DAY, Phase.TRADING, "b");

        assertEquals(1, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.add("c"));
    }
}
