package in.zonecast.service.report;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import in.zonecast.application.port.output.EventStore;
import in.zonecast.domain.common.EventType;
import in.zonecast.domain.common.Phase;
import in.zonecast.domain.order.Order;
import in.zonecast.transport.ws.EventJsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds order reports from the stored events of the TRADING phase.
 */
public class ReportService {
    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final EventStore eventStore;
    private final ObjectReader orderReader = EventJsonCodec.mapper()
        .readerFor(Order.class)
        .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public ReportService(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    public OrderReport report(LocalDate tradingDate) {
        return OrderReport.of(orders(tradingDate));
    }

    /**
     * Latest state of each order emitted on the day, in first-seen order.
     */
    public List<Order> orders(LocalDate tradingDate) {
        Map<String, Order> latest = new LinkedHashMap<>();
        String payloadField = EventType.ORDER.payloadField();

        for (String json : eventStore.events(tradingDate, Phase.TRADING)) {
            try {
                JsonNode node = EventJsonCodec.mapper().readTree(json);
                if (!EventType.ORDER.wireName().equals(node.path("eventType").asText())) continue;
                Order order = orderReader.readValue(node.get(payloadField));
                latest.put(order.id(), order);
            } catch (IOException e) {
                log.warn("[REPORT] Skipping unreadable event for {}: {}", tradingDate, e.getMessage());
            }
        }
        return new ArrayList<>(latest.values());
    }
}
