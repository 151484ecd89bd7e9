package in.zonecast.transport.ws;

import in.zonecast.infrastructure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.LongSupplier;

/**
 * Broadcasts serialized events to subscribers from a single thread.
 *
 * The distributor thread owns the subscriber table and the shared pending buffer. Events
 * published while no subscriber is ready wait in the buffer, bounded at {@code pendingCap}
 * with oldest-first eviction, and go to the first subscriber that sends READY.
 */
public class EventDistributor {
    private static final Logger log = LoggerFactory.getLogger(EventDistributor.class);

    public static final int DEFAULT_PENDING_CAP = 100_000;

    private final BlockingQueue<DistributorCommand> inbox = new LinkedBlockingQueue<>();
    private final Map<String, Entry> subscribers = new LinkedHashMap<>();
    private final Deque<String> pending = new ArrayDeque<>();
    private final int pendingCap;
    private final PipelineMetrics metrics;
    private final LongSupplier clock;

    private volatile ControlListener controlListener;
    private volatile boolean running;
    private Thread thread;

    public EventDistributor(int pendingCap, PipelineMetrics metrics) {
        this(pendingCap, metrics, System::currentTimeMillis);
    }

    EventDistributor(int pendingCap, PipelineMetrics metrics, LongSupplier clock) {
        if (pendingCap <= 0) {
            throw new IllegalArgumentException("pendingCap must be positive: " + pendingCap);
        }
        this.pendingCap = pendingCap;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void setControlListener(ControlListener controlListener) {
        this.controlListener = controlListener;
    }

    public synchronized void start() {
        if (running) return;
        running = true;
        thread = new Thread(this::runLoop, "event-distributor");
        thread.setDaemon(true);
        thread.start();
        log.info("[DISTRIBUTOR] Started (pending cap {})", pendingCap);
    }

    public void stop() {
        Thread current;
        synchronized (this) {
            if (!running) return;
            current = thread;
        }
        inbox.add(new DistributorCommand.Shutdown());
        try {
            current.join(5_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public void publish(String json) {
        inbox.add(new DistributorCommand.Publish(json));
    }

    public void connect(Subscriber subscriber) {
        inbox.add(new DistributorCommand.Connect(subscriber));
    }

    public void disconnect(String subscriberId) {
        inbox.add(new DistributorCommand.Disconnect(subscriberId));
    }

    public void inbound(String subscriberId, String text) {
        inbox.add(new DistributorCommand.Inbound(subscriberId, text));
    }

    private void runLoop() {
        try {
            while (running) {
                DistributorCommand command = inbox.take();
                try {
                    handle(command);
                } catch (RuntimeException e) {
                    log.error("[DISTRIBUTOR] Failed to handle {}: {}", command.getClass().getSimpleName(), e.getMessage(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running = false;
            for (Entry entry : subscribers.values()) {
                entry.subscriber.close();
            }
            subscribers.clear();
            metrics.subscribers(0);
            log.info("[DISTRIBUTOR] Stopped");
        }
    }

    /**
     * Applies one command. Runs on the distributor thread, or directly in tests.
     */
    void handle(DistributorCommand command) {
        if (command instanceof DistributorCommand.Publish) {
            broadcast(((DistributorCommand.Publish) command).json());
        } else if (command instanceof DistributorCommand.Connect) {
            Subscriber subscriber = ((DistributorCommand.Connect) command).subscriber();
            subscribers.put(subscriber.id(), new Entry(subscriber));
            metrics.subscribers(subscribers.size());
            log.info("[DISTRIBUTOR] Subscriber {} connected ({} total)", subscriber.id(), subscribers.size());
        } else if (command instanceof DistributorCommand.Disconnect) {
            DistributorCommand.Disconnect disconnect = (DistributorCommand.Disconnect) command;
            Entry removed = subscribers.remove(disconnect.subscriberId());
            if (removed != null) {
                metrics.subscribers(subscribers.size());
                log.info("[DISTRIBUTOR] Subscriber {} disconnected ({} left)", disconnect.subscriberId(), subscribers.size());
            }
        } else if (command instanceof DistributorCommand.Inbound) {
            DistributorCommand.Inbound inbound = (DistributorCommand.Inbound) command;
            onInbound(inbound.subscriberId(), inbound.text());
        } else if (command instanceof DistributorCommand.Shutdown) {
            running = false;
        }
    }

    int pendingSize() {
        return pending.size();
    }

    int subscriberCount() {
        return subscribers.size();
    }

    private void broadcast(String json) {
        List<Entry> ready = new ArrayList<>();
        for (Entry entry : subscribers.values()) {
            if (entry.ready) ready.add(entry);
        }
        if (ready.isEmpty()) {
            buffer(json);
            return;
        }
        for (Entry entry : ready) {
            deliver(entry, json);
        }
    }

    private void buffer(String json) {
        if (pending.size() >= pendingCap) {
            pending.pollFirst();
            metrics.pendingEvicted();
            log.warn("[DISTRIBUTOR] Pending buffer full ({}), evicted oldest event", pendingCap);
        }
        pending.addLast(json);
        metrics.pendingSize(pending.size());
    }

    private void onInbound(String subscriberId, String text) {
        Entry entry = subscribers.get(subscriberId);
        if (entry == null) {
            log.warn("[DISTRIBUTOR] Message from unknown subscriber {}", subscriberId);
            return;
        }

        ControlMessage message;
        try {
            message = ControlMessage.parse(text);
        } catch (ControlMessageException e) {
            log.warn("[DISTRIBUTOR] Bad control message from {}: {} ({})", subscriberId, e.getMessage(), text);
            metrics.controlError();
            deliver(entry, EventJsonCodec.error(e.getMessage(), clock.getAsLong()));
            return;
        }

        if (message instanceof ControlMessage.Ready) {
            markReady(entry);
        } else if (message instanceof ControlMessage.Plan) {
            ControlMessage.Plan plan = (ControlMessage.Plan) message;
            log.info("[DISTRIBUTOR] PLAN {} ({} days) from {}", plan.date(), plan.days(), subscriberId);
            ControlListener listener = controlListener;
            if (listener != null) listener.onPlan(plan.date(), plan.days());
        } else if (message instanceof ControlMessage.Trade) {
            log.info("[DISTRIBUTOR] TRADE from {}", subscriberId);
            ControlListener listener = controlListener;
            if (listener != null) listener.onTrade();
        } else if (message instanceof ControlMessage.Speed) {
            double speed = ((ControlMessage.Speed) message).speed();
            log.info("[DISTRIBUTOR] SPEED {} from {} (advisory)", speed, subscriberId);
            deliver(entry, EventJsonCodec.lifecycle("replay", "speed=" + speed, clock.getAsLong()));
        }
    }

    private void markReady(Entry entry) {
        entry.ready = true;
        int drained = 0;
        while (!pending.isEmpty() && subscribers.containsKey(entry.subscriber.id())) {
            String json = pending.pollFirst();
            drained++;
            deliver(entry, json);
        }
        metrics.pendingSize(pending.size());
        log.info("[DISTRIBUTOR] Subscriber {} ready, flushed {} pending events", entry.subscriber.id(), drained);
    }

    private void deliver(Entry entry, String json) {
        try {
            entry.subscriber.send(json);
        } catch (IOException | RuntimeException e) {
            log.warn("[DISTRIBUTOR] Send to {} failed, dropping subscriber: {}", entry.subscriber.id(), e.getMessage());
            subscribers.remove(entry.subscriber.id());
            metrics.subscribers(subscribers.size());
            entry.subscriber.close();
        }
    }

    private static final class Entry {
        final Subscriber subscriber;
        boolean ready;

        Entry(Subscriber subscriber) {
            this.subscriber = subscriber;
        }
    }
}
