package in.zonecast.service.pipeline;

import in.zonecast.application.port.input.CandleStream;
import in.zonecast.domain.common.Phase;
import in.zonecast.domain.data.Candle;
import in.zonecast.domain.event.Event;
import in.zonecast.domain.event.PhaseEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Drives one stream on its own thread: pulls candles, runs them through the pipeline and hands
 * each event, tagged with the phase, to the sink.
 *
 * Cancellation is checked between candles and completes the task normally.
 */
public class StreamTask implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(StreamTask.class);

    private final String name;
    private final Phase phase;
    private final Supplier<CandleStream> streamSupplier;
    private final EventPipeline pipeline;
    private final Consumer<PhaseEvent> sink;
    private final CompletableFuture<StreamStatus> completion = new CompletableFuture<>();

    private volatile StreamStatus status = StreamStatus.IDLE;
    private volatile boolean cancelRequested;
    private volatile CandleStream stream;
    private volatile long candlesProcessed;

    public StreamTask(String name, Phase phase, Supplier<CandleStream> streamSupplier,
                      EventPipeline pipeline, Consumer<PhaseEvent> sink) {
        this.name = name;
        this.phase = phase;
        this.streamSupplier = streamSupplier;
        this.pipeline = pipeline;
        this.sink = sink;
    }

    @Override
    public void run() {
        if (status != StreamStatus.IDLE) {
            throw new IllegalStateException("Stream " + name + " already ran: " + status);
        }
        status = StreamStatus.STREAMING;
        log.info("[STREAM] {} started (phase={}, mode={})", name, phase.wireName(), pipeline.getMode().label());

        try (CandleStream candles = streamSupplier.get()) {
            stream = candles;
            while (!cancelRequested && candles.hasNext()) {
                Candle candle = candles.next();
                List<Event> events = pipeline.onCandle(candle);
                for (Event event : events) {
                    sink.accept(new PhaseEvent(phase, event));
                }
                candlesProcessed++;
            }
            finish(cancelRequested ? StreamStatus.CANCELLED : StreamStatus.COMPLETED);
        } catch (RuntimeException e) {
            log.error("[STREAM] {} failed after {} candles: {}", name, candlesProcessed, e.getMessage(), e);
            status = StreamStatus.CANCELLED;
            completion.completeExceptionally(e);
        }
    }

    /**
     * Requests a stop. A live stream blocked waiting for candles is closed to unblock it.
     */
    public void cancel() {
        cancelRequested = true;
        CandleStream current = stream;
        if (current != null && pipeline.getMode() == StreamMode.LIVE) {
            current.close();
        }
    }

    public StreamStatus getStatus() {
        return status;
    }

    public CompletableFuture<StreamStatus> completion() {
        return completion;
    }

    public Phase getPhase() {
        return phase;
    }

    public String getName() {
        return name;
    }

    public long getCandlesProcessed() {
        return candlesProcessed;
    }

    public EventPipeline getPipeline() {
        return pipeline;
    }

    private void finish(StreamStatus finalStatus) {
        status = finalStatus;
        log.info("[STREAM] {} {} after {} candles", name, finalStatus, candlesProcessed);
        completion.complete(finalStatus);
    }
}
