package in.zonecast.infrastructure.persistence;

import in.zonecast.application.port.input.CandleSource;
import in.zonecast.application.port.input.CandleStream;
import in.zonecast.domain.data.Candle;
import in.zonecast.domain.data.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * One-minute candles held in memory. {@link #publish(Candle)} feeds open live streams.
 */
public class InMemoryCandleSource implements CandleSource {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCandleSource.class);

    private final List<Candle> candles = new ArrayList<>();
    private final List<LiveStream> liveStreams = new CopyOnWriteArrayList<>();

    public InMemoryCandleSource() {
    }

    public InMemoryCandleSource(List<Candle> oneMinute) {
        oneMinute.forEach(this::add);
    }

    /**
     * Adds a historical candle without notifying live streams.
     */
    public synchronized void add(Candle candle) {
        candles.add(candle);
        candles.sort(Comparator.comparingLong(Candle::timestamp));
    }

    /**
     * Adds a candle and hands it to every open live stream.
     */
    public void publish(Candle candle) {
        add(candle);
        for (LiveStream stream : liveStreams) {
            stream.offer(candle);
        }
    }

    @Override
    public synchronized CandleStream stream(long fromMs, long toMs, Resolution resolution) {
        List<Candle> range = new ArrayList<>();
        for (Candle c : candles) {
            if (c.timestamp() >= fromMs && c.timestamp() < toMs) range.add(c);
        }
        return new ListStream(CandleAggregator.aggregate(range, resolution));
    }

    @Override
    public synchronized CandleStream live(long fromMs) {
        LiveStream stream = new LiveStream();
        for (Candle c : candles) {
            if (c.timestamp() >= fromMs) stream.offer(c);
        }
        liveStreams.add(stream);
        return stream;
    }

    @Override
    public void close() {
        for (LiveStream stream : liveStreams) {
            stream.close();
        }
    }

    private static final class ListStream implements CandleStream {
        private final Iterator<Candle> iterator;

        ListStream(List<Candle> candles) {
            this.iterator = candles.iterator();
        }

        @Override
        public boolean hasNext() {
            return iterator.hasNext();
        }

        @Override
        public Candle next() {
            return iterator.next();
        }

        @Override
        public void close() {
        }
    }

    private final class LiveStream implements CandleStream {
        // Sentinel marking the end of the stream
        private final Candle endMarker = new Candle(Long.MIN_VALUE, 0, 0, 0, 0, 0);
        private final BlockingQueue<Candle> queue = new LinkedBlockingQueue<>();
        private Candle next;
        private volatile boolean closed;

        void offer(Candle candle) {
            if (!closed) queue.add(candle);
        }

        @Override
        public boolean hasNext() {
            if (next != null) return next != endMarker;
            try {
                next = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("[CANDLES] Live stream interrupted");
                next = endMarker;
            }
            return next != endMarker;
        }

        @Override
        public Candle next() {
            if (!hasNext()) throw new NoSuchElementException();
            Candle result = next;
            next = null;
            return result;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            liveStreams.remove(this);
            queue.add(endMarker);
        }
    }
}
