package in.zonecast.application.port.input;

import in.zonecast.domain.data.Resolution;

/**
 * Supplies candles for replay and live streaming. May be queried repeatedly.
 */
public interface CandleSource extends AutoCloseable {

    /**
     * Bounded range {@code [fromMs, toMs)} in ascending timestamp order.
     */
    CandleStream stream(long fromMs, long toMs, Resolution resolution);

    /**
     * One-minute candles from {@code fromMs} onwards. {@code hasNext()} blocks until a candle
     * arrives and returns false only once the stream is closed.
     */
    CandleStream live(long fromMs);

    @Override
    default void close() {
    }
}
