package in.zonecast.application.port.input;

import in.zonecast.domain.data.Candle;

import java.util.Iterator;

/**
 * Timestamp-ordered candles from a {@link CandleSource}. Must be closed by the consumer.
 */
public interface CandleStream extends Iterator<Candle>, AutoCloseable {

    @Override
    void close();
}
