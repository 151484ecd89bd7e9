package in.zonecast.support;

import in.zonecast.domain.data.Candle;
import in.zonecast.service.analysis.TechnicalAnalysisEngine;
import in.zonecast.service.state.StreamState;

import java.util.List;

/**
 * Builds stream states with candles and analytics already aligned.
 */
public final class TestStates {

    private static final TechnicalAnalysisEngine ENGINE = new TechnicalAnalysisEngine();

    public static StreamState withCandles(List<Candle> candles) {
        StreamState state = new StreamState(TestCandles.TRADING_DAY);
        for (Candle candle : candles) {
            state.appendCandle(candle);
            state.appendAnalysis(ENGINE.analyze(state.candles()));
        }
        return state;
    }

    private TestStates() {}
}
