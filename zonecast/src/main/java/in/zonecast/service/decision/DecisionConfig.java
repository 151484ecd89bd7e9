package in.zonecast.service.decision;

import in.zonecast.util.Env;

/**
 * Tunables of the decision engine.
 *
 * @param contractSymbol full-size contract; micros are sized as "M" + symbol
 */
public record DecisionConfig(double accountBalance, int minSignalScore, double dailyRCap, String contractSymbol) {

    public static DecisionConfig defaults() {
        return new DecisionConfig(50_000.0, 75, 6.0, "ES");
    }

    public static DecisionConfig fromEnv() {
        return new DecisionConfig(
            Env.getDouble("ACCOUNT_BALANCE", 50_000.0),
            Env.getInt("MIN_SIGNAL_SCORE", 75),
            Env.getDouble("DAILY_R_CAP", 6.0),
            Env.get("CONTRACT_SYMBOL", "ES")
        );
    }
}
