package in.zonecast.service.decision;

import in.zonecast.domain.order.Order;
import in.zonecast.domain.order.OrderStatus;

import java.util.List;

/**
 * Position sizing from account value and recent outcomes.
 *
 * Risk per trade by approximate account value:
 * - below 50k: 500
 * - below 100k: 1000
 * - otherwise 1000 per full 100k
 *
 * The multiplier is that risk over {@link #BASE_RISK_DOLLARS}, stepped up after losses
 * (1x, 2x, 3x, then halving) and cut in drawdown: x0.25 beyond 18k, x0.5 beyond 15k,
 * capped at 2x beyond 10k.
 */
public final class RiskSizer {

    public static final double BASE_RISK_DOLLARS = 1000.0;
    /** Micro contracts per full-size contract. */
    public static final int MICROS_PER_CONTRACT = 10;

    public record ContractSize(String contract, int contracts) {
    }

    public static double riskPerTrade(double accountValue) {
        if (accountValue < 50_000.0) return 500.0;
        if (accountValue < 100_000.0) return 1000.0;
        return Math.floor(accountValue / 100_000.0) * 1000.0;
    }

    /**
     * Risk multiplier for the next order given the closed orders so far, oldest first.
     */
    public static double riskMultiplier(List<Order> closedOrders, double accountBalance) {
        double running = accountBalance;
        double peak = accountBalance;
        for (Order order : closedOrders) {
            running += valueOf(order, riskPerTrade(running));
            peak = Math.max(peak, running);
        }

        double valueBased = riskPerTrade(running) / BASE_RISK_DOLLARS;
        if (closedOrders.isEmpty()) return valueBased;

        double drawdown = peak - running;
        if (drawdown > 18_000.0) return valueBased * 0.25;
        if (drawdown > 15_000.0) return valueBased * 0.5;

        int sinceLastWin = 0;
        for (int i = closedOrders.size() - 1; i >= 0; i--) {
            if (closedOrders.get(i).status() == OrderStatus.PROFIT) break;
            sinceLastWin++;
        }

        double step;
        if (sinceLastWin == 0) step = 1.0;
        else if (sinceLastWin == 1) step = 2.0;
        else if (sinceLastWin == 2) step = 3.0;
        else step = Math.pow(0.5, sinceLastWin - 2);

        if (drawdown > 10_000.0) step = Math.min(step, 2.0);
        return valueBased * step;
    }

    /**
     * Micro contracts that fit the risk; ten or more become full-size contracts.
     *
     * @param baseContract full-size symbol, micros are prefixed with "M"
     */
    public static ContractSize contractsFor(double riskDollars, double riskPoints, String baseContract) {
        if (riskPoints <= 0 || riskDollars <= 0) {
            throw new IllegalArgumentException("Risk must be positive: dollars=" + riskDollars + ", points=" + riskPoints);
        }
        int micros = (int) Math.floor(riskDollars / (riskPoints * Order.DOLLARS_PER_MICRO));
        if (micros >= MICROS_PER_CONTRACT) {
            return new ContractSize(baseContract, (int) Math.round(micros / (double) MICROS_PER_CONTRACT));
        }
        return new ContractSize("M" + baseContract, micros);
    }

    private static double valueOf(Order order, double riskPerTrade) {
        double atRiskPerContract = order.riskPoints() * Order.DOLLARS_PER_MICRO;
        if (atRiskPerContract <= 0) return 0.0;
        int contracts = (int) Math.floor(riskPerTrade / atRiskPerContract);
        double atRisk = atRiskPerContract * contracts;
        return switch (order.status()) {
            case PROFIT -> atRisk * order.profitMultiplier();
            case LOSS -> -atRisk;
            default -> 0.0;
        };
    }

    private RiskSizer() {}
}
