package in.zonecast.domain.order;

/**
 * Order status. Transitions only move forward; PROFIT, LOSS and CANCELLED are terminal.
 */
public enum OrderStatus {
    PLANNED,    // emitted by the decision engine, not yet at the broker
    PLACED,     // bracket accepted by the broker
    FILLED,     // entry executed
    PROFIT,     // target touched
    LOSS,       // stop touched
    CANCELLED;  // cancelled or invalidated before fill

    public boolean isTerminal() {
        return this == PROFIT || this == LOSS || this == CANCELLED;
    }

    public boolean canTransitionTo(OrderStatus next) {
        return switch (this) {
            case PLANNED -> next == PLACED || next == FILLED || next == CANCELLED;
            case PLACED -> next == FILLED || next == CANCELLED;
            case FILLED -> next == PROFIT || next == LOSS;
            case PROFIT, LOSS, CANCELLED -> false;
        };
    }
}
