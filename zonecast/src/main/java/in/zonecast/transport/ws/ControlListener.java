package in.zonecast.transport.ws;

import java.time.LocalDate;

/**
 * Receives phase commands arriving over the WebSocket.
 */
public interface ControlListener {

    void onPlan(LocalDate date, int days);

    void onTrade();
}
