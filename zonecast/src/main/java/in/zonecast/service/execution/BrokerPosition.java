package in.zonecast.service.execution;

/**
 * Net position held at the broker. Zero means flat.
 */
public record BrokerPosition(String contract, int netPosition, long timestamp) {

    public boolean isFlat() {
        return netPosition == 0;
    }
}
