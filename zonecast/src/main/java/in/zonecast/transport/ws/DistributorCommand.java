package in.zonecast.transport.ws;

/**
 * Work items for the distributor thread. Producers only ever enqueue these.
 */
interface DistributorCommand {

    record Publish(String json) implements DistributorCommand {}

    record Connect(Subscriber subscriber) implements DistributorCommand {}

    record Disconnect(String subscriberId) implements DistributorCommand {}

    record Inbound(String subscriberId, String text) implements DistributorCommand {}

    record Shutdown() implements DistributorCommand {}
}
