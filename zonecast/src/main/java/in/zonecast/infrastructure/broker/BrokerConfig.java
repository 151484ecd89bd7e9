package in.zonecast.infrastructure.broker;

import in.zonecast.util.Env;

/**
 * Connection settings for the REST broker.
 */
public record BrokerConfig(String baseUrl, String token, long accountId, String accountSpec) {

    public static BrokerConfig fromEnv() {
        return new BrokerConfig(
            Env.get("BROKER_BASE_URL", "https://demo.tradovateapi.com/v1"),
            Env.get("BROKER_TOKEN", ""),
            Long.parseLong(Env.get("BROKER_ACCOUNT_ID", "0")),
            Env.get("BROKER_ACCOUNT_SPEC", "")
        );
    }
}
