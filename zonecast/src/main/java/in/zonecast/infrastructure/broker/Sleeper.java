package in.zonecast.infrastructure.broker;

import java.time.Duration;

/**
 * Blocks the calling task between retry attempts. Tests substitute a recording sleeper.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
