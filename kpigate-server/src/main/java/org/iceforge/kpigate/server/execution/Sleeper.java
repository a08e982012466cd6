package org.iceforge.kpigate.server.execution;

import java.time.Duration;

/** Pause between status polls. Swapped out in tests so no real time passes. */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return d -> Thread.sleep(d.toMillis());
    }
}
