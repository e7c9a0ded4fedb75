package org.rostilos.gitvault.core.util;

import java.time.Duration;

/**
 * Pause between attempts. Replaced in tests so waits cost nothing.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
