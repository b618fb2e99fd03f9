package com.fplrefresh.common;

import java.time.Duration;

/**
 * Blocking pause between retries. Swapped for a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());
}
