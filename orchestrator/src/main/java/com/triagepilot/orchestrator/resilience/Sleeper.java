package com.triagepilot.orchestrator.resilience;

import java.time.Duration;

/**
 * Backoff pause. Swapped for a recording no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
