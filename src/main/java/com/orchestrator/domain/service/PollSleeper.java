package com.orchestrator.domain.service;

import java.time.Duration;

/**
 * Wait between two polls of an external job.
 */
@FunctionalInterface
public interface PollSleeper {

    void sleep(Duration duration) throws InterruptedException;

    static PollSleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
