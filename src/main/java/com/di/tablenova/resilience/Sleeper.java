package com.di.tablenova.resilience;

import java.time.Duration;

/** Backoff pause; replaced in tests to avoid real sleeping. */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
}
