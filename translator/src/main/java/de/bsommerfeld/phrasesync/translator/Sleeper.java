package de.bsommerfeld.phrasesync.translator;

import java.time.Duration;

/**
 * Blocking wait used for backoff and inter-batch pauses. Exists so tests can
 * record requested delays instead of actually sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
