package com.pocketca.crypto;

import java.time.Duration;

/**
 * Observer for key generation progress.
 *
 * <p>Events are advisory only. Exceptions thrown by a listener are logged and
 * never change the outcome of key generation.
 */
public interface KeyGenerationListener {

    /** Listener that ignores every event */
    KeyGenerationListener NONE = new KeyGenerationListener() {
    };

    default void onStarted(KeySpec spec) {
    }

    default void onCompleted(KeySpec spec, Duration elapsed) {
    }
}
