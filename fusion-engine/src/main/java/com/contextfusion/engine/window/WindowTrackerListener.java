package com.contextfusion.engine.window;

/**
 * Receives cache changes from {@link BackgroundWindowTracker}. Callbacks run after the
 * tracker lock is released.
 */
public interface WindowTrackerListener {

    default void onWindowDetected(WindowCandidate window) {}

    default void onWindowActivated(WindowCandidate window) {}

    default void onWindowRemoved(WindowCandidate window) {}
}
