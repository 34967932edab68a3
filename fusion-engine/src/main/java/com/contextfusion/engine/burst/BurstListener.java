package com.contextfusion.engine.burst;

/**
 * Receives burst lifecycle notifications from {@link DownloadBurstDetector}.
 * Callbacks run on the recording thread after the detector lock is released.
 */
public interface BurstListener {

    default void onBurstStarted(BurstStatus status) {}

    default void onBurstContinued(BurstStatus status) {}

    default void onBurstEnded(BurstStatus status) {}
}
