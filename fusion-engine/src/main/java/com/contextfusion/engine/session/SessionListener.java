package com.contextfusion.engine.session;

/**
 * Session lifecycle notifications, fired after the corresponding store write succeeded.
 * Sessions passed to callbacks are copies.
 */
public interface SessionListener {

    default void onSessionStarted(DownloadSession session) {}

    default void onSessionEnded(DownloadSession session) {}

    default void onFileAdded(DownloadSession session, String fileName) {}

    default void onSessionTimedOut(DownloadSession session) {}
}
