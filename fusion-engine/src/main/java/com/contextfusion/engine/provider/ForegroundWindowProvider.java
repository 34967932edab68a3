package com.contextfusion.engine.provider;

/**
 * Port for the currently focused window. How the window is obtained is outside this service.
 */
public interface ForegroundWindowProvider {

    /** Title of the focused window, or {@code null} when unknown. */
    String activeTitle();

    /** Process name of the focused window, or {@code null} when unknown. */
    String activeProcessName();
}
