package com.contextfusion.common.model;

/**
 * Independent observation channels that can propose a classification for a file.
 *
 * <ul>
 *   <li>{@link #FOREGROUND}: the focused window of the source application at observation time</li>
 *   <li>{@link #BACKGROUND}: the tracker's cache of recently seen source windows</li>
 *   <li>{@link #SESSION}:   the active download session (the ongoing batch)</li>
 *   <li>{@link #PATTERN}:   a learned extension / name / time-of-day pattern</li>
 * </ul>
 *
 * <p>Declaration order is the collection order used by the fusion engine and the final
 * tie-break of {@code WeightedContextVotingStrategy}.
 */
public enum SignalSource {
    FOREGROUND,
    BACKGROUND,
    SESSION,
    PATTERN
}
