package com.contextfusion.engine.window;

import java.time.Instant;

/** Best recently-seen group name with the confidence of the window it came from. */
public record GroupCandidate(String name, double confidence, Instant lastSeen) {}
