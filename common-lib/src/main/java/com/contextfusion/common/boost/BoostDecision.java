package com.contextfusion.common.boost;

import com.contextfusion.common.model.ContextSignal;

import java.util.List;

/**
 * Output of {@link SessionPriorityBoost#evaluate}.
 *
 * @param signals  signals to vote with; re-weighted copies when {@code applied}, else the input
 * @param applied  true when the session signal was boosted
 * @param reason   human-readable explanation, {@code null} when not applied
 * @param boostCase branch that decided the outcome
 */
public record BoostDecision(
    List<ContextSignal> signals,
    boolean applied,
    String reason,
    BoostCase boostCase
) {

    public BoostDecision {
        signals = List.copyOf(signals);
    }

    static BoostDecision unchanged(List<ContextSignal> signals, BoostCase boostCase) {
        return new BoostDecision(signals, false, null, boostCase);
    }
}
