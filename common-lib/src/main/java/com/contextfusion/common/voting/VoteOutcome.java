package com.contextfusion.common.voting;

import com.contextfusion.common.model.ContextSignal;
import com.contextfusion.common.model.SignalSource;

import java.util.Map;

/**
 * Immutable output of a {@link ContextVotingStrategy} run.
 *
 * @param winner       winning context, {@link ContextSignal#UNSORTED} when nothing voted
 * @param winningScore summed voting power of the winner
 * @param totals       summed voting power per context, in first-seen order
 * @param breakdown    voting power per source
 */
public record VoteOutcome(
    String winner,
    double winningScore,
    Map<String, Double> totals,
    Map<SignalSource, Double> breakdown
) {

    public static VoteOutcome empty() {
        return new VoteOutcome(ContextSignal.UNSORTED, 0.0, Map.of(), Map.of());
    }
}
