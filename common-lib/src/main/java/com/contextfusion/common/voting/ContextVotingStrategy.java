package com.contextfusion.common.voting;

import com.contextfusion.common.model.ContextSignal;

import java.util.List;

/**
 * Strategy contract for combining valid context signals into a single winner.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no reactive types, no side effects</li>
 *   <li><b>Deterministic</b>: identical input lists always produce the same winner</li>
 * </ul>
 *
 * <p>Current implementation: {@link WeightedContextVotingStrategy}. Register a different
 * implementation as a Spring {@code @Bean} to swap strategies without touching the engine.
 */
public interface ContextVotingStrategy {

    /**
     * @param validSignals non-null list of signals that already passed validity and
     *                     confidence-floor filtering (may be empty)
     * @return a {@link VoteOutcome}, never {@code null}; {@link VoteOutcome#empty()} for no input
     */
    VoteOutcome vote(List<ContextSignal> validSignals);
}
