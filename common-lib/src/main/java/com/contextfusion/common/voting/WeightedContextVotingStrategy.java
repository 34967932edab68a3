package com.contextfusion.common.voting;

import com.contextfusion.common.model.ContextSignal;
import com.contextfusion.common.model.SignalSource;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link ContextVotingStrategy}: sum of voting power per context.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Group signals by {@code detectedContext} (exact match, first-seen order).</li>
 *   <li>Sum {@code weight × confidence} per group.</li>
 *   <li>The group with the highest total wins.</li>
 * </ol>
 *
 * <h3>Tie-break</h3>
 * <pre>
 *   equal totals  → higher best single-signal confidence within the group
 *   still equal   → group first seen in collection order (FOREGROUND, BACKGROUND, SESSION, PATTERN)
 * </pre>
 *
 * <p>This class is stateless and thread-safe. It does NOT modify the signals.
 */
public class WeightedContextVotingStrategy implements ContextVotingStrategy {

    /** Totals closer than this are treated as equal before applying the tie-break. */
    static final double SCORE_EPSILON = 1e-9;

    @Override
    public VoteOutcome vote(List<ContextSignal> validSignals) {
        if (validSignals == null || validSignals.isEmpty()) {
            return VoteOutcome.empty();
        }

        Map<String, Double> totals        = new LinkedHashMap<>();
        Map<String, Double> maxConfidence = new LinkedHashMap<>();
        Map<SignalSource, Double> breakdown = new EnumMap<>(SignalSource.class);

        for (ContextSignal s : validSignals) {
            totals.merge(s.detectedContext(), s.votingPower(), Double::sum);
            maxConfidence.merge(s.detectedContext(), s.confidence(), Math::max);
            breakdown.merge(s.source(), s.votingPower(), Double::sum);
        }

        String winner = null;
        double best   = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> e : totals.entrySet()) {
            double score = e.getValue();
            if (winner == null || score > best + SCORE_EPSILON) {
                winner = e.getKey();
                best   = score;
            } else if (Math.abs(score - best) <= SCORE_EPSILON
                       && maxConfidence.get(e.getKey()) > maxConfidence.get(winner) + SCORE_EPSILON) {
                winner = e.getKey();
                best   = Math.max(best, score);
            }
        }

        return new VoteOutcome(winner, totals.get(winner),
                               Collections.unmodifiableMap(totals),
                               Collections.unmodifiableMap(breakdown));
    }
}
