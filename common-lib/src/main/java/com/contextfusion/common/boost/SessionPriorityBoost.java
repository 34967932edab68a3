package com.contextfusion.common.boost;

import com.contextfusion.common.model.ContextSignal;
import com.contextfusion.common.model.SignalSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Session Priority Boost: keeps a running batch together when the user switches away.
 *
 * <h3>Engagement</h3>
 * <p>Only when boosting is enabled AND a valid {@link SignalSource#SESSION} signal is present.
 *
 * <h3>Case A: foreground missing or weak → boost</h3>
 * <p>No foreground signal, or its voting power is below {@link BoostSettings#weakThreshold()}.
 * The session signal's weight is multiplied by {@link BoostSettings#multiplier()} and flagged
 * {@code wasBoosted}; every other signal's weight is multiplied by
 * {@link BoostSettings#dampeningFactor()}.
 *
 * <h3>Case B: foreground strong, different group → no boost</h3>
 * <p>The user has switched to another chat; the foreground wins on its own weight.
 *
 * <p>A strong foreground naming the session's own group also leaves weights untouched.
 * Group comparison is case-insensitive.
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class SessionPriorityBoost {

    private SessionPriorityBoost() {}

    /**
     * @param validSignals signals that already passed validity and confidence-floor filtering
     * @param settings     boost tunables
     * @return {@link BoostDecision}; never null
     */
    public static BoostDecision evaluate(List<ContextSignal> validSignals, BoostSettings settings) {
        if (!settings.enabled()) {
            return BoostDecision.unchanged(validSignals, BoostCase.DISABLED);
        }

        Optional<ContextSignal> session = find(validSignals, SignalSource.SESSION);
        if (session.isEmpty() || !session.get().isValid()) {
            return BoostDecision.unchanged(validSignals, BoostCase.NO_SESSION);
        }

        Optional<ContextSignal> foreground = find(validSignals, SignalSource.FOREGROUND);
        String reason;
        BoostCase boostCase;
        if (foreground.isEmpty()) {
            boostCase = BoostCase.FOREGROUND_MISSING;
            reason = "Foreground missing (user switched apps) - maintaining batch consistency";
        } else if (foreground.get().votingPower() < settings.weakThreshold()) {
            boostCase = BoostCase.FOREGROUND_WEAK;
            reason = String.format(Locale.ROOT, "Foreground weak (power: %.2f < threshold: %.2f) - maintaining batch consistency",
                foreground.get().votingPower(), settings.weakThreshold());
        } else if (!foreground.get().detectedContext().equalsIgnoreCase(session.get().detectedContext())) {
            return BoostDecision.unchanged(validSignals, BoostCase.GROUP_MISMATCH);
        } else {
            return BoostDecision.unchanged(validSignals, BoostCase.SAME_GROUP);
        }

        List<ContextSignal> reweighted = new ArrayList<>(validSignals.size());
        for (ContextSignal s : validSignals) {
            reweighted.add(s.source() == SignalSource.SESSION
                ? s.boosted(settings.multiplier())
                : s.dampened(settings.dampeningFactor()));
        }
        return new BoostDecision(reweighted, true, reason, boostCase);
    }

    private static Optional<ContextSignal> find(List<ContextSignal> signals, SignalSource source) {
        return signals.stream().filter(s -> s.source() == source).findFirst();
    }
}
