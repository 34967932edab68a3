package com.contextfusion.common.confidence;

import com.contextfusion.common.model.ContextSignal;

import java.time.Duration;
import java.util.List;

/**
 * Confidence formulas shared by the signal collectors, the burst detector and the fusion engine.
 *
 * <p>All methods are pure and clamp their result to [0.0, 1.0].
 */
public final class SignalConfidenceCalculator {

    /** Confidence of a foreground signal whose window identifies the source application. */
    public static final double FOREGROUND_CONFIDENCE = 0.95;

    /** Pattern experience bonus is capped at this value. */
    public static final double MAX_EXPERIENCE_BONUS = 0.1;

    /** Agreement bonus when more than one signal carries the winner. */
    public static final double CONSENSUS_BONUS = 0.1;

    /** Penalty per valid signal naming a different context. */
    public static final double DISAGREEMENT_PENALTY = 0.05;

    /** Burst file count at which confidence saturates to 1.0. */
    public static final int BURST_SATURATION_COUNT = 10;

    /** Average interval below which a burst's interval score is perfect. */
    public static final double FAST_INTERVAL_SECONDS = 2.0;

    private SignalConfidenceCalculator() {}

    /** Linear decay: {@code max(0, 1 - age/horizon)}; 0 for a non-positive horizon. */
    public static double ageDecay(Duration age, double horizonSeconds) {
        if (horizonSeconds <= 0) return 0.0;
        double ageSeconds = Math.max(0.0, age.toMillis() / 1000.0);
        return clamp(1.0 - ageSeconds / horizonSeconds);
    }

    /** Stored session score decayed over twice the session timeout since the last activity. */
    public static double sessionConfidence(double storedScore, Duration sinceLastActivity, int timeoutSeconds) {
        return clamp(storedScore * ageDecay(sinceLastActivity, 2.0 * timeoutSeconds));
    }

    /** Background window confidence decayed over the maximum signal age. */
    public static double backgroundConfidence(double candidateConfidence, Duration age, double maxSignalAgeSeconds) {
        return clamp(candidateConfidence * ageDecay(age, maxSignalAgeSeconds));
    }

    /** Pattern score plus an experience bonus of {@code min(0.1, timesSeen/100)}. */
    public static double patternConfidence(double score, int timesSeen) {
        double bonus = Math.min(MAX_EXPERIENCE_BONUS, Math.max(0, timesSeen) / 100.0);
        return clamp(score + bonus);
    }

    /**
     * Mean confidence of the signals naming {@code winner}, plus {@value #CONSENSUS_BONUS} when
     * more than one agrees, minus {@value #DISAGREEMENT_PENALTY} per valid disagreeing signal.
     */
    public static double overallConfidence(List<ContextSignal> validSignals, String winner) {
        double sum = 0;
        int agreeing = 0;
        int disagreeing = 0;
        for (ContextSignal s : validSignals) {
            if (s.detectedContext().equals(winner)) {
                sum += s.confidence();
                agreeing++;
            } else if (s.isValid()) {
                disagreeing++;
            }
        }
        if (agreeing == 0) return 0.0;

        double confidence = sum / agreeing;
        if (agreeing > 1) confidence += CONSENSUS_BONUS;
        confidence -= DISAGREEMENT_PENALTY * disagreeing;
        return clamp(confidence);
    }

    /**
     * Burst confidence from the file count and the mean spacing between files.
     * 0 below two files; 1 at or beyond {@value #BURST_SATURATION_COUNT} files.
     */
    public static double burstConfidence(int fileCount, double averageIntervalSeconds) {
        if (fileCount < 2) return 0.0;
        if (fileCount >= BURST_SATURATION_COUNT) return 1.0;

        double countScore = Math.min((double) fileCount / BURST_SATURATION_COUNT, 1.0);
        double intervalScore = averageIntervalSeconds < FAST_INTERVAL_SECONDS
            ? 1.0
            : Math.max(0.0, 1.0 - averageIntervalSeconds / BURST_SATURATION_COUNT);
        return clamp((countScore + intervalScore) / 2.0);
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
