package com.contextfusion.common.boost;

/** Which branch of the Session Priority Boost policy decided the outcome. */
public enum BoostCase {
    DISABLED,
    NO_SESSION,
    FOREGROUND_MISSING,
    FOREGROUND_WEAK,
    GROUP_MISMATCH,
    SAME_GROUP;

    public boolean boosts() {
        return this == FOREGROUND_MISSING || this == FOREGROUND_WEAK;
    }
}
