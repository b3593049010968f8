package org.trump304.model.game.rules;

public enum IllegalPlayPolicy {
    /** Illegal plays are refused and nothing changes. */
    REJECT,
    /** Illegal plays by the seat to act are committed and the hand is forfeited. */
    FORFEIT
}
