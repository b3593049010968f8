package org.trump304.model.game.rules;

/** When a non-trumper may ask for the trump to be revealed. */
public enum CutPolicy {
    /** Only on your turn, mid-trick, holding no card of the lead suit. */
    VOID_IN_LEAD_SUIT,
    /** On your turn, mid-trick, whatever you hold. */
    ANY_TIME
}
