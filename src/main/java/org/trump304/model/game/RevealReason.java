package org.trump304.model.game;

public enum RevealReason {
    VOLUNTARY,
    CUT_REQUEST,
    LAST_CARD // trumper has nothing left in hand but the face-down card
}
