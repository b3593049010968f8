package org.trump304.model.game;

public enum GamePhase {
    WAITING,
    DEALING,
    BIDDING,
    TRUMP_SELECTION,
    CARD_EXCHANGE, // 3 players only
    PLAYING,
    SCORING;

    public boolean isTimed() { return this == BIDDING || this == PLAYING; }
}
