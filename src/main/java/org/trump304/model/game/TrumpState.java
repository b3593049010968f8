package org.trump304.model.game;

import lombok.Data;

@Data
public class TrumpState {
    private Integer trumperSeat;
    private Card.Suit suit;
    private Card card;
    private boolean revealed = false;
    private RevealReason revealReason;

    public boolean isSelected() { return suit != null; }

    /** Selected but still lying face down in front of the trumper. */
    public boolean isFaceDown() { return suit != null && !revealed; }

    public TrumpState copy() {
        TrumpState t = new TrumpState();
        t.setTrumperSeat(trumperSeat);
        t.setSuit(suit);
        t.setCard(card);
        t.setRevealed(revealed);
        t.setRevealReason(revealReason);
        return t;
    }
}
