package org.trump304.model.game;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class Seat {
    private final int index;
    private String playerId;
    private String name;
    private boolean connected = false;
    private List<Card> hand = new ArrayList<>();

    public boolean isTaken() { return playerId != null; }

    public boolean holds(Card c) { return hand.contains(c); }

    public boolean holdsSuit(Card.Suit suit) {
        for (Card c : hand) if (c.getSuit() == suit) return true;
        return false;
    }

    public Seat copy() {
        Seat s = new Seat(index);
        s.setPlayerId(playerId);
        s.setName(name);
        s.setConnected(connected);
        s.setHand(new ArrayList<>(hand));
        return s;
    }
}
