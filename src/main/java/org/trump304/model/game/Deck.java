package org.trump304.model.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public final class Deck {
    public static final int SIZE = 32;
    public static final int TOTAL_POINTS = 304;

    private Deck() {}

    public static List<Card> newDeck() {
        List<Card> cards = new ArrayList<>(SIZE);
        for (Card.Suit s : Card.Suit.values()) {
            for (Card.Rank r : Card.Rank.values()) cards.add(new Card(r, s));
        }
        return cards;
    }

    public static List<Card> shuffle(List<Card> deck, Random rnd) {
        Collections.shuffle(deck, rnd);
        return deck;
    }

    public static int points(Iterable<Card> cards) {
        int sum = 0;
        for (Card c : cards) sum += c.points();
        return sum;
    }
}
