package org.trump304.model.game.rules;

import org.trump304.model.game.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class TrickRules {
    private TrickRules(){}

    public static final Comparator<Card> BY_STRENGTH = Comparator.comparingInt(c -> c.getRank().getStrength());

    /** Leading: anything. Following: the lead suit if held, otherwise anything. */
    public static List<Card> validCards(List<Card> hand, Card.Suit leadSuit) {
        if (leadSuit == null) return new ArrayList<>(hand);
        List<Card> follow = hand.stream().filter(c -> c.getSuit() == leadSuit).toList();
        return follow.isEmpty() ? new ArrayList<>(hand) : new ArrayList<>(follow);
    }

    /**
     * Highest trump-suit card once a revealed trump was played, else highest card of the
     * lead suit. Trump-suit cards laid before the reveal compete with the revealed ones.
     * Ranking uses trick strength, not points.
     */
    public static TrickCard winner(List<TrickCard> trick) {
        if (trick.isEmpty()) throw new IllegalArgumentException("empty trick");
        Card.Suit lead = trick.get(0).card().getSuit();
        Card.Suit trumpSuit = trick.stream().filter(TrickCard::trump)
                .map(tc -> tc.card().getSuit()).findFirst().orElse(null);
        Card.Suit wanted = trumpSuit != null ? trumpSuit : lead;
        List<TrickCard> candidates = trick.stream().filter(tc -> tc.card().getSuit() == wanted).toList();
        TrickCard best = candidates.get(0);
        for (TrickCard tc : candidates) {
            if (BY_STRENGTH.compare(tc.card(), best.card()) > 0) best = tc;
        }
        return best;
    }

    public static int points(List<TrickCard> trick) {
        int sum = 0;
        for (TrickCard tc : trick) sum += tc.card().points();
        return sum;
    }
}
