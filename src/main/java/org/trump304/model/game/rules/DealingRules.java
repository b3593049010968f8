package org.trump304.model.game.rules;

import org.trump304.model.game.*;

import java.util.*;

public final class DealingRules {
    private DealingRules(){}

    public static final int BATCH = 4;

    public record Deal(Map<Integer, List<Card>> hands, List<Card> centerPile) {}

    public static int handSize(int mode) {
        return switch (mode) {
            case 2 -> 4;
            case 3, 4 -> 8;
            default -> throw new GameRuleException(ErrorCode.INVALID_MODE);
        };
    }

    /**
     * Deals in batches of four starting left of the dealer. Whatever is not dealt
     * becomes the center pile (24 cards in 2p, 8 in 3p, none in 4p).
     */
    public static Deal deal(List<Card> deck, int mode, int dealerSeat) {
        int size = handSize(mode);
        if (deck.size() != Deck.SIZE) throw new IllegalArgumentException("Deck must hold " + Deck.SIZE + " cards");

        Map<Integer, List<Card>> hands = new TreeMap<>();
        for (int s = 0; s < mode; s++) hands.put(s, new ArrayList<>(size));

        int idx = 0;
        for (int dealt = 0; dealt < size; dealt += BATCH) {
            for (int k = 1; k <= mode; k++) {
                int seat = (dealerSeat + k) % mode;
                hands.get(seat).addAll(deck.subList(idx, idx + BATCH));
                idx += BATCH;
            }
        }
        return new Deal(hands, new ArrayList<>(deck.subList(idx, deck.size())));
    }

    public static void dealInto(GameSession s, Random rnd) {
        s.setPhase(GamePhase.DEALING);
        Deal d = deal(Deck.shuffle(Deck.newDeck(), rnd), s.getMode(), s.getDealerSeat());
        for (Seat seat : s.getSeats().values()) {
            seat.getHand().clear();
            seat.getHand().addAll(d.hands().get(seat.getIndex()));
        }
        s.getCenterPile().clear();
        s.getCenterPile().addAll(d.centerPile());
    }
}
