package org.trump304.service.game;

import org.trump304.model.game.*;

import java.util.ArrayList;
import java.util.List;

/** Hand-built sessions for rule tests. */
final class Fixtures {
    private Fixtures() {}

    static Card c(String id) { return Card.fromId(id); }

    static List<Card> cards(String... ids) {
        List<Card> out = new ArrayList<>();
        for (String id : ids) out.add(Card.fromId(id));
        return out;
    }

    /** All seats taken by players p0..pN. */
    static GameSession seated(int mode) {
        GameSession s = new GameSession("TEST01", mode);
        for (Seat seat : s.getSeats().values()) {
            seat.setPlayerId("p" + seat.getIndex());
            seat.setName("Player " + seat.getIndex());
        }
        return s;
    }

    static void hand(GameSession s, int seat, String... ids) {
        s.seat(seat).getHand().clear();
        s.seat(seat).getHand().addAll(cards(ids));
    }

    static void captured(GameSession s, int seat, String... ids) {
        s.getCaptured().computeIfAbsent(seat, k -> new ArrayList<>()).addAll(cards(ids));
    }

    /** Every card of the given suits, e.g. {@code suits("hearts")}. */
    static String[] suits(String... suits) {
        List<String> ids = new ArrayList<>();
        for (String suit : suits) {
            for (Card.Rank r : Card.Rank.values()) ids.add(r.getLabel() + "_" + suit);
        }
        return ids.toArray(new String[0]);
    }

    /** Bidding closed at {@code bid} for {@code trumper}, trump chosen, trick 1 about to start. */
    static GameSession playing(int mode, int dealer, int trumper, int bid, String trumpCard, boolean revealed) {
        GameSession s = seated(mode);
        s.setDealerSeat(dealer);
        Bid b = new Bid(trumper, bid);
        s.getBids().add(b);
        s.setCurrentBid(b);
        Card card = Card.fromId(trumpCard);
        TrumpState t = s.getTrump();
        t.setTrumperSeat(trumper);
        t.setSuit(card.getSuit());
        t.setCard(card);
        if (revealed) {
            t.setRevealed(true);
            t.setRevealReason(RevealReason.VOLUNTARY);
        }
        s.setExchangeDone(mode == 3);
        s.setPhase(GamePhase.PLAYING);
        s.setTrickNumber(1);
        s.setTurnSeat((dealer + 1) % mode);
        return s;
    }

    /** Lays cards already played this trick, starting with the leader. */
    static void trick(GameSession s, int leader, String... ids) {
        List<Card> played = cards(ids);
        for (int i = 0; i < played.size(); i++) {
            int seat = (leader + i) % s.getMode();
            Card card = played.get(i);
            boolean trump = s.getTrump().isRevealed() && card.getSuit() == s.getTrump().getSuit();
            s.getCurrentTrick().add(new TrickCard(seat, card, trump));
        }
        s.setTurnSeat((leader + played.size()) % s.getMode());
    }
}
