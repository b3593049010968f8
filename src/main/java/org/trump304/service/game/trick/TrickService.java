package org.trump304.service.game.trick;

import lombok.extern.slf4j.Slf4j;
import org.trump304.model.game.*;
import org.trump304.model.game.rules.TrickRules;
import org.trump304.service.game.engine.GameEvent;
import org.springframework.stereotype.Service;

import java.util.*;

@Slf4j
@Service
public class TrickService {

    /** Recomputed from the session every time; empty unless {@code seat} is to play. */
    public List<Card> validCardsFor(GameSession s, int seat) {
        if (s.getPhase() != GamePhase.PLAYING || !Objects.equals(s.getTurnSeat(), seat)) return List.of();
        return TrickRules.validCards(s.seat(seat).getHand(), s.leadSuit());
    }

    /** Throws OUT_OF_TURN or ILLEGAL_CARD without touching the session. */
    public void checkPlay(GameSession s, int seat, Card card) {
        if (s.getPhase() != GamePhase.PLAYING) throw new GameRuleException(ErrorCode.INVALID_PHASE);
        if (!Objects.equals(s.getTurnSeat(), seat)) throw new GameRuleException(ErrorCode.OUT_OF_TURN);
        if (card == null || !s.seat(seat).holds(card)) throw new GameRuleException(ErrorCode.ILLEGAL_CARD, "not in your hand");
        if (!validCardsFor(s, seat).contains(card)) {
            throw new GameRuleException(ErrorCode.ILLEGAL_CARD, "you must follow " + s.leadSuit().getLabel());
        }
    }

    public List<GameEvent> play(GameSession s, int seat, Card card) {
        checkPlay(s, seat, card);

        Card.Suit lead = s.leadSuit();
        TrumpState trump = s.getTrump();
        boolean isTrump = trump.isRevealed() && card.getSuit() == trump.getSuit();
        s.seat(seat).getHand().remove(card);
        s.getCurrentTrick().add(new TrickCard(seat, card, isTrump));

        List<GameEvent> events = new ArrayList<>();
        Map<String, Object> played = new LinkedHashMap<>();
        played.put("seat", seat);
        played.put("card", card.id());
        played.put("cut", isTrump && lead != null && lead != card.getSuit());
        events.add(GameEvent.of(GameEvent.Type.CARD_PLAYED, played));

        if (s.getCurrentTrick().size() == s.getMode()) {
            resolve(s, events);
        } else {
            s.setTurnSeat(s.nextSeat(seat));
        }
        return events;
    }

    private void resolve(GameSession s, List<GameEvent> events) {
        List<TrickCard> trick = new ArrayList<>(s.getCurrentTrick());
        TrickCard win = TrickRules.winner(trick);
        int points = TrickRules.points(trick);

        List<Card> pile = s.getCaptured().computeIfAbsent(win.seat(), k -> new ArrayList<>());
        for (TrickCard tc : trick) pile.add(tc.card());
        s.getCurrentTrick().clear();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("winnerSeat", win.seat());
        payload.put("points", points);
        payload.put("trickNumber", s.getTrickNumber());
        events.add(GameEvent.of(GameEvent.Type.TRICK_WON, payload));

        s.setTrickNumber(s.getTrickNumber() + 1);
        s.setTurnSeat(win.seat());

        if (s.getMode() == 2 && !s.getCenterPile().isEmpty()) draw(s, win.seat(), events);
    }

    /** 2 players: winner draws first, then the other seat, one card each. */
    private void draw(GameSession s, int winner, List<GameEvent> events) {
        List<Integer> drew = new ArrayList<>();
        for (int seat : List.of(winner, s.nextSeat(winner))) {
            if (s.getCenterPile().isEmpty()) break;
            s.seat(seat).getHand().add(s.getCenterPile().remove(0));
            drew.add(seat);
        }
        // which cards were drawn is private to each seat's hand
        events.add(GameEvent.of(GameEvent.Type.CARDS_DRAWN, Map.of(
                "seats", drew,
                "centerPileCount", s.getCenterPile().size())));
    }

    public boolean isTrickInProgress(GameSession s) {
        return !s.getCurrentTrick().isEmpty();
    }

    /** Every hand empty and nothing left face down. */
    public boolean isHandComplete(GameSession s) {
        if (s.getPhase() != GamePhase.PLAYING || isTrickInProgress(s)) return false;
        if (s.getTrump().isFaceDown()) return false;
        for (Seat seat : s.getSeats().values()) if (!seat.getHand().isEmpty()) return false;
        return true;
    }
}
