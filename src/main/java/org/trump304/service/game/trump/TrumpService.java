package org.trump304.service.game.trump;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.trump304.config.GameRulesProperties;
import org.trump304.model.game.*;
import org.trump304.model.game.rules.CutPolicy;
import org.trump304.model.game.rules.Teams;
import org.trump304.model.game.rules.ScoringRules;
import org.trump304.service.game.engine.GameEvent;
import org.springframework.stereotype.Service;

import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class TrumpService {
    public static final int MAX_EXCHANGE = 2;
    public static final int SUIT_SIZE = 8;

    private final GameRulesProperties rules;

    public List<GameEvent> select(GameSession s, int seat, Card.Suit suit, Card card) {
        if (s.getPhase() != GamePhase.TRUMP_SELECTION) throw new GameRuleException(ErrorCode.INVALID_PHASE);
        if (!s.isTrumper(seat)) throw new GameRuleException(ErrorCode.OUT_OF_TURN);
        Seat trumper = s.seat(seat);
        if (suit == null || card == null || card.getSuit() != suit || !trumper.holds(card)) {
            throw new GameRuleException(ErrorCode.INVALID_TRUMP_CARD);
        }

        trumper.getHand().remove(card);
        TrumpState t = s.getTrump();
        t.setSuit(suit);
        t.setCard(card);
        t.setRevealed(false);
        t.setRevealReason(null);

        List<GameEvent> events = new ArrayList<>();
        // suit and card stay out of the event: everyone receives it
        events.add(GameEvent.of(GameEvent.Type.TRUMP_SELECTED, Map.of("trumperSeat", seat)));

        if (s.getMode() == 3) {
            s.setPhase(GamePhase.CARD_EXCHANGE);
        } else {
            startPlay(s);
        }
        return events;
    }

    /** 3 players: trade one or two hand cards for the same number from the center pile. */
    public List<GameEvent> exchange(GameSession s, int seat, List<Card> cards) {
        ensureExchange(s, seat);
        if (cards == null || cards.isEmpty() || cards.size() > MAX_EXCHANGE || new HashSet<>(cards).size() != cards.size()) {
            throw new GameRuleException(ErrorCode.EXCHANGE_NOT_ALLOWED, "give one or two distinct cards");
        }
        Seat trumper = s.seat(seat);
        for (Card c : cards) {
            if (!trumper.holds(c)) throw new GameRuleException(ErrorCode.EXCHANGE_NOT_ALLOWED, "you do not hold " + c);
        }
        if (s.getCenterPile().size() < cards.size()) {
            throw new GameRuleException(ErrorCode.EXCHANGE_NOT_ALLOWED, "center pile too small");
        }

        List<Card> taken = new ArrayList<>(s.getCenterPile().subList(0, cards.size()));
        s.getCenterPile().subList(0, cards.size()).clear();
        trumper.getHand().removeAll(cards);
        trumper.getHand().addAll(taken);
        s.getCenterPile().addAll(cards);
        s.setExchangeDone(true);
        startPlay(s);

        return List.of(GameEvent.of(GameEvent.Type.CARDS_EXCHANGED, Map.of("seat", seat, "count", cards.size())));
    }

    public List<GameEvent> skipExchange(GameSession s, int seat) {
        ensureExchange(s, seat);
        s.setExchangeDone(true);
        startPlay(s);
        return List.of(GameEvent.of(GameEvent.Type.EXCHANGE_SKIPPED, Map.of("seat", seat)));
    }

    private void ensureExchange(GameSession s, int seat) {
        if (s.getMode() != 3 || s.getPhase() != GamePhase.CARD_EXCHANGE) {
            throw new GameRuleException(ErrorCode.EXCHANGE_NOT_ALLOWED, "only right after trump selection with 3 players");
        }
        if (!s.isTrumper(seat)) throw new GameRuleException(ErrorCode.EXCHANGE_NOT_ALLOWED, "only the trumper exchanges");
    }

    /** Left of the dealer leads, except on an all-points bid where the trumper does. */
    public void startPlay(GameSession s) {
        s.setPhase(GamePhase.PLAYING);
        s.getCurrentTrick().clear();
        s.setTrickNumber(1);
        Bid bid = s.getCurrentBid();
        if (bid != null && bid.amount() >= ScoringRules.ALL_POINTS) {
            s.setTurnSeat(s.trumperSeat());
        } else {
            s.setTurnSeat(s.nextSeat(s.getDealerSeat()));
        }
    }

    public List<GameEvent> revealVoluntarily(GameSession s, int seat) {
        ensureRevealable(s);
        if (!s.isTrumper(seat)) throw new GameRuleException(ErrorCode.REVEAL_NOT_ALLOWED, "only the trumper can reveal");
        return reveal(s, RevealReason.VOLUNTARY, seat);
    }

    public List<GameEvent> askTrump(GameSession s, int seat) {
        ensureRevealable(s);
        if (s.isTrumper(seat)) throw new GameRuleException(ErrorCode.REVEAL_NOT_ALLOWED, "the trumper reveals instead");
        if (!Objects.equals(s.getTurnSeat(), seat)) throw new GameRuleException(ErrorCode.OUT_OF_TURN);
        Card.Suit lead = s.leadSuit();
        if (lead == null) throw new GameRuleException(ErrorCode.REVEAL_NOT_ALLOWED, "no trick to cut");
        if (rules.cutPolicy() == CutPolicy.VOID_IN_LEAD_SUIT && s.seat(seat).holdsSuit(lead)) {
            throw new GameRuleException(ErrorCode.REVEAL_NOT_ALLOWED, "you can follow suit");
        }
        return reveal(s, RevealReason.CUT_REQUEST, seat);
    }

    /** Trumper must act but holds nothing except the face-down card. */
    public List<GameEvent> revealIfForced(GameSession s) {
        Integer turn = s.getTurnSeat();
        if (s.getPhase() != GamePhase.PLAYING || turn == null || !s.isTrumper(turn)) return List.of();
        if (!s.getTrump().isFaceDown() || !s.seat(turn).getHand().isEmpty()) return List.of();
        return reveal(s, RevealReason.LAST_CARD, turn);
    }

    private void ensureRevealable(GameSession s) {
        if (s.getPhase() != GamePhase.PLAYING) throw new GameRuleException(ErrorCode.INVALID_PHASE);
        if (!s.getTrump().isFaceDown()) throw new GameRuleException(ErrorCode.REVEAL_NOT_ALLOWED, "already revealed");
    }

    private List<GameEvent> reveal(GameSession s, RevealReason reason, int requester) {
        TrumpState t = s.getTrump();
        t.setRevealed(true);
        t.setRevealReason(reason);
        s.seat(t.getTrumperSeat()).getHand().add(t.getCard());
        log.debug("Trump revealed on {} ({}) by seat {}", s.getCode(), reason, requester);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("seat", requester);
        payload.put("reason", reason.name());
        payload.put("suit", t.getSuit().getLabel());
        payload.put("trumpCard", t.getCard().id());
        return List.of(GameEvent.of(GameEvent.Type.TRUMP_REVEALED, payload));
    }

    /**
     * Spoilt when the trumper's side holds every trump-suit card in its captured
     * tricks. A card still face down counts as held by the trumper.
     */
    public boolean isSpoilt(GameSession s) {
        TrumpState t = s.getTrump();
        if (!t.isSelected()) return false;
        int held = t.isFaceDown() ? 1 : 0;
        for (int seat : Teams.trumperTeam(s)) {
            for (Card c : s.getCaptured().getOrDefault(seat, List.of())) {
                if (c.getSuit() == t.getSuit()) held++;
            }
        }
        return held == SUIT_SIZE;
    }
}
