package org.trump304.service.game.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.trump304.config.GameRulesProperties;
import org.trump304.model.game.*;
import org.trump304.model.game.rules.DealingRules;
import org.trump304.model.game.rules.IllegalPlayPolicy;
import org.trump304.service.game.bidding.BiddingService;
import org.trump304.service.game.command.Command;
import org.trump304.service.game.scoring.ScoringService;
import org.trump304.service.game.trick.TrickService;
import org.trump304.service.game.trump.TrumpService;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.*;

/**
 * Phase machine of a session: {@code (session, action) -> (session', events)}.
 * The session handed in is never modified; every transition works on a copy,
 * so a rejected action leaves no trace.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameEngine {
    private final BiddingService bidding;
    private final TrumpService trump;
    private final TrickService tricks;
    private final ScoringService scoring;
    private final GameRulesProperties rules;
    private final Random random;

    public Transition dispatch(GameSession current, int seat, Command command) {
        Long seq = command.seq();
        if (seq != null && seq != current.getActionSeq()) throw new GameRuleException(ErrorCode.STALE_ACTION);
        current.seat(seat);

        GameSession s = current.copy();
        List<GameEvent> events = switch (command.type()) {
            case START_GAME -> start(s);
            case BID -> bidding.bid(s, seat, ((Command.PlaceBid) command).amount());
            case PASS -> bidding.pass(s, seat);
            case SELECT_TRUMP -> {
                Command.SelectTrump c = (Command.SelectTrump) command;
                yield trump.select(s, seat, c.suit(), c.card());
            }
            case EXCHANGE_CARDS -> trump.exchange(s, seat, ((Command.ExchangeCards) command).cards());
            case SKIP_EXCHANGE -> trump.skipExchange(s, seat);
            case PLAY_CARD -> play(s, seat, ((Command.PlayCard) command).card());
            case ASK_TRUMP -> trump.askTrump(s, seat);
            case REVEAL_TRUMP -> trump.revealVoluntarily(s, seat);
        };
        return commit(s, events);
    }

    /**
     * Turn deadline reached. Anything that no longer matches the session (turn moved
     * on, phase changed, sequence advanced) is dropped without effect.
     */
    public Transition onTimeout(GameSession current, int seat, long seq) {
        if (seq != current.getActionSeq() || !current.getPhase().isTimed() || !Objects.equals(toAct(current), seat)) {
            log.debug("Stale timeout dropped on {} for seat {} (seq {} vs {})", current.getCode(), seat, seq, current.getActionSeq());
            return Transition.unchanged(current);
        }
        GameSession s = current.copy();
        List<GameEvent> events = new ArrayList<>();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("seat", seat);
        payload.put("timeout", true);

        if (s.getPhase() == GamePhase.BIDDING) {
            payload.put("action", "pass");
            events.add(GameEvent.of(GameEvent.Type.TURN_TIMEOUT, payload));
            events.addAll(bidding.pass(s, seat));
        } else {
            List<Card> valid = tricks.validCardsFor(s, seat);
            Card card = valid.get(random.nextInt(valid.size()));
            payload.put("card", card.id());
            events.add(GameEvent.of(GameEvent.Type.TURN_TIMEOUT, payload));
            events.addAll(play(s, seat, card));
        }
        log.info("Turn timeout on {}: seat {} auto-{}", s.getCode(), seat, payload.getOrDefault("card", "pass"));
        return commit(s, events);
    }

    /**
     * Forfeits the hand for a play the rules forbid, whatever the configured policy. The seat must be
     * on turn and hold the card, and the card must fail the follow-suit check; anything else is refused
     * with the usual rejection, or PLAY_IS_LEGAL when the play is fine.
     */
    public Transition adjudicateIllegalPlay(GameSession current, int seat, Card card) {
        if (!isCommittableIllegal(current, seat, card)) throw new GameRuleException(ErrorCode.PLAY_IS_LEGAL);
        GameSession s = current.copy();
        log.warn("Adjudicating illegal play of {} by seat {} on {}", card, seat, s.getCode());
        return commit(s, scoring.forfeit(s, seat));
    }

    public List<Card> validCardsFor(GameSession s, int seat) {
        return tricks.validCardsFor(s, seat);
    }

    /** The one seat expected to act, or null in WAITING, DEALING and SCORING. */
    public static Integer toAct(GameSession s) {
        return switch (s.getPhase()) {
            case BIDDING -> s.getBidTurnSeat();
            case TRUMP_SELECTION, CARD_EXCHANGE -> s.trumperSeat();
            case PLAYING -> s.getTurnSeat();
            case WAITING, DEALING, SCORING -> null;
        };
    }

    private List<GameEvent> start(GameSession s) {
        switch (s.getPhase()) {
            case WAITING -> {
                if (!s.isFull()) throw new GameRuleException(ErrorCode.NOT_ENOUGH_PLAYERS);
                s.setDealerSeat(random.nextInt(s.getMode()));
            }
            case SCORING -> s.setDealerSeat(s.nextSeat(s.getDealerSeat()));
            default -> throw new GameRuleException(ErrorCode.INVALID_PHASE);
        }
        return deal(s);
    }

    private List<GameEvent> deal(GameSession s) {
        s.resetHand();
        DealingRules.dealInto(s, random);
        bidding.start(s);
        log.info("Hand {} dealt on {} (dealer seat {})", s.getGamesPlayed() + 1, s.getCode(), s.getDealerSeat());
        return List.of(GameEvent.of(GameEvent.Type.HAND_DEALT, Map.of(
                "dealerSeat", s.getDealerSeat(),
                "handNumber", s.getGamesPlayed() + 1,
                "centerPileCount", s.getCenterPile().size())));
    }

    private List<GameEvent> play(GameSession s, int seat, Card card) {
        if (rules.illegalPlayPolicy() == IllegalPlayPolicy.FORFEIT && isCommittableIllegal(s, seat, card)) {
            log.warn("Illegal play of {} by seat {} on {} committed as forfeit", card, seat, s.getCode());
            return scoring.forfeit(s, seat);
        }
        tricks.checkPlay(s, seat, card);

        List<GameEvent> events = new ArrayList<>(tricks.play(s, seat, card));
        boolean trickJustClosed = !tricks.isTrickInProgress(s);
        if (trickJustClosed && trump.isSpoilt(s)) {
            events.addAll(spoilt(s));
        } else if (tricks.isHandComplete(s)) {
            events.addAll(scoring.score(s));
        } else {
            events.addAll(trump.revealIfForced(s));
        }
        return events;
    }

    /**
     * True when the play fails only the follow-suit check with a card the seat holds. Turn, phase and
     * unknown-card rejections propagate.
     */
    private boolean isCommittableIllegal(GameSession s, int seat, Card card) {
        try {
            tricks.checkPlay(s, seat, card);
            return false;
        } catch (GameRuleException e) {
            if (e.getCode() != ErrorCode.ILLEGAL_CARD || card == null || !s.seat(seat).holds(card)) throw e;
            return true;
        }
    }

    /** Void hand: no scoring, dealer moves on, fresh deal. */
    private List<GameEvent> spoilt(GameSession s) {
        Integer trumper = s.trumperSeat();
        log.info("Spoilt trump on {}: trumper seat {} holds every trump", s.getCode(), trumper);
        List<GameEvent> events = new ArrayList<>();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("trumperSeat", trumper);
        payload.put("suit", s.getTrump().getSuit().getLabel());
        events.add(GameEvent.of(GameEvent.Type.HAND_SPOILT, payload));
        s.setDealerSeat(s.nextSeat(s.getDealerSeat()));
        events.addAll(deal(s));
        return events;
    }

    private Transition commit(GameSession s, List<GameEvent> events) {
        s.nextSeq();
        Integer actor = toAct(s);
        TimerDirective timer = s.getPhase().isTimed() && actor != null
                ? TimerDirective.arm(actor, s.getActionSeq(), Duration.ofSeconds(rules.turnTimeoutSeconds()))
                : TimerDirective.cancel();
        return new Transition(s, List.copyOf(events), timer);
    }
}
