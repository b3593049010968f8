package org.trump304.service.game.bidding;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.trump304.config.GameRulesProperties;
import org.trump304.model.game.*;
import org.trump304.model.game.rules.BidRules;
import org.trump304.service.game.engine.GameEvent;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class BiddingService {
    private final GameRulesProperties rules;

    public void start(GameSession s) {
        s.setPhase(GamePhase.BIDDING);
        s.getBids().clear();
        s.getPassedSeats().clear();
        s.setCurrentBid(null);
        s.setBidTurnSeat(s.nextSeat(s.getDealerSeat()));
    }

    public List<GameEvent> bid(GameSession s, int seat, int amount) {
        ensureTurn(s, seat);
        BidRules.check(s, seat, amount, rules.bidLimits());

        Bid bid = new Bid(seat, amount);
        s.getBids().add(bid);
        s.setCurrentBid(bid);

        List<GameEvent> events = new ArrayList<>();
        events.add(GameEvent.of(GameEvent.Type.BID_PLACED, Map.of("seat", seat, "amount", amount)));
        advance(s, events);
        return events;
    }

    public List<GameEvent> pass(GameSession s, int seat) {
        ensureTurn(s, seat);
        s.getBids().add(Bid.pass(seat));
        s.getPassedSeats().add(seat);

        List<GameEvent> events = new ArrayList<>();
        events.add(GameEvent.of(GameEvent.Type.BID_PASSED, Map.of("seat", seat)));
        advance(s, events);
        return events;
    }

    private void ensureTurn(GameSession s, int seat) {
        switch (s.getPhase()) {
            case BIDDING -> { }
            case TRUMP_SELECTION, CARD_EXCHANGE, PLAYING -> throw new GameRuleException(ErrorCode.BIDDING_ALREADY_CLOSED);
            default -> throw new GameRuleException(ErrorCode.INVALID_PHASE);
        }
        if (s.getBidTurnSeat() == null || s.getBidTurnSeat() != seat) throw new GameRuleException(ErrorCode.OUT_OF_TURN);
    }

    private void advance(GameSession s, List<GameEvent> events) {
        int active = s.getMode() - s.getPassedSeats().size();
        Bid current = s.getCurrentBid();

        if (active == 0 || (active == 1 && current != null && !s.getPassedSeats().contains(current.seat()))) {
            close(s, events);
            return;
        }
        int next = s.getBidTurnSeat();
        do {
            next = s.nextSeat(next);
        } while (s.getPassedSeats().contains(next));
        s.setBidTurnSeat(next);
    }

    private void close(GameSession s, List<GameEvent> events) {
        boolean forced = false;
        if (s.getCurrentBid() == null) {
            // nobody bid: the dealer is stuck with the minimum
            Bid forcedBid = new Bid(s.getDealerSeat(), rules.minBid());
            s.getBids().add(forcedBid);
            s.setCurrentBid(forcedBid);
            forced = true;
        }
        Bid winning = s.getCurrentBid();
        s.getTrump().setTrumperSeat(winning.seat());
        s.setBidTurnSeat(null);
        s.setPhase(GamePhase.TRUMP_SELECTION);
        log.debug("Bidding closed on {}: seat {} at {}{}", s.getCode(), winning.seat(), winning.amount(), forced ? " (forced)" : "");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("trumperSeat", winning.seat());
        payload.put("bid", winning.amount());
        payload.put("forced", forced);
        events.add(GameEvent.of(GameEvent.Type.BIDDING_CLOSED, payload));
    }
}
