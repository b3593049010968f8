package org.trump304.model.game.rules;

import org.trump304.model.game.*;

import java.util.Objects;

public final class BidRules {
    private BidRules(){}

    public record Limits(int min, int max, int step, int specialThreshold) {}

    public static boolean isWellFormed(int amount, Limits l) {
        if (amount < l.min() || amount > l.max()) return false;
        return amount == l.max() || amount % l.step() == 0;
    }

    public static boolean hasBid(GameSession s, int seat) {
        return s.getBids().stream().anyMatch(b -> b.seat() == seat && !b.isPass());
    }

    /** Checks an amount for {@code seat}; throws INVALID_BID_AMOUNT with the reason. */
    public static void check(GameSession s, int seat, int amount, Limits l) {
        if (!isWellFormed(amount, l)) {
            throw new GameRuleException(ErrorCode.INVALID_BID_AMOUNT,
                    "bids go from " + l.min() + " to " + l.max() + " in steps of " + l.step());
        }
        Bid current = s.getCurrentBid();
        if (current != null && amount <= current.amount()) {
            throw new GameRuleException(ErrorCode.INVALID_BID_AMOUNT, "must exceed " + current.amount());
        }
        // re-bidding after being overbid is the 200+ special rule
        if (hasBid(s, seat) && amount < l.specialThreshold()) {
            throw new GameRuleException(ErrorCode.INVALID_BID_AMOUNT,
                    "a second bid must be at least " + l.specialThreshold());
        }
        Integer partner = Teams.partnerOf(s.getMode(), seat);
        if (current != null && partner != null && Objects.equals(current.seat(), partner)
                && amount < l.specialThreshold()) {
            throw new GameRuleException(ErrorCode.INVALID_BID_AMOUNT,
                    "cannot overbid your partner below " + l.specialThreshold());
        }
    }
}
