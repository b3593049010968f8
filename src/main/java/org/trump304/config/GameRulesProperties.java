package org.trump304.config;

import org.trump304.model.game.rules.BidRules;
import org.trump304.model.game.rules.CutPolicy;
import org.trump304.model.game.rules.IllegalPlayPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "game.rules")
public record GameRulesProperties(
        int turnTimeoutSeconds,   // per-turn deadline in BIDDING and PLAYING
        int minBid,
        int maxBid,
        int bidStep,
        int specialBidThreshold,  // re-bids and partner overbids need at least this
        int forfeitBonus,         // tokens added on top of the tier when a hand is forfeited
        CutPolicy cutPolicy,
        IllegalPlayPolicy illegalPlayPolicy
) {
    public GameRulesProperties {
        if (turnTimeoutSeconds <= 0) turnTimeoutSeconds = 30;
        if (minBid <= 0) minBid = 150;
        if (maxBid <= 0) maxBid = 304;
        if (bidStep <= 0) bidStep = 10;
        if (specialBidThreshold <= 0) specialBidThreshold = 200;
        if (forfeitBonus <= 0) forfeitBonus = 2;
        if (cutPolicy == null) cutPolicy = CutPolicy.VOID_IN_LEAD_SUIT;
        if (illegalPlayPolicy == null) illegalPlayPolicy = IllegalPlayPolicy.REJECT;
    }

    public static GameRulesProperties defaults() {
        return new GameRulesProperties(0, 0, 0, 0, 0, 0, null, null);
    }

    public GameRulesProperties withCutPolicy(CutPolicy policy) {
        return new GameRulesProperties(turnTimeoutSeconds, minBid, maxBid, bidStep,
                specialBidThreshold, forfeitBonus, policy, illegalPlayPolicy);
    }

    public GameRulesProperties withIllegalPlayPolicy(IllegalPlayPolicy policy) {
        return new GameRulesProperties(turnTimeoutSeconds, minBid, maxBid, bidStep,
                specialBidThreshold, forfeitBonus, cutPolicy, policy);
    }

    public BidRules.Limits bidLimits() {
        return new BidRules.Limits(minBid, maxBid, bidStep, specialBidThreshold);
    }
}
