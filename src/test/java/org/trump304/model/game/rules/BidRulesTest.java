package org.trump304.model.game.rules;

import org.trump304.model.game.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BidRulesTest {

    private final BidRules.Limits limits = new BidRules.Limits(150, 304, 10, 200);
    private GameSession s;

    @BeforeEach
    void setup() {
        s = new GameSession("BIDBID", 4);
    }

    private void bid(int seat, int amount) {
        Bid b = new Bid(seat, amount);
        s.getBids().add(b);
        s.setCurrentBid(b);
    }

    @Test
    void isWellFormed_rangeAndStep() {
        assertThat(BidRules.isWellFormed(150, limits)).isTrue();
        assertThat(BidRules.isWellFormed(290, limits)).isTrue();
        assertThat(BidRules.isWellFormed(304, limits)).isTrue();
        assertThat(BidRules.isWellFormed(140, limits)).isFalse();
        assertThat(BidRules.isWellFormed(155, limits)).isFalse();
        assertThat(BidRules.isWellFormed(310, limits)).isFalse();
    }

    @Test
    void check_mustExceedCurrentBid() {
        bid(1, 160);

        assertThatThrownBy(() -> BidRules.check(s, 2, 160, limits))
                .isInstanceOf(GameRuleException.class)
                .extracting("code").isEqualTo(ErrorCode.INVALID_BID_AMOUNT);
        assertThatCode(() -> BidRules.check(s, 2, 170, limits)).doesNotThrowAnyException();
    }

    @Test
    void check_secondBidNeedsSpecialThreshold() {
        bid(1, 160);
        bid(2, 170);

        assertThatThrownBy(() -> BidRules.check(s, 1, 180, limits))
                .isInstanceOf(GameRuleException.class);
        assertThatCode(() -> BidRules.check(s, 1, 200, limits)).doesNotThrowAnyException();
    }

    @Test
    void check_partnerOverbidNeedsSpecialThreshold() {
        bid(0, 160);

        assertThatThrownBy(() -> BidRules.check(s, 2, 170, limits))
                .isInstanceOf(GameRuleException.class)
                .hasMessageContaining("partner");
        assertThatCode(() -> BidRules.check(s, 2, 200, limits)).doesNotThrowAnyException();
        assertThatCode(() -> BidRules.check(s, 1, 170, limits)).doesNotThrowAnyException();
    }

    @Test
    void check_noPartnersOutsideFourPlayers() {
        s = new GameSession("THREEP", 3);
        bid(0, 160);

        assertThatCode(() -> BidRules.check(s, 2, 170, limits)).doesNotThrowAnyException();
    }
}
