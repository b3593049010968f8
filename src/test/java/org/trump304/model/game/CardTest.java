package org.trump304.model.game;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CardTest {

    @Test
    void newDeck_has32UniqueCardsWorth304() {
        List<Card> deck = Deck.newDeck();

        assertThat(deck).hasSize(Deck.SIZE);
        assertThat(new HashSet<>(deck)).hasSize(Deck.SIZE);
        assertThat(Deck.points(deck)).isEqualTo(Deck.TOTAL_POINTS);
    }

    @Test
    void fromId_parsesRankAndSuit() {
        Card c = Card.fromId("10_spades");

        assertThat(c.getRank()).isEqualTo(Card.Rank.TEN);
        assertThat(c.getSuit()).isEqualTo(Card.Suit.SPADES);
        assertThat(c.points()).isEqualTo(10);
        assertThat(c.id()).isEqualTo("10_spades");
    }

    @Test
    void fromId_unknown_throwsUnknownCard() {
        assertThatThrownBy(() -> Card.fromId("X_hearts"))
                .isInstanceOf(GameRuleException.class)
                .extracting("code").isEqualTo(ErrorCode.UNKNOWN_CARD);
        assertThatThrownBy(() -> Card.fromId("J_stars"))
                .isInstanceOf(GameRuleException.class);
        assertThatThrownBy(() -> Card.fromId("Jhearts"))
                .isInstanceOf(GameRuleException.class);
    }

    @Test
    void strengthOrder_isJackNineAceTenKingQueenEightSeven() {
        assertThat(Card.Rank.JACK.getStrength()).isGreaterThan(Card.Rank.NINE.getStrength());
        assertThat(Card.Rank.NINE.getStrength()).isGreaterThan(Card.Rank.ACE.getStrength());
        assertThat(Card.Rank.ACE.getStrength()).isGreaterThan(Card.Rank.TEN.getStrength());
        assertThat(Card.Rank.TEN.getStrength()).isGreaterThan(Card.Rank.KING.getStrength());
        assertThat(Card.Rank.KING.getStrength()).isGreaterThan(Card.Rank.QUEEN.getStrength());
        assertThat(Card.Rank.QUEEN.getStrength()).isGreaterThan(Card.Rank.EIGHT.getStrength());
        assertThat(Card.Rank.EIGHT.getStrength()).isGreaterThan(Card.Rank.SEVEN.getStrength());
    }

    @Test
    void session_invalidMode_throws() {
        assertThatThrownBy(() -> new GameSession("ABC123", 5))
                .isInstanceOf(GameRuleException.class)
                .extracting("code").isEqualTo(ErrorCode.INVALID_MODE);
    }

    @Test
    void session_copy_isDeep() {
        GameSession s = new GameSession("ABC123", 4);
        s.seat(0).getHand().add(Card.fromId("J_hearts"));
        s.getCaptured().put(1, new java.util.ArrayList<>(List.of(Card.fromId("9_clubs"))));

        GameSession c = s.copy();
        c.seat(0).getHand().clear();
        c.getCaptured().get(1).clear();
        c.getTrump().setTrumperSeat(2);

        assertThat(s.seat(0).getHand()).containsExactly(Card.fromId("J_hearts"));
        assertThat(s.getCaptured().get(1)).hasSize(1);
        assertThat(s.trumperSeat()).isNull();
    }
}
