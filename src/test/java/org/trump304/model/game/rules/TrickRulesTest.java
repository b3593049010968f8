package org.trump304.model.game.rules;

import org.trump304.model.game.Card;
import org.trump304.model.game.TrickCard;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TrickRulesTest {

    private static Card c(String id) { return Card.fromId(id); }

    @Test
    void validCards_mustFollowLeadSuitWhenHeld() {
        List<Card> hand = List.of(c("7_hearts"), c("J_spades"), c("A_hearts"));

        assertThat(TrickRules.validCards(hand, Card.Suit.HEARTS)).containsExactly(c("7_hearts"), c("A_hearts"));
    }

    @Test
    void validCards_voidOrLeading_anyCard() {
        List<Card> hand = List.of(c("7_hearts"), c("J_spades"));

        assertThat(TrickRules.validCards(hand, Card.Suit.CLUBS)).containsExactlyElementsOf(hand);
        assertThat(TrickRules.validCards(hand, null)).containsExactlyElementsOf(hand);
    }

    @Test
    void winner_highestOfLeadSuitWithoutTrump() {
        List<TrickCard> trick = List.of(
                new TrickCard(0, c("A_hearts"), false),
                new TrickCard(1, c("9_hearts"), false),
                new TrickCard(2, c("J_spades"), false),
                new TrickCard(3, c("10_hearts"), false));

        assertThat(TrickRules.winner(trick).seat()).isEqualTo(1);
        assertThat(TrickRules.points(trick)).isEqualTo(11 + 20 + 30 + 10);
    }

    @Test
    void winner_revealedTrumpBeatsLeadSuit() {
        List<TrickCard> trick = List.of(
                new TrickCard(0, c("J_hearts"), false),
                new TrickCard(1, c("7_clubs"), true),
                new TrickCard(2, c("8_clubs"), true),
                new TrickCard(3, c("9_hearts"), false));

        assertThat(TrickRules.winner(trick).seat()).isEqualTo(2);
    }

    @Test
    void winner_trumpSuitPlayedFaceDownDoesNotCut() {
        List<TrickCard> trick = List.of(
                new TrickCard(0, c("7_hearts"), false),
                new TrickCard(1, c("J_clubs"), false));

        assertThat(TrickRules.winner(trick).seat()).isEqualTo(0);
    }

    @Test
    void winner_leadOfTrumpSuitBeforeReveal_competesWithLaterTrumps() {
        List<TrickCard> trick = List.of(
                new TrickCard(1, c("J_hearts"), false),
                new TrickCard(2, c("7_spades"), false),
                new TrickCard(3, c("7_hearts"), true),
                new TrickCard(0, c("8_clubs"), false));

        assertThat(TrickRules.winner(trick).seat()).isEqualTo(1);
    }
}
