package org.trump304.service.game.command;

import org.trump304.model.game.Card;

import java.util.List;

/**
 * Inbound player actions. {@code seq}, when present, must equal the session's
 * current action sequence or the command is refused as stale.
 */
public sealed interface Command {

    ActionType type();

    Long seq();

    enum ActionType {
        START_GAME, BID, PASS, SELECT_TRUMP, EXCHANGE_CARDS, SKIP_EXCHANGE, PLAY_CARD, ASK_TRUMP, REVEAL_TRUMP
    }

    record StartGame(Long seq) implements Command {
        public ActionType type() { return ActionType.START_GAME; }
    }

    record PlaceBid(int amount, Long seq) implements Command {
        public ActionType type() { return ActionType.BID; }
    }

    record Pass(Long seq) implements Command {
        public ActionType type() { return ActionType.PASS; }
    }

    record SelectTrump(Card.Suit suit, Card card, Long seq) implements Command {
        public ActionType type() { return ActionType.SELECT_TRUMP; }
    }

    record ExchangeCards(List<Card> cards, Long seq) implements Command {
        public ExchangeCards {
            cards = cards == null ? List.of() : List.copyOf(cards);
        }
        public ActionType type() { return ActionType.EXCHANGE_CARDS; }
    }

    record SkipExchange(Long seq) implements Command {
        public ActionType type() { return ActionType.SKIP_EXCHANGE; }
    }

    record PlayCard(Card card, Long seq) implements Command {
        public ActionType type() { return ActionType.PLAY_CARD; }
    }

    record AskTrump(Long seq) implements Command {
        public ActionType type() { return ActionType.ASK_TRUMP; }
    }

    record RevealTrump(Long seq) implements Command {
        public ActionType type() { return ActionType.REVEAL_TRUMP; }
    }
}
