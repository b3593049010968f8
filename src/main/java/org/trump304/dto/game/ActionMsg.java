package org.trump304.dto.game;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.trump304.model.game.Card;
import org.trump304.model.game.ErrorCode;
import org.trump304.model.game.GameRuleException;
import org.trump304.service.game.command.Command;

import java.util.List;
import java.util.Locale;

/** Inbound STOMP frame on {@code /app/games/{code}/action}. Cards are sent by id, e.g. {@code "J_hearts"}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionMsg {
    @JsonProperty("player_id")
    private String playerId;

    private String action;

    private Integer amount;
    private String suit;
    private String card;
    private List<String> cards;
    private Long seq;

    public Command toCommand() {
        String a = action == null ? "" : action.trim().toLowerCase(Locale.ROOT);
        return switch (a) {
            case "start_game" -> new Command.StartGame(seq);
            case "bid" -> {
                if (amount == null) throw new GameRuleException(ErrorCode.INVALID_BID_AMOUNT, "amount is required");
                yield new Command.PlaceBid(amount, seq);
            }
            case "pass" -> new Command.Pass(seq);
            case "select_trump" -> new Command.SelectTrump(
                    suit == null ? null : Card.Suit.fromLabel(suit),
                    card == null ? null : Card.fromId(card),
                    seq);
            case "exchange_cards" -> new Command.ExchangeCards(
                    cards == null ? List.of() : cards.stream().map(Card::fromId).toList(), seq);
            case "skip_exchange" -> new Command.SkipExchange(seq);
            case "play_card" -> new Command.PlayCard(card == null ? null : Card.fromId(card), seq);
            case "ask_trump" -> new Command.AskTrump(seq);
            case "reveal_trump" -> new Command.RevealTrump(seq);
            default -> throw new GameRuleException(ErrorCode.UNKNOWN_ACTION, action);
        };
    }
}
