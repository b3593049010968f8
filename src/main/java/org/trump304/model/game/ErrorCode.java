package org.trump304.model.game;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCode {

    OUT_OF_TURN("Not your turn"),
    INVALID_PHASE("This action is not allowed in the current phase"),
    INVALID_BID_AMOUNT("Invalid bid amount"),
    BIDDING_ALREADY_CLOSED("Bidding is already closed"),
    INVALID_TRUMP_CARD("Trump card must be a card of the selected suit from your hand"),
    REVEAL_NOT_ALLOWED("Trump cannot be revealed now"),
    EXCHANGE_NOT_ALLOWED("Card exchange is not allowed"),
    ILLEGAL_CARD("You cannot play that card"),
    PLAY_IS_LEGAL("That play follows the rules"),
    INVALID_MODE("Mode must be 2, 3 or 4"),
    STALE_ACTION("Action is out of date"),

    UNKNOWN_CARD("Unknown card or suit"),
    GAME_NOT_FOUND("Game not found"),
    GAME_FULL("Game is full"),
    GAME_ALREADY_STARTED("Game has already started"),
    NOT_ENOUGH_PLAYERS("All seats must be taken before the game starts"),
    UNKNOWN_PLAYER("You are not seated in this game"),
    UNKNOWN_ACTION("Unknown action"),

    UNKNOWN_ERROR("Unexpected error");

    private final String message;
}
