package org.trump304.model.game;

import lombok.Getter;

/** A rejected action. Never leaves the session modified. */
@Getter
public class GameRuleException extends RuntimeException {
    private final ErrorCode code;

    public GameRuleException(ErrorCode code) {
        super(code.getMessage());
        this.code = code;
    }

    public GameRuleException(ErrorCode code, String detail) {
        super(code.getMessage() + ": " + detail);
        this.code = code;
    }
}
