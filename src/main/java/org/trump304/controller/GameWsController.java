package org.trump304.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.trump304.dto.game.ActionMsg;
import org.trump304.model.game.ErrorCode;
import org.trump304.model.game.GameRuleException;
import org.trump304.service.GameService;
import org.trump304.service.game.access.GameBroadcaster;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.stereotype.Controller;

@Slf4j
@Controller
@RequiredArgsConstructor
public class GameWsController {

    private final GameService service;
    private final GameBroadcaster broadcaster;

    @MessageMapping("/games/{code}/action")
    public void action(@DestinationVariable String code, ActionMsg msg) {
        String playerId = msg != null ? msg.getPlayerId() : null;
        try {
            if (msg == null || playerId == null || playerId.isBlank()) {
                throw new GameRuleException(ErrorCode.UNKNOWN_PLAYER);
            }
            service.action(code, playerId, msg.toCommand());
        } catch (GameRuleException e) {
            log.debug("Rejected {} from {} on {}: {}", msg != null ? msg.getAction() : null, playerId, code, e.getCode());
            broadcaster.sendError(code, playerId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Action failed on {}", code, e);
            broadcaster.sendError(code, playerId, ErrorCode.UNKNOWN_ERROR.getMessage());
        }
    }
}
