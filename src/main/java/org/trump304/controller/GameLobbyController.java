package org.trump304.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.trump304.dto.game.CreateGameReq;
import org.trump304.dto.game.JoinGameReq;
import org.trump304.dto.game.JoinResponse;
import org.trump304.dto.game.PlayerView;
import org.trump304.model.game.ErrorCode;
import org.trump304.model.game.GameRuleException;
import org.trump304.model.game.GameSession;
import org.trump304.service.GameService;
import org.trump304.service.game.util.GameViews;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class GameLobbyController {

    private static final int DEFAULT_MODE = 4;

    private final GameService service;
    private final GameViews views;

    @PostMapping
    public ResponseEntity<JoinResponse> create(@Valid @RequestBody(required = false) CreateGameReq req) {
        int mode = req != null && req.getMode() != null ? req.getMode() : DEFAULT_MODE;
        String name = req != null ? req.getPlayerName() : null;
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(mode, name));
    }

    @PostMapping("/{code}/join")
    public ResponseEntity<JoinResponse> join(@PathVariable String code,
                                             @Valid @RequestBody(required = false) JoinGameReq req) {
        return ResponseEntity.ok(service.join(code, req != null ? req.getPlayerName() : null));
    }

    /** Public summary: no hands, no trump. */
    @GetMapping("/{code}")
    public ResponseEntity<Map<String, Object>> summary(@PathVariable String code) {
        GameSession s = service.get(code);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("game_code", s.getCode());
        out.put("mode", s.getMode());
        out.put("phase", s.getPhase());
        out.put("players", views.players(s));
        out.put("scores", s.getScores());
        out.put("games_played", s.getGamesPlayed());
        return ResponseEntity.ok(out);
    }

    @GetMapping("/{code}/view")
    public ResponseEntity<PlayerView> view(@PathVariable String code, @RequestParam("player_id") String playerId) {
        return ResponseEntity.ok(service.view(code, playerId));
    }

    @ExceptionHandler(GameRuleException.class)
    public ResponseEntity<Map<String, String>> onRule(GameRuleException e) {
        HttpStatus status = e.getCode() == ErrorCode.GAME_NOT_FOUND ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, String>> onUnexpected(RuntimeException e) {
        log.error("Unexpected lobby failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", ErrorCode.UNKNOWN_ERROR.getMessage()));
    }
}
