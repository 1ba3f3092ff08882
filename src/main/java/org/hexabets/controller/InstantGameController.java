package org.hexabets.controller;

import lombok.RequiredArgsConstructor;
import org.hexabets.dto.*;
import org.hexabets.service.BetService;
import org.hexabets.service.games.*;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/** Jeux à un seul appel : une requête = une mise résolue et réglée. */
@RestController
@RequestMapping("/api/game")
@RequiredArgsConstructor
public class InstantGameController {

    private final BetService betService;
    private final DiceResolver dice;
    private final CoinflipResolver coinflip;
    private final LimboResolver limbo;
    private final RouletteResolver roulette;
    private final PlinkoResolver plinko;
    private final KenoResolver keno;
    private final WheelResolver wheel;

    @PostMapping("/dice")
    public ResponseEntity<BetResponse> dice(@RequestBody DiceRequest req,
                                            @RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        return ResponseEntity.ok(betService.play(sessionId, dice, req, new DiceResolver.Params(req.target, req.over)));
    }

    @PostMapping("/coinflip")
    public ResponseEntity<BetResponse> coinflip(@RequestBody CoinflipRequest req,
                                                @RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        return ResponseEntity.ok(betService.play(sessionId, coinflip, req, new CoinflipResolver.Params(req.pick)));
    }

    @PostMapping("/limbo")
    public ResponseEntity<BetResponse> limbo(@RequestBody LimboRequest req,
                                             @RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        return ResponseEntity.ok(betService.play(sessionId, limbo, req, new LimboResolver.Params(req.target)));
    }

    @PostMapping("/roulette")
    public ResponseEntity<BetResponse> roulette(@RequestBody RouletteBetRequest req,
                                                @RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        return ResponseEntity.ok(betService.play(sessionId, roulette, req, new RouletteResolver.Params(req.type, req.number)));
    }

    @PostMapping("/plinko")
    public ResponseEntity<BetResponse> plinko(@RequestBody BetRequest req,
                                              @RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        return ResponseEntity.ok(betService.play(sessionId, plinko, req, null));
    }

    @PostMapping("/keno")
    public ResponseEntity<BetResponse> keno(@RequestBody KenoRequest req,
                                            @RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        return ResponseEntity.ok(betService.play(sessionId, keno, req, new KenoResolver.Params(req.picks)));
    }

    @PostMapping("/wheel")
    public ResponseEntity<BetResponse> wheel(@RequestBody BetRequest req,
                                             @RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        return ResponseEntity.ok(betService.play(sessionId, wheel, req, null));
    }
}
