package org.hexabets.controller;

import lombok.RequiredArgsConstructor;
import org.hexabets.dto.*;
import org.hexabets.service.BetService;
import org.hexabets.service.games.BlackjackResolver;
import org.hexabets.service.games.HiLoResolver;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Hi-lo et blackjack en deux temps : /start réserve un bloc de nonces pour la session et
 * montre les cartes d'ouverture, le second appel joue ce bloc une seule fois avec la mise.
 */
@RestController
@RequestMapping("/api/game")
@RequiredArgsConstructor
public class CardGameController {

    private final BetService betService;
    private final HiLoResolver hilo;
    private final BlackjackResolver blackjack;

    @PostMapping("/hilo/start")
    public ResponseEntity<DealResponse> hiloStart(@RequestBody(required = false) DealRequest req,
                                                   @RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        BetService.Draw d = betService.deal(sessionId, hilo, req == null ? null : req.playerSeed);
        return ResponseEntity.ok(new DealResponse(Map.of("current", hilo.currentCard(d.draws())),
                d.playerSeed(), d.sequenceNumber(), d.commitment().getCommitHash()));
    }

    @PostMapping("/hilo/guess")
    public ResponseEntity<BetResponse> hiloGuess(@RequestBody HiLoGuessRequest req,
                                       @RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        return ResponseEntity.ok(betService.playDeal(sessionId, hilo, req, new HiLoResolver.Params(req.guess)));
    }

    @PostMapping("/blackjack/start")
    public ResponseEntity<DealResponse> blackjackStart(@RequestBody(required = false) DealRequest req,
                                                   @RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        BetService.Draw d = betService.deal(sessionId, blackjack, req == null ? null : req.playerSeed);
        return ResponseEntity.ok(new DealResponse(blackjack.open(d.draws()),
                d.playerSeed(), d.sequenceNumber(), d.commitment().getCommitHash()));
    }

    @PostMapping("/blackjack/play")
    public ResponseEntity<BetResponse> blackjackPlay(@RequestBody BlackjackPlayRequest req,
                                           @RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        return ResponseEntity.ok(betService.playDeal(sessionId, blackjack, req, new BlackjackResolver.Params(req.actions)));
    }
}
