package org.hexabets.controller;

import lombok.RequiredArgsConstructor;
import org.hexabets.dto.CrashCashoutRequest;
import org.hexabets.dto.CrashEvent;
import org.hexabets.service.crash.CrashCashoutResult;
import org.hexabets.service.crash.CrashRoundScheduler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/** Accès HTTP au crash, en plus du canal STOMP. */
@RestController
@RequestMapping("/api/game/crash")
@RequiredArgsConstructor
public class CrashController {

    private final CrashRoundScheduler scheduler;

    @GetMapping
    public ResponseEntity<CrashEvent> status() {
        return ResponseEntity.ok(scheduler.snapshot());
    }

    @PostMapping("/cashout")
    public ResponseEntity<CrashCashoutResult> cashout(@RequestBody CrashCashoutRequest req) {
        return ResponseEntity.ok(scheduler.cashout(req.betAmount, req.claimedMultiplier));
    }
}
