package org.hexabets.controller;

import lombok.RequiredArgsConstructor;
import org.hexabets.dto.CrashCashoutRequest;
import org.hexabets.dto.CrashEvent;
import org.hexabets.exception.InvalidBetException;
import org.hexabets.service.crash.CrashCashoutResult;
import org.hexabets.service.crash.CrashRoundScheduler;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.messaging.simp.annotation.SubscribeMapping;
import org.springframework.stereotype.Controller;

import java.util.Map;

@Controller
@RequiredArgsConstructor
public class CrashWsController {

    private final CrashRoundScheduler scheduler;

    // SUBSCRIBE /app/crash : photo immédiate pour un abonné arrivé en cours de manche
    @SubscribeMapping("/crash")
    public CrashEvent status() {
        return scheduler.snapshot();
    }

    @MessageMapping("/crash/cashout")
    @SendToUser(destinations = "/queue/crash/cashout", broadcast = false)
    public CrashCashoutResult cashout(CrashCashoutRequest req) {
        return scheduler.cashout(req.betAmount, req.claimedMultiplier);
    }

    @MessageExceptionHandler(InvalidBetException.class)
    @SendToUser(destinations = "/queue/errors", broadcast = false)
    public Map<String, String> invalidBet(InvalidBetException e) {
        return Map.of("error", e.getMessage());
    }
}
