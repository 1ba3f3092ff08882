package org.hexabets.controller;

import lombok.RequiredArgsConstructor;
import org.hexabets.service.WalletService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/wallet")
@RequiredArgsConstructor
public class WalletController {

    private final WalletService walletService;

    // solde de la session courante (créé à la première lecture)
    @GetMapping("/me")
    public ResponseEntity<?> solde(@RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        return ResponseEntity.ok(Map.of("session", sessionId, "solde", walletService.getSolde(sessionId)));
    }
}
