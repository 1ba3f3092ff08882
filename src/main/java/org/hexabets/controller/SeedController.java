package org.hexabets.controller;

import lombok.RequiredArgsConstructor;
import org.hexabets.dto.SeedVerifyRequest;
import org.hexabets.service.fair.CommitmentManager;
import org.hexabets.service.fair.RandomStream;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/seed")
@RequiredArgsConstructor
public class SeedController {

    private final CommitmentManager commitments;

    @GetMapping
    public ResponseEntity<?> commitment() {
        return ResponseEntity.ok(commitments.getCommitment());
    }

    @PostMapping("/rotate")
    public ResponseEntity<?> rotate() {
        return ResponseEntity.ok(commitments.rotate());
    }

    // recalcul indépendant d'un tirage à partir d'un seed révélé
    @PostMapping("/verify")
    public ResponseEntity<?> verify(@RequestBody SeedVerifyRequest req) {
        if (req == null || req.serverSeed == null || req.serverSeed.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "serverSeed manquant"));
        }
        if (req.sequenceNumber < 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "sequenceNumber doit être >= 0"));
        }
        String playerSeed = req.playerSeed == null ? "" : req.playerSeed;
        String hash = RandomStream.sha256Hex(req.serverSeed);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("fraction", RandomStream.fraction(req.serverSeed, playerSeed, req.sequenceNumber));
        body.put("commitHash", hash);
        if (req.commitHash != null) body.put("matches", hash.equalsIgnoreCase(req.commitHash));
        return ResponseEntity.ok(body);
    }
}
