package org.hexabets.controller;

import lombok.RequiredArgsConstructor;
import org.hexabets.dto.MinesRevealRequest;
import org.hexabets.dto.MinesStartRequest;
import org.hexabets.model.MinesBoard;
import org.hexabets.service.MinesService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/game/mines")
@RequiredArgsConstructor
public class MinesController {

    private final MinesService minesService;

    // ==================== DÉMARRER PARTIE ====================
    @PostMapping("/start")
    public ResponseEntity<?> start(@RequestBody MinesStartRequest req,
                                   @RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        return ResponseEntity.ok(minesService.start(sessionId, req));
    }

    // ==================== RÉVÉLER UNE CASE ====================
    @PostMapping("/reveal")
    public ResponseEntity<?> reveal(@RequestBody MinesRevealRequest req,
                                    @RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        return ResponseEntity.ok(minesService.reveal(sessionId, req.x, req.y));
    }

    // ==================== CASHOUT ====================
    @PostMapping("/cashout")
    public ResponseEntity<?> cashout(@RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        return ResponseEntity.ok(minesService.cashout(sessionId));
    }

    // ==================== RESUME ====================
    @GetMapping("/resume")
    public ResponseEntity<?> resume(@RequestHeader(value = Sessions.HEADER, defaultValue = Sessions.GUEST) String sessionId) {
        MinesBoard active = minesService.getActive(sessionId);
        if (active == null) {
            return ResponseEntity.ok(Map.of("active", false));
        }
        return ResponseEntity.ok(Map.of(
                "active", true,
                "boardId", active.getId(),
                "safeCount", active.safeCount(),
                "revealed", active.getRevealedCells(),
                "mise", active.getMise()
        ));
    }
}
