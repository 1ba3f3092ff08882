package org.hexabets.controller;

import lombok.extern.slf4j.Slf4j;
import org.hexabets.exception.FairnessUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Erreurs récupérables rendues au client : 400 pour mise / paramètres invalides,
 * 409 pour un état incompatible (grille mines terminée...).
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionAdvice {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(FairnessUnavailableException.class)
    public ResponseEntity<Map<String, String>> fatal(FairnessUnavailableException e) {
        log.error("Aléa indisponible", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Tirages indisponibles"));
    }
}
