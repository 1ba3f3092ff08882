package org.hexabets.model;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Grille éphémère d'une session. Toutes les mutations se font sous le moniteur de la
 * grille ; {@code active} passe à false dès qu'elle est perdue, encaissée ou remplacée.
 */
@Getter
public class MinesBoard {
    private final String id;
    private final String sessionId;
    private final BigDecimal mise;
    private final long sequenceNumber;
    private final String commitHash;
    private final Set<Integer> minedCells;
    private final Set<Integer> revealedCells = new LinkedHashSet<>();
    private boolean active = true;

    public MinesBoard(String id, String sessionId, BigDecimal mise, long sequenceNumber,
                      String commitHash, Set<Integer> minedCells) {
        this.id = id;
        this.sessionId = sessionId;
        this.mise = mise;
        this.sequenceNumber = sequenceNumber;
        this.commitHash = commitHash;
        this.minedCells = Collections.unmodifiableSet(minedCells);
    }

    public boolean isMine(int cell) {
        return minedCells.contains(cell);
    }

    public boolean reveal(int cell) {
        return revealedCells.add(cell);
    }

    public int safeCount() {
        return revealedCells.size();
    }

    public void close() {
        this.active = false;
    }
}
