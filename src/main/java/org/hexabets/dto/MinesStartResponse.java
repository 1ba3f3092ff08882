package org.hexabets.dto;

import java.math.BigDecimal;

public class MinesStartResponse {
    public String boardId;
    public int gridSize;
    public int mines;
    public double nextMultiplier; // multiplicateur si on révèle 1er diamant
    public long sequenceNumber;
    public String commitHash;
    public BigDecimal solde;      // solde après débit

    public MinesStartResponse(String boardId, int gridSize, int mines, double nextMultiplier,
                              long sequenceNumber, String commitHash, BigDecimal solde) {
        this.boardId = boardId;
        this.gridSize = gridSize;
        this.mines = mines;
        this.nextMultiplier = nextMultiplier;
        this.sequenceNumber = sequenceNumber;
        this.commitHash = commitHash;
        this.solde = solde;
    }
}
