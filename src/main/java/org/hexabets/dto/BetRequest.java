package org.hexabets.dto;

import java.math.BigDecimal;

/** Champs communs à toutes les mises. */
public class BetRequest {
    public BigDecimal betAmount;
    public String playerSeed;     // défaut : app.fair.default-player-seed
    public Long sequenceNumber;   // null -> alloué par le serveur

    public BetRequest() {}
    public BetRequest(BigDecimal betAmount, String playerSeed, Long sequenceNumber) {
        this.betAmount = betAmount;
        this.playerSeed = playerSeed;
        this.sequenceNumber = sequenceNumber;
    }
}
