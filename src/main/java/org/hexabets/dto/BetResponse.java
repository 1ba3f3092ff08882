package org.hexabets.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class BetResponse {
    private String game;
    private Object outcome;
    private boolean won;
    private boolean push;
    private BigDecimal betAmount;
    private BigDecimal payout;
    private String playerSeed;
    private long sequenceNumber;
    private String commitHash;
    private long epoch;
    private BigDecimal solde;
}
