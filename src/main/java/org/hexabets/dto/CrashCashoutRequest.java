package org.hexabets.dto;

import java.math.BigDecimal;

public class CrashCashoutRequest {
    public BigDecimal betAmount;
    public double claimedMultiplier;

    public CrashCashoutRequest() {}
    public CrashCashoutRequest(BigDecimal betAmount, double claimedMultiplier) {
        this.betAmount = betAmount;
        this.claimedMultiplier = claimedMultiplier;
    }
}
