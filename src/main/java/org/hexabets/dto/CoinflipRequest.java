package org.hexabets.dto;

public class CoinflipRequest extends BetRequest {
    public String pick = "heads"; // "heads" ou "tails"
}
