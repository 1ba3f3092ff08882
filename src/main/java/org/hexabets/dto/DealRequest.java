package org.hexabets.dto;

/** Ouverture d'une main hi-lo / blackjack, sans mise. */
public class DealRequest {
    public String playerSeed;

    public DealRequest() {}
    public DealRequest(String playerSeed) { this.playerSeed = playerSeed; }
}
