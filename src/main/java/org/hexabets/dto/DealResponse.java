package org.hexabets.dto;

public class DealResponse {
    public Object cards;
    public String playerSeed;
    public long nonceBase;
    public String commitHash;

    public DealResponse(Object cards, String playerSeed, long nonceBase, String commitHash) {
        this.cards = cards;
        this.playerSeed = playerSeed;
        this.nonceBase = nonceBase;
        this.commitHash = commitHash;
    }
}
