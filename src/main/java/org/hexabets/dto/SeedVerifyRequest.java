package org.hexabets.dto;

public class SeedVerifyRequest {
    public String serverSeed;
    public String playerSeed;
    public long sequenceNumber;
    public String commitHash;   // optionnel
}
