package org.hexabets.dto;

public class LimboRequest extends BetRequest {
    public double target = 2.0;
}
