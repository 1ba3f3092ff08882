package org.hexabets.dto;

public class DiceRequest extends BetRequest {
    public double target = 50;
    public boolean over;      // false : roll < target gagne
}
