package org.hexabets.dto;

public class RouletteBetRequest extends BetRequest {
    public String type = "red"; // number | red | black | even | odd | low | high | dozen
    public Integer number;      // pour number : 0..36, pour dozen : 1..3
}
