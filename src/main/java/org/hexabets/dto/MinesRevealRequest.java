package org.hexabets.dto;

public class MinesRevealRequest {
    public int x;
    public int y;

    public MinesRevealRequest() {}
    public MinesRevealRequest(int x, int y) {
        this.x = x;
        this.y = y;
    }
}
