package org.hexabets.dto;

public class MinesStartRequest extends BetRequest {
}
