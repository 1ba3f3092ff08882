package org.hexabets.dto;

/** {@code sequenceNumber} = nonceBase renvoyé par /hilo/start. */
public class HiLoGuessRequest extends BetRequest {
    public String guess = "higher";
}
