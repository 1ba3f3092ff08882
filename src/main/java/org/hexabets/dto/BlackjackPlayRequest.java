package org.hexabets.dto;

import java.util.List;

/** {@code sequenceNumber} = nonceBase renvoyé par /blackjack/start. */
public class BlackjackPlayRequest extends BetRequest {
    public List<String> actions = List.of();
}
