package org.hexabets.service.games;

import org.hexabets.service.fair.FairDraws;

import java.math.BigDecimal;

/**
 * One game. {@code resolve} is a pure function of the bet, the draws bound to
 * (secret seed, player seed, sequence number) and the game parameters; it never touches
 * a balance, the caller settles the returned payout.
 *
 * @param <P> game parameters
 */
public interface GameResolver<P> {

    String name();

    /** Size of the sequence-number block one bet consumes. */
    default int drawsPerBet() {
        return 1;
    }

    /** Runs before any sequence number is consumed. */
    default void validate(P params) {}

    BetOutcome resolve(BigDecimal betAmount, FairDraws draws, P params);
}
