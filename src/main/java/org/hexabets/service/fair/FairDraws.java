package org.hexabets.service.fair;

/**
 * The draws of one bet: offset {@code k} is the fraction for sequence number
 * {@code base + k} under a fixed (secret seed, player seed) pair.
 */
@FunctionalInterface
public interface FairDraws {

    double fraction(int offset);

    default int intBelow(int offset, int upperBoundExclusive) {
        return (int) Math.floor(fraction(offset) * upperBoundExclusive);
    }
}
