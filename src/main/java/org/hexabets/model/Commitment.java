package org.hexabets.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicLong;

/**
 * One commitment epoch: the secret seed, its published SHA-256 and the sequence counter
 * of that epoch. Immutable apart from the counter; rotation replaces the whole object.
 */
@Getter
public final class Commitment {

    private final String secretSeed;   // 64 caractères hex, jamais exposé avant révélation
    private final String commitHash;   // sha256(secretSeed), publié
    private final long epoch;

    @Getter(AccessLevel.NONE)
    private final AtomicLong nonceCounter = new AtomicLong();

    public Commitment(String secretSeed, String commitHash, long epoch) {
        this.secretSeed = secretSeed;
        this.commitHash = commitHash;
        this.epoch = epoch;
    }

    /** Premier numéro d'un bloc contigu de {@code count} numéros. */
    public long allocate(int count) {
        return nonceCounter.getAndAdd(count);
    }

    /**
     * Réserve un bloc choisi par l'appelant. Refusé si le bloc commence avant le
     * compteur : ces numéros ont pu être tirés et révélés dans cette epoch.
     */
    public boolean claim(long firstSequence, int count) {
        long end = firstSequence + count;
        while (true) {
            long current = nonceCounter.get();
            if (firstSequence < current) return false;
            if (nonceCounter.compareAndSet(current, end)) return true;
        }
    }

    public long nextSequence() {
        return nonceCounter.get();
    }
}
