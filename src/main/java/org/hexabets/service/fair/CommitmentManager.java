package org.hexabets.service.fair;

import lombok.extern.slf4j.Slf4j;
import org.hexabets.exception.FairnessUnavailableException;
import org.hexabets.model.Commitment;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Owns the live server seed. Reads are a single volatile load of an immutable
 * {@link Commitment}; rotation builds the next commitment before swapping it in, so a
 * draw never sees a half-written seed and always belongs to exactly one epoch.
 */
@Slf4j
@Service
public class CommitmentManager {

    private static final int SEED_BYTES = 32;

    private final SecureRandom random;
    private volatile Commitment current;

    @Autowired
    public CommitmentManager() {
        this(new SecureRandom());
    }

    public CommitmentManager(SecureRandom random) {
        this.random = random;
        this.current = create(0L);
        log.info("Commitment epoch 0 publié : {}", current.getCommitHash());
    }

    /** Démarre sur une graine connue (vecteurs de conformité, tests). */
    public CommitmentManager(String secretSeedHex) {
        this.random = new SecureRandom();
        this.current = new Commitment(secretSeedHex, RandomStream.sha256Hex(secretSeedHex), 0L);
    }

    public Commitment current() {
        return current;
    }

    public Published getCommitment() {
        Commitment c = current;
        return new Published(c.getCommitHash(), c.getEpoch());
    }

    /**
     * Retires the live seed and publishes a fresh one. The new seed is generated before
     * anything is revealed: if generation fails the old commitment stays live.
     */
    public synchronized Rotation rotate() {
        Commitment old = current;
        Commitment next = create(old.getEpoch() + 1);
        current = next;
        log.info("Rotation du seed : epoch {} révélé ({} nonces émis), epoch {} publié : {}",
                old.getEpoch(), old.nextSequence(), next.getEpoch(), next.getCommitHash());
        return new Rotation(old.getSecretSeed(), old.getEpoch(), next.getCommitHash(), next.getEpoch());
    }

    /** A fresh commitment that does not replace the live one. */
    public Commitment issue(long epoch) {
        return create(epoch);
    }

    private Commitment create(long epoch) {
        byte[] bytes = new byte[SEED_BYTES];
        try {
            random.nextBytes(bytes);
        } catch (RuntimeException e) {
            log.error("Source d'aléa sécurisée indisponible", e);
            throw new FairnessUnavailableException("Secure random source failed", e);
        }
        String seed = HexFormat.of().formatHex(bytes);
        return new Commitment(seed, RandomStream.sha256Hex(seed), epoch);
    }

    public record Published(String commitHash, long epoch) {}

    public record Rotation(String revealedSeed, long revealedEpoch, String newCommitHash, long newEpoch) {}
}
