package org.hexabets.service.fair;

import lombok.RequiredArgsConstructor;
import org.hexabets.exception.FairnessUnavailableException;
import org.hexabets.model.Commitment;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Derives reproducible fractions in [0,1) from HMAC-SHA256(secretSeed, playerSeed:seq).
 * The top 52 bits of the MAC are divided by 2^52, i.e. the first 13 hex digits.
 */
@Component
@RequiredArgsConstructor
public class RandomStream {

    private static final String HMAC = "HmacSHA256";
    private static final double TWO_POW_52 = 0x1p52;

    private final CommitmentManager commitments;

    /**
     * Reads the live commitment once. The same sequence number gives a different
     * fraction after a rotation: it is a different epoch, not a bug.
     */
    public double deriveFraction(String playerSeed, long sequenceNumber) {
        return deriveFraction(commitments.current(), playerSeed, sequenceNumber);
    }

    public double deriveFraction(Commitment commitment, String playerSeed, long sequenceNumber) {
        return fraction(commitment.getSecretSeed(), playerSeed, sequenceNumber);
    }

    public int drawInt(String playerSeed, long sequenceNumber, int upperBoundExclusive) {
        return (int) Math.floor(deriveFraction(playerSeed, sequenceNumber) * upperBoundExclusive);
    }

    /** Offset {@code k} of the returned view reads sequence number {@code baseSequence + k}. */
    public FairDraws cursor(Commitment commitment, String playerSeed, long baseSequence) {
        return offset -> deriveFraction(commitment, playerSeed, baseSequence + offset);
    }

    public static double fraction(String secretSeed, String playerSeed, long sequenceNumber) {
        byte[] mac = hmac(secretSeed, playerSeed + ":" + sequenceNumber);
        long v = 0;
        for (int i = 0; i < 7; i++) v = (v << 8) | (mac[i] & 0xFF);
        v >>>= 4; // 56 -> 52 bits
        return v / TWO_POW_52;
    }

    public static String sha256Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new FairnessUnavailableException("SHA-256 unavailable", e);
        }
    }

    private static byte[] hmac(String key, String message) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC));
            return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new FairnessUnavailableException("HmacSHA256 unavailable", e);
        }
    }
}
