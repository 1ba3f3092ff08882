package org.hexabets.service.fair;

import org.hexabets.model.Commitment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RandomStreamTest {

    static final String SECRET = "3f1c9a7be2d54086a1f7c3e9b5d20a4c6e8f1b3d5a7c9e0f2b4d6a8c0e2f4a61";

    private CommitmentManager commitments;
    private RandomStream randomStream;

    @BeforeEach
    void setUp() {
        commitments = new CommitmentManager(SECRET);
        randomStream = new RandomStream(commitments);
    }

    // --- VECTEUR DE CONFORMITÉ ---

    @Test
    void commitHash_isSha256OfHexText() {
        assertThat(commitments.current().getCommitHash())
                .isEqualTo("f00bc81d78a76ae47de2e5c79f7de6107bf4451210228806ec93d90d9f3a120a");
    }

    @Test
    void fraction_matchesKnownVector() {
        assertThat(randomStream.deriveFraction("test", 0)).isEqualTo(0.5231094322023586);
        assertThat(randomStream.deriveFraction("test", 1)).isEqualTo(0.19993938735814698);
        assertThat(randomStream.deriveFraction("test", 2)).isEqualTo(0.22503285463667444);
        assertThat(randomStream.deriveFraction("test", 3)).isEqualTo(0.47583255013672465);
        assertThat(randomStream.deriveFraction("client", 0)).isEqualTo(0.10494324474096972);
    }

    @Test
    void fraction_isDeterministicAndInUnitInterval() {
        for (long seq = 0; seq < 200; seq++) {
            double a = randomStream.deriveFraction("abc", seq);
            double b = RandomStream.fraction(SECRET, "abc", seq);
            assertThat(a).isEqualTo(b);
            assertThat(a).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);
        }
    }

    @Test
    void fraction_dependsOnPlayerSeed() {
        assertThat(randomStream.deriveFraction("test", 0))
                .isNotEqualTo(randomStream.deriveFraction("client", 0));
    }

    @Test
    void fraction_changesAfterRotation() {
        double before = randomStream.deriveFraction("test", 0);
        commitments.rotate();
        assertThat(randomStream.deriveFraction("test", 0)).isNotEqualTo(before);
    }

    @Test
    void drawInt_staysInBounds() {
        for (long seq = 0; seq < 500; seq++) {
            assertThat(randomStream.drawInt("bounds", seq, 37)).isBetween(0, 36);
        }
    }

    @Test
    void cursor_offsetReadsBasePlusOffset() {
        Commitment c = commitments.current();
        FairDraws draws = randomStream.cursor(c, "test", 2);
        assertThat(draws.fraction(0)).isEqualTo(0.22503285463667444);
        assertThat(draws.fraction(1)).isEqualTo(0.47583255013672465);
    }

    // --- UNIFORMITÉ ---

    @Test
    void fractions_passChiSquareOverTenBuckets() {
        int[] buckets = new int[10];
        int n = 10_000;
        for (long seq = 0; seq < n; seq++) {
            buckets[(int) (RandomStream.fraction(SECRET, "uniform", seq) * 10)]++;
        }
        double expected = n / 10.0;
        double chi2 = 0;
        for (int b : buckets) chi2 += (b - expected) * (b - expected) / expected;
        // 9 degrés de liberté, seuil à 0.1 %
        assertThat(chi2).isLessThan(27.88);
    }

    @Test
    void sha256Hex_knownValue() {
        assertThat(RandomStream.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(RandomStream.sha256Hex("abc")).hasSize(64);
    }

    @Test
    void intBelow_floorsFraction() {
        FairDraws draws = offset -> 0.999;
        assertThat(draws.intBelow(0, 10)).isEqualTo(9);
        FairDraws zero = offset -> 0.0;
        assertThat(zero.intBelow(3, 10)).isZero();
    }
}
