package org.hexabets.service.games;

import org.hexabets.exception.InvalidParametersException;
import org.hexabets.model.Card;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HiLoResolverTest {

    private final HiLoResolver hilo = new HiLoResolver();
    private final BigDecimal bet = new BigDecimal("10");

    // rang courant, couleur, rang suivant, couleur
    private static double[] hand(int current, int next) {
        return new double[]{Draws.rank(current), 0.1, Draws.rank(next), 0.6};
    }

    @Test
    void higher_whenNextIsHigher_wins() {
        BetOutcome out = hilo.resolve(bet, Draws.of(hand(7, 10)), new HiLoResolver.Params("higher"));

        HiLoResolver.Reveal r = (HiLoResolver.Reveal) out.detail();
        assertThat(r.current.getRank()).isEqualTo(7);
        assertThat(r.next.getRank()).isEqualTo(10);
        assertThat(r.next.getSuit()).isEqualTo(Card.Suit.DIAMONDS);
        assertThat(out.payout()).isEqualByComparingTo("19.20");
    }

    @Test
    void lower_whenNextIsHigher_loses() {
        BetOutcome out = hilo.resolve(bet, Draws.of(hand(7, 10)), new HiLoResolver.Params("lower"));

        assertThat(out.won()).isFalse();
        assertThat(out.payout()).isEqualByComparingTo("0");
    }

    @Test
    void tie_returnsStake() {
        BetOutcome out = hilo.resolve(bet, Draws.of(hand(Card.ACE, Card.ACE)), new HiLoResolver.Params("higher"));

        assertThat(out.push()).isTrue();
        assertThat(out.won()).isFalse();
        assertThat(out.payout()).isEqualByComparingTo("10");
    }

    @Test
    void currentCard_readsFirstTwoOffsetsOnly() {
        Card c = hilo.currentCard(Draws.of(Draws.rank(12), 0.9));

        assertThat(c.getRank()).isEqualTo(12);
        assertThat(c.getSuit()).isEqualTo(Card.Suit.CLUBS);
    }

    @Test
    void validate_rejectsUnknownGuess() {
        assertThatThrownBy(() -> hilo.validate(new HiLoResolver.Params("same")))
                .isInstanceOf(InvalidParametersException.class);
    }
}
