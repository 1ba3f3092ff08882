package org.hexabets.service.games;

import org.hexabets.exception.InvalidParametersException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouletteResolverTest {

    private final RouletteResolver roulette = new RouletteResolver();
    private final BigDecimal bet = new BigDecimal("10");

    private BetOutcome spin(int pocket, String type, Integer number) {
        return roulette.resolve(bet, Draws.of(Draws.slot(pocket, RouletteResolver.POCKETS)),
                new RouletteResolver.Params(type, number));
    }

    @Test
    void straightNumber_paysThirtySixMinusEdge() {
        BetOutcome out = spin(0, "number", 0);

        assertThat(((RouletteResolver.Spin) out.detail()).color).isEqualTo("green");
        assertThat(out.payout()).isEqualByComparingTo("352.80");
    }

    @Test
    void zero_losesAllEvenMoneyBets() {
        assertThat(spin(0, "red", null).won()).isFalse();
        assertThat(spin(0, "black", null).won()).isFalse();
        assertThat(spin(0, "even", null).won()).isFalse();
        assertThat(spin(0, "odd", null).won()).isFalse();
        assertThat(spin(0, "low", null).won()).isFalse();
    }

    @Test
    void red_onOne_paysTwoMinusEdge() {
        BetOutcome out = spin(1, "red", null);

        assertThat(out.won()).isTrue();
        assertThat(out.payout()).isEqualByComparingTo("19.60");
    }

    @Test
    void dozen_coversItsTwelveNumbers() {
        assertThat(spin(30, "dozen", 3).payout()).isEqualByComparingTo("29.40");
        assertThat(spin(12, "dozen", 1).won()).isTrue();
        assertThat(spin(13, "dozen", 1).won()).isFalse();
        assertThat(spin(19, "high", null).won()).isTrue();
    }

    @Test
    void validate_rejectsUnknownOrOutOfRange() {
        assertThatThrownBy(() -> roulette.validate(new RouletteResolver.Params("purple", null)))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> roulette.validate(new RouletteResolver.Params("number", 37)))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> roulette.validate(new RouletteResolver.Params("dozen", 4)))
                .isInstanceOf(InvalidParametersException.class);
    }
}
