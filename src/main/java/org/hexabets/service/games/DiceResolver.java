package org.hexabets.service.games;

import org.hexabets.exception.InvalidParametersException;
import org.hexabets.service.fair.FairDraws;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
public class DiceResolver implements GameResolver<DiceResolver.Params> {

    public static final double HOUSE_EDGE = 0.01;

    /** @param over true : gagne si roll > target, sinon roll < target */
    public record Params(double target, boolean over) {}

    public static final class Roll {
        public final double roll;
        public final double target;
        public final boolean over;
        public final double multiplier;

        public Roll(double roll, double target, boolean over, double multiplier) {
            this.roll = roll;
            this.target = target;
            this.over = over;
            this.multiplier = multiplier;
        }
    }

    @Override
    public String name() { return "dice"; }

    @Override
    public void validate(Params p) {
        if (!Double.isFinite(p.target()) || p.target() < 1.0 || p.target() > 99.0) {
            throw new InvalidParametersException("target doit être entre 1 et 99");
        }
    }

    @Override
    public BetOutcome resolve(BigDecimal betAmount, FairDraws draws, Params p) {
        double roll = Math.floor(draws.fraction(0) * 10000) / 100; // 0.00 .. 99.99
        double mult = multiplier(p.target(), p.over());
        boolean win = p.over() ? roll > p.target() : roll < p.target();
        Roll detail = new Roll(roll, p.target(), p.over(), mult);
        return win ? BetOutcome.win(detail, Payouts.floor(betAmount, mult)) : BetOutcome.loss(detail);
    }

    /** Cote équitable (1 / probabilité) diminuée de l'avantage maison. */
    public static double multiplier(double target, boolean over) {
        double prob = over ? (100 - target - 0.01) / 100 : target / 100;
        return (1 - HOUSE_EDGE) / prob;
    }
}
