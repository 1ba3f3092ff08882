package org.hexabets.service.games;

import org.hexabets.exception.InvalidParametersException;
import org.hexabets.service.fair.FairDraws;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
public class LimboResolver implements GameResolver<LimboResolver.Params> {

    public static final double EDGE_FACTOR = 0.99;
    public static final double MAX_TARGET = 1_000_000;

    public record Params(double target) {}

    public static final class Limbo {
        public final double roll;
        public final double target;

        public Limbo(double roll, double target) {
            this.roll = roll;
            this.target = target;
        }
    }

    @Override
    public String name() { return "limbo"; }

    @Override
    public void validate(Params p) {
        if (!Double.isFinite(p.target()) || p.target() <= 1.0 || p.target() > MAX_TARGET) {
            throw new InvalidParametersException("target doit être > 1");
        }
    }

    @Override
    public BetOutcome resolve(BigDecimal betAmount, FairDraws draws, Params p) {
        double r = draws.fraction(0);
        Limbo detail = new Limbo(r, p.target());
        if (r < (1 / p.target()) * EDGE_FACTOR) {
            return BetOutcome.win(detail, Payouts.floor(betAmount, p.target() * EDGE_FACTOR));
        }
        return BetOutcome.loss(detail);
    }
}
