package org.hexabets.service.games;

import org.hexabets.service.fair.FairDraws;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

@Component
public class WheelResolver implements GameResolver<Void> {

    public static final List<Integer> SEGMENTS =
            List.of(1, 1, 1, 2, 2, 3, 5, 10, 1, 1, 1, 2, 2, 3, 5, 1, 1, 2, 3, 20);
    public static final double EDGE_FACTOR = 0.99;

    public static final class Spin {
        public final int index;
        public final int multiplier;

        public Spin(int index, int multiplier) {
            this.index = index;
            this.multiplier = multiplier;
        }
    }

    @Override
    public String name() { return "wheel"; }

    @Override
    public BetOutcome resolve(BigDecimal betAmount, FairDraws draws, Void params) {
        int idx = draws.intBelow(0, SEGMENTS.size());
        int mult = SEGMENTS.get(idx);
        return BetOutcome.paid(new Spin(idx, mult), betAmount, Payouts.floor(betAmount, mult * EDGE_FACTOR));
    }
}
