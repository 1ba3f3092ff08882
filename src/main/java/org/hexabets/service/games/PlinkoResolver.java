package org.hexabets.service.games;

import org.hexabets.service.fair.FairDraws;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

@Component
public class PlinkoResolver implements GameResolver<Void> {

    public static final int ROWS = 12;
    // symétrique, index = nombre de rebonds à droite
    public static final List<Double> MULTIPLIERS =
            List.of(0.2, 0.3, 0.5, 0.8, 1.0, 1.2, 3.0, 1.2, 1.0, 0.8, 0.5, 0.3, 0.2);

    public static final class Drop {
        public final int index;
        public final double multiplier;

        public Drop(int index, double multiplier) {
            this.index = index;
            this.multiplier = multiplier;
        }
    }

    @Override
    public String name() { return "plinko"; }

    @Override
    public int drawsPerBet() { return ROWS; }

    @Override
    public BetOutcome resolve(BigDecimal betAmount, FairDraws draws, Void params) {
        int pos = 0;
        for (int i = 0; i < ROWS; i++) pos += draws.fraction(i) < 0.5 ? 0 : 1;
        double mult = MULTIPLIERS.get(pos);
        return BetOutcome.paid(new Drop(pos, mult), betAmount, Payouts.floor(betAmount, mult));
    }
}
