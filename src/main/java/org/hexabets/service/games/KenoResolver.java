package org.hexabets.service.games;

import org.hexabets.exception.InvalidParametersException;
import org.hexabets.service.fair.FairDraws;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class KenoResolver implements GameResolver<KenoResolver.Params> {

    public static final int POOL = 40;
    public static final int DRAWN = 20;
    public static final int MAX_PICKS = 10;

    // nombre de numéros choisis -> gain par nombre de numéros trouvés
    private static final Map<Integer, double[]> PAYTABLE = Map.of(
            1, new double[]{0, 1.9},
            2, new double[]{0, 1, 3.5},
            3, new double[]{0, 0.5, 2, 9},
            4, new double[]{0, 0.5, 2, 7, 28},
            5, new double[]{0, 0, 1, 5, 12, 50},
            6, new double[]{0, 0, 0.5, 3, 10, 30, 75},
            7, new double[]{0, 0, 0.5, 2, 7, 20, 50, 120},
            8, new double[]{0, 0, 0.5, 2, 5, 15, 40, 90, 200},
            9, new double[]{0, 0, 0.5, 1, 3, 10, 25, 60, 120, 300},
            10, new double[]{0, 0, 0.5, 1, 2, 7, 20, 50, 100, 200, 500}
    );

    public record Params(List<Integer> picks) {}

    public static final class Draw {
        public final List<Integer> draw;
        public final int hits;
        public final double multiplier;

        public Draw(List<Integer> draw, int hits, double multiplier) {
            this.draw = draw;
            this.hits = hits;
            this.multiplier = multiplier;
        }
    }

    @Override
    public String name() { return "keno"; }

    @Override
    public int drawsPerBet() { return POOL; }

    @Override
    public void validate(Params p) {
        List<Integer> picks = p.picks();
        if (picks == null || picks.isEmpty() || picks.size() > MAX_PICKS) {
            throw new InvalidParametersException("Choisir entre 1 et " + MAX_PICKS + " numéros");
        }
        Set<Integer> seen = new HashSet<>();
        for (Integer n : picks) {
            if (n == null || n < 1 || n > POOL) {
                throw new InvalidParametersException("Numéro hors de 1.." + POOL + " : " + n);
            }
            if (!seen.add(n)) throw new InvalidParametersException("Numéro en double : " + n);
        }
    }

    @Override
    public BetOutcome resolve(BigDecimal betAmount, FairDraws draws, Params p) {
        List<Integer> drawn = draw(draws);
        Set<Integer> set = new HashSet<>(drawn);
        int hits = (int) p.picks().stream().filter(set::contains).count();
        double mult = PAYTABLE.get(p.picks().size())[hits];
        return BetOutcome.paid(new Draw(drawn, hits, mult), betAmount, Payouts.floor(betAmount, mult));
    }

    /** Fisher-Yates piloté par les tirages : l'étape i consomme l'offset i. */
    public static List<Integer> draw(FairDraws draws) {
        List<Integer> pool = new ArrayList<>(POOL);
        for (int i = 1; i <= POOL; i++) pool.add(i);
        for (int i = POOL - 1; i > 0; i--) {
            int j = draws.intBelow(i, i + 1);
            Integer tmp = pool.get(i);
            pool.set(i, pool.get(j));
            pool.set(j, tmp);
        }
        return List.copyOf(pool.subList(0, DRAWN));
    }

    public static double multiplierFor(int picks, int hits) {
        return PAYTABLE.get(picks)[hits];
    }
}
