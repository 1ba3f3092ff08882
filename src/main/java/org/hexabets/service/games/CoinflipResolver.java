package org.hexabets.service.games;

import org.hexabets.exception.InvalidParametersException;
import org.hexabets.service.fair.FairDraws;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
public class CoinflipResolver implements GameResolver<CoinflipResolver.Params> {

    public static final String HEADS = "heads";
    public static final String TAILS = "tails";
    public static final double PAYOUT_MULTIPLIER = 1.98;

    public record Params(String pick) {}

    public static final class Flip {
        public final String result;
        public final String pick;

        public Flip(String result, String pick) {
            this.result = result;
            this.pick = pick;
        }
    }

    @Override
    public String name() { return "coinflip"; }

    @Override
    public void validate(Params p) {
        if (!HEADS.equals(p.pick()) && !TAILS.equals(p.pick())) {
            throw new InvalidParametersException("Choix invalide (heads|tails)");
        }
    }

    @Override
    public BetOutcome resolve(BigDecimal betAmount, FairDraws draws, Params p) {
        String result = draws.fraction(0) < 0.5 ? HEADS : TAILS;
        Flip detail = new Flip(result, p.pick());
        return result.equals(p.pick())
                ? BetOutcome.win(detail, Payouts.floor(betAmount, PAYOUT_MULTIPLIER))
                : BetOutcome.loss(detail);
    }
}
