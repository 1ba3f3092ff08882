package org.hexabets.service.games;

import org.hexabets.exception.InvalidParametersException;
import org.hexabets.model.Card;
import org.hexabets.model.blackjack.rules.HandRules;
import org.hexabets.service.fair.FairDraws;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Single hand against the dealer, ranks only. Offsets 0-1 player, 2-3 dealer, then the
 * player's hits and the dealer's draws in that order. No split, no double.
 */
@Component
public class BlackjackResolver implements GameResolver<BlackjackResolver.Params> {

    public static final double WIN_MULTIPLIER = 1.98;
    public static final int MAX_ACTIONS = 20;
    // 4 cartes initiales + coups du joueur + tirages du croupier
    public static final int DRAW_BLOCK = 64;

    public enum Outcome { WIN, LOSE, BUST, PUSH }

    /** @param actions "hit" / "stand", lus dans l'ordre jusqu'au premier stand */
    public record Params(List<String> actions) {}

    public static final class Hands {
        public final List<Integer> player;
        public final List<Integer> dealer;
        public final int playerScore;
        public final int dealerScore;
        public final Outcome outcome;

        public Hands(List<Integer> player, List<Integer> dealer, Outcome outcome) {
            this.player = player;
            this.dealer = dealer;
            this.playerScore = HandRules.bestTotal(player);
            this.dealerScore = HandRules.bestTotal(dealer);
            this.outcome = outcome;
        }
    }

    /** Ce que voit le joueur avant de miser : ses deux cartes et la carte visible du croupier. */
    public static final class Opening {
        public final List<Integer> player;
        public final int dealerUp;
        public final int playerScore;

        public Opening(List<Integer> player, int dealerUp) {
            this.player = player;
            this.dealerUp = dealerUp;
            this.playerScore = HandRules.bestTotal(player);
        }
    }

    @Override
    public String name() { return "blackjack"; }

    @Override
    public int drawsPerBet() { return DRAW_BLOCK; }

    @Override
    public void validate(Params p) {
        List<String> actions = p.actions() == null ? List.of() : p.actions();
        if (actions.size() > MAX_ACTIONS) {
            throw new InvalidParametersException("Au plus " + MAX_ACTIONS + " actions");
        }
        for (String a : actions) {
            if (!"hit".equals(a) && !"stand".equals(a)) {
                throw new InvalidParametersException("Action inconnue : " + a);
            }
        }
    }

    public Opening open(FairDraws draws) {
        return new Opening(List.of(rank(draws, 0), rank(draws, 1)), rank(draws, 2));
    }

    @Override
    public BetOutcome resolve(BigDecimal betAmount, FairDraws draws, Params p) {
        List<Integer> player = new ArrayList<>(List.of(rank(draws, 0), rank(draws, 1)));
        List<Integer> dealer = new ArrayList<>(List.of(rank(draws, 2), rank(draws, 3)));
        int n = 4;
        for (String act : p.actions() == null ? List.<String>of() : p.actions()) {
            if ("stand".equals(act) || HandRules.bestTotal(player) >= HandRules.BLACKJACK) break;
            player.add(rank(draws, n++));
        }

        if (HandRules.isBusted(player)) {
            return BetOutcome.loss(new Hands(player, dealer, Outcome.BUST));
        }
        while (HandRules.dealerMustDraw(dealer)) dealer.add(rank(draws, n++));

        Outcome outcome = settle(HandRules.bestTotal(player), HandRules.bestTotal(dealer));
        Hands detail = new Hands(player, dealer, outcome);
        return switch (outcome) {
            case WIN -> BetOutcome.win(detail, Payouts.floor(betAmount, WIN_MULTIPLIER));
            case PUSH -> BetOutcome.push(detail, betAmount);
            default -> BetOutcome.loss(detail);
        };
    }

    public static Outcome settle(int playerTotal, int dealerTotal) {
        if (playerTotal > HandRules.BLACKJACK) return Outcome.BUST;
        if (dealerTotal > HandRules.BLACKJACK || playerTotal > dealerTotal) return Outcome.WIN;
        if (playerTotal == dealerTotal) return Outcome.PUSH;
        return Outcome.LOSE;
    }

    private static int rank(FairDraws draws, int offset) {
        return Card.rankFromIndex(draws.intBelow(offset, Card.RANK_COUNT));
    }
}
