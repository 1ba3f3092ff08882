package org.hexabets.service.games;

import org.hexabets.exception.InvalidParametersException;
import org.hexabets.model.Card;
import org.hexabets.service.fair.FairDraws;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Carte courante = offsets 0 (rang) et 1 (couleur), carte suivante = offsets 2 et 3.
 * Égalité de rang : push, la mise est rendue.
 */
@Component
public class HiLoResolver implements GameResolver<HiLoResolver.Params> {

    public static final double PAYOUT_MULTIPLIER = 1.92;

    public record Params(String guess) {}

    public static final class Reveal {
        public final Card current;
        public final Card next;
        public final String guess;
        public final boolean tie;

        public Reveal(Card current, Card next, String guess, boolean tie) {
            this.current = current;
            this.next = next;
            this.guess = guess;
            this.tie = tie;
        }
    }

    @Override
    public String name() { return "hilo"; }

    @Override
    public int drawsPerBet() { return 4; }

    @Override
    public void validate(Params p) {
        if (!"higher".equals(p.guess()) && !"lower".equals(p.guess())) {
            throw new InvalidParametersException("guess invalide (higher|lower)");
        }
    }

    @Override
    public BetOutcome resolve(BigDecimal betAmount, FairDraws draws, Params p) {
        Card current = currentCard(draws);
        Card next = card(draws, 2);
        boolean tie = next.getRank() == current.getRank();
        Reveal detail = new Reveal(current, next, p.guess(), tie);
        if (tie) return BetOutcome.push(detail, betAmount);
        boolean win = "higher".equals(p.guess())
                ? next.getRank() > current.getRank()
                : next.getRank() < current.getRank();
        return win ? BetOutcome.win(detail, Payouts.floor(betAmount, PAYOUT_MULTIPLIER)) : BetOutcome.loss(detail);
    }

    public Card currentCard(FairDraws draws) {
        return card(draws, 0);
    }

    static Card card(FairDraws draws, int offset) {
        int rank = Card.rankFromIndex(draws.intBelow(offset, Card.RANK_COUNT));
        Card.Suit suit = Card.Suit.values()[draws.intBelow(offset + 1, Card.Suit.values().length)];
        return new Card(rank, suit);
    }
}
