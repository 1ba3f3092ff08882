package org.hexabets.service.games;

import org.hexabets.exception.InvalidParametersException;
import org.hexabets.service.fair.FairDraws;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Set;

/** Roulette européenne, un seul tirage 0..36. */
@Component
public class RouletteResolver implements GameResolver<RouletteResolver.Params> {

    public static final int POCKETS = 37;
    public static final double EDGE_FACTOR = 0.98;

    private static final Set<Integer> RED_SET = Set.of(
            1, 3, 5, 7, 9, 12, 14, 16, 18, 19, 21, 23, 25, 27, 30, 32, 34, 36
    );
    private static final Set<String> TYPES =
            Set.of("number", "red", "black", "even", "odd", "low", "high", "dozen");

    /**
     * @param type   number | red | black | even | odd | low | high | dozen
     * @param number numéro joué (number) ou douzaine 1..3 (dozen)
     */
    public record Params(String type, Integer number) {}

    public static final class Spin {
        public final int result;
        public final String color;
        public final int multiplier;

        public Spin(int result, String color, int multiplier) {
            this.result = result;
            this.color = color;
            this.multiplier = multiplier;
        }
    }

    @Override
    public String name() { return "roulette"; }

    @Override
    public void validate(Params p) {
        if (p.type() == null || !TYPES.contains(p.type())) {
            throw new InvalidParametersException("Type de pari inconnu : " + p.type());
        }
        if ("number".equals(p.type()) && (p.number() == null || p.number() < 0 || p.number() > 36)) {
            throw new InvalidParametersException("number doit être entre 0 et 36");
        }
        if ("dozen".equals(p.type()) && (p.number() == null || p.number() < 1 || p.number() > 3)) {
            throw new InvalidParametersException("dozen doit être 1, 2 ou 3");
        }
    }

    @Override
    public BetOutcome resolve(BigDecimal betAmount, FairDraws draws, Params p) {
        int n = draws.intBelow(0, POCKETS);
        int mult = payoutMultiplier(p.type());
        Spin detail = new Spin(n, couleurPour(n), mult);
        if (!estGagnant(p, n)) return BetOutcome.loss(detail);
        // l'avantage maison réduit le gain, pas la probabilité
        return BetOutcome.win(detail, Payouts.floor(betAmount, mult * EDGE_FACTOR));
    }

    public static String couleurPour(int numero) {
        if (numero == 0) return "green";
        return RED_SET.contains(numero) ? "red" : "black";
    }

    public static boolean estGagnant(Params p, int n) {
        return switch (p.type()) {
            case "number" -> p.number() != null && p.number() == n;
            case "red" -> RED_SET.contains(n);
            case "black" -> n != 0 && !RED_SET.contains(n);
            case "even" -> n != 0 && n % 2 == 0; // le 0 n'est ni pair ni impair
            case "odd" -> n % 2 == 1;
            case "low" -> n >= 1 && n <= 18;
            case "high" -> n >= 19 && n <= 36;
            case "dozen" -> p.number() != null && n >= 1 && (n - 1) / 12 + 1 == p.number();
            default -> false;
        };
    }

    public static int payoutMultiplier(String type) {
        return switch (type) {
            case "number" -> 36;
            case "dozen" -> 3;
            default -> 2;
        };
    }
}
