package org.hexabets.service.games;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Payouts {
    private Payouts() {}

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    /** floor(bet * multiplier) au centime, jamais arrondi vers le haut. */
    public static BigDecimal floor(BigDecimal bet, double multiplier) {
        return bet.multiply(BigDecimal.valueOf(multiplier)).setScale(2, RoundingMode.FLOOR);
    }

    public static double round2(double value) {
        return Math.floor(value * 100.0) / 100.0;
    }
}
