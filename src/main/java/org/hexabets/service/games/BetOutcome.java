package org.hexabets.service.games;

import java.math.BigDecimal;

/**
 * @param detail game specific result, serialized as is
 * @param push   stake returned, neither a win nor a loss
 * @param payout amount credited back, in the bet's unit (0 when lost)
 */
public record BetOutcome(Object detail, boolean won, boolean push, BigDecimal payout) {

    public static BetOutcome win(Object detail, BigDecimal payout) {
        return new BetOutcome(detail, true, false, payout);
    }

    public static BetOutcome loss(Object detail) {
        return new BetOutcome(detail, false, false, Payouts.ZERO);
    }

    public static BetOutcome push(Object detail, BigDecimal stake) {
        return new BetOutcome(detail, false, true, stake);
    }

    /**
     * Jeux à multiplicateur (plinko, keno, wheel) : gagné dès que le paiement dépasse la
     * mise, push s'il la rend exactement.
     */
    public static BetOutcome paid(Object detail, BigDecimal bet, BigDecimal payout) {
        int cmp = payout.compareTo(bet);
        return new BetOutcome(detail, cmp > 0, cmp == 0, payout);
    }
}
