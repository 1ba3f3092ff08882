package org.hexabets.service.crash;

import java.math.BigDecimal;

/** @param reason null si accepté */
public record CrashCashoutResult(boolean accepted, BigDecimal payout, long roundId, Rejection reason) {

    public enum Rejection { ROUND_NOT_RUNNING, RACE_VIOLATION, INVALID_CLAIM }

    public static CrashCashoutResult rejected(long roundId, Rejection reason) {
        return new CrashCashoutResult(false, BigDecimal.ZERO.setScale(2), roundId, reason);
    }
}
