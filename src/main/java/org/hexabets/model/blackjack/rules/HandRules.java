package org.hexabets.model.blackjack.rules;

import org.hexabets.model.Card;

import java.util.List;

public final class HandRules {
    private HandRules(){}

    public static final int BLACKJACK = 21;
    public static final int DEALER_STANDS_ON = 17;

    public static int value(int rank) {
        if (rank == Card.ACE) return 11; // réduit à 1 dans bestTotal si besoin
        if (rank >= 11) return 10;       // J, Q, K
        return rank;
    }

    public static int bestTotal(List<Integer> ranks) {
        int sum = 0, aces = 0;
        for (int r : ranks) {
            sum += value(r);
            if (r == Card.ACE) aces++;
        }
        while (sum > BLACKJACK && aces-- > 0) sum -= 10;
        return sum;
    }

    public static boolean isBusted(List<Integer> ranks) {
        return bestTotal(ranks) > BLACKJACK;
    }

    public static boolean dealerMustDraw(List<Integer> ranks) {
        return bestTotal(ranks) < DEALER_STANDS_ON;
    }
}
