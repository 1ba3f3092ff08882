package org.hexabets.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** Rang 2..14 (11=J, 12=Q, 13=K, 14=A). La couleur est décorative. */
@Getter
@AllArgsConstructor
public class Card {
    public static final int RANK_COUNT = 13;
    public static final int ACE = 14;

    private final int rank;
    private final Suit suit;

    public static int rankFromIndex(int index) {
        return index + 2;
    }

    public enum Suit { SPADES, HEARTS, DIAMONDS, CLUBS }
}
