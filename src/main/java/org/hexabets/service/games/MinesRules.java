package org.hexabets.service.games;

import org.hexabets.service.fair.FairDraws;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Grille 5x5, 3 mines, +0.2 par case sûre révélée. */
public final class MinesRules {
    private MinesRules() {}

    public static final int SIDE = 5;
    public static final int GRID = SIDE * SIDE;
    public static final int MINES = 3;
    public static final double STEP = 0.2;

    /**
     * Partial Fisher-Yates over the 25 cells: draw {@code k} picks one of the
     * {@code 25 - k} cells not chosen yet. Always exactly {@link #MINES} draws.
     */
    public static Set<Integer> placeMines(FairDraws draws) {
        List<Integer> cells = new ArrayList<>(GRID);
        for (int i = 0; i < GRID; i++) cells.add(i);
        Set<Integer> mines = new LinkedHashSet<>();
        for (int k = 0; k < MINES; k++) {
            int j = k + draws.intBelow(k, GRID - k);
            Integer tmp = cells.get(k);
            cells.set(k, cells.get(j));
            cells.set(j, tmp);
            mines.add(cells.get(k));
        }
        return mines;
    }

    public static double multiplierFor(int safeCount) {
        return Payouts.round2(1 + safeCount * STEP + 1e-9); // 1e-9 absorbe l'erreur binaire avant le floor
    }

    public static int index(int x, int y) {
        return y * SIDE + x;
    }
}
