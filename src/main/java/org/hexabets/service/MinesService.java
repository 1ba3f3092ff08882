package org.hexabets.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hexabets.dto.MinesStartRequest;
import org.hexabets.dto.MinesStartResponse;
import org.hexabets.exception.InvalidParametersException;
import org.hexabets.exception.StaleBoardException;
import org.hexabets.model.MinesBoard;
import org.hexabets.service.games.MinesRules;
import org.hexabets.service.games.Payouts;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Une grille par session. Une nouvelle partie remplace la précédente (mise perdue) ;
 * les révélations d'une même grille sont sérialisées sur son moniteur.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MinesService {

    private final Map<String, MinesBoard> boards = new ConcurrentHashMap<>();
    private final BetService bets;
    private final WalletService wallet;

    public MinesStartResponse start(String sessionId, MinesStartRequest req) {
        BigDecimal mise = req.betAmount == null ? null : req.betAmount.setScale(2, RoundingMode.FLOOR);
        wallet.verifierMise(sessionId, mise);
        BetService.Draw draw = bets.open(MinesRules.MINES, req.playerSeed, req.sequenceNumber);
        BigDecimal solde = wallet.debiter(sessionId, mise);

        MinesBoard board = new MinesBoard(UUID.randomUUID().toString(), sessionId, mise,
                draw.sequenceNumber(), draw.commitment().getCommitHash(),
                MinesRules.placeMines(draw.draws()));
        MinesBoard previous = boards.put(sessionId, board);
        if (previous != null) {
            synchronized (previous) {
                if (previous.isActive()) {
                    previous.close();
                    log.info("Grille {} remplacée, mise {} perdue (session {})",
                            previous.getId(), previous.getMise(), sessionId);
                }
            }
        }
        return new MinesStartResponse(board.getId(), MinesRules.GRID, MinesRules.MINES,
                MinesRules.multiplierFor(1), draw.sequenceNumber(), board.getCommitHash(), solde);
    }

    public RevealResult reveal(String sessionId, int x, int y) {
        if (x < 0 || x >= MinesRules.SIDE || y < 0 || y >= MinesRules.SIDE) {
            throw new InvalidParametersException("Case hors grille : " + x + "," + y);
        }
        int cell = MinesRules.index(x, y);
        MinesBoard board = mustGetActive(sessionId);
        synchronized (board) {
            ensureLive(sessionId, board);
            if (board.isMine(cell)) {
                board.close();
                boards.remove(sessionId, board);
                return new RevealResult(true, cell, board.safeCount(), 0.0, Payouts.ZERO, true,
                        List.copyOf(board.getMinedCells()), wallet.getSolde(sessionId));
            }
            board.reveal(cell);
            int k = board.safeCount();
            double mult = MinesRules.multiplierFor(k);
            BigDecimal potential = Payouts.floor(board.getMise(), mult);
            if (k == MinesRules.GRID - MinesRules.MINES) {
                // plus aucune case sûre : encaissement automatique
                BigDecimal solde = settle(sessionId, board, potential);
                return new RevealResult(false, cell, k, mult, potential, true,
                        List.copyOf(board.getMinedCells()), solde);
            }
            return new RevealResult(false, cell, k, mult, potential, false, List.of(), wallet.getSolde(sessionId));
        }
    }

    public CashoutResult cashout(String sessionId) {
        MinesBoard board = mustGetActive(sessionId);
        synchronized (board) {
            ensureLive(sessionId, board);
            int k = board.safeCount();
            if (k <= 0) throw new IllegalStateException("Aucun diamant révélé.");
            double mult = MinesRules.multiplierFor(k);
            BigDecimal payout = Payouts.floor(board.getMise(), mult);
            BigDecimal solde = settle(sessionId, board, payout);
            return new CashoutResult(k, mult, payout, List.copyOf(board.getMinedCells()), solde);
        }
    }

    public MinesBoard getActive(String sessionId) {
        MinesBoard b = boards.get(sessionId);
        return b != null && b.isActive() ? b : null;
    }

    private BigDecimal settle(String sessionId, MinesBoard board, BigDecimal payout) {
        board.close();
        boards.remove(sessionId, board);
        log.debug("mines session={} seq={} safe={} payout={}", sessionId, board.getSequenceNumber(),
                board.safeCount(), payout);
        return wallet.crediter(sessionId, payout);
    }

    private MinesBoard mustGetActive(String sessionId) {
        MinesBoard b = boards.get(sessionId);
        if (b == null) throw new StaleBoardException("Aucune partie en cours. Relancez une partie.");
        return b;
    }

    // la grille a pu être perdue, encaissée ou remplacée avant la prise du verrou
    private void ensureLive(String sessionId, MinesBoard board) {
        if (!board.isActive() || boards.get(sessionId) != board) {
            throw new StaleBoardException("Partie terminée ou remplacée. Relancez une partie.");
        }
    }

    public static final class RevealResult {
        public final boolean mine;
        public final int index;
        public final int safeCount;
        public final double currentMultiplier;
        public final BigDecimal potentialPayout;
        public final boolean finished;
        public final List<Integer> minedCells; // révélées en fin de partie
        public final BigDecimal solde;

        public RevealResult(boolean mine, int index, int safeCount, double currentMultiplier,
                            BigDecimal potentialPayout, boolean finished, List<Integer> minedCells,
                            BigDecimal solde) {
            this.mine = mine;
            this.index = index;
            this.safeCount = safeCount;
            this.currentMultiplier = currentMultiplier;
            this.potentialPayout = potentialPayout;
            this.finished = finished;
            this.minedCells = minedCells;
            this.solde = solde;
        }
    }

    public static final class CashoutResult {
        public final int safeCount;
        public final double multiplier;
        public final BigDecimal payout;
        public final List<Integer> minedCells;
        public final BigDecimal solde;

        public CashoutResult(int safeCount, double multiplier, BigDecimal payout,
                             List<Integer> minedCells, BigDecimal solde) {
            this.safeCount = safeCount;
            this.multiplier = multiplier;
            this.payout = payout;
            this.minedCells = minedCells;
            this.solde = solde;
        }
    }
}
