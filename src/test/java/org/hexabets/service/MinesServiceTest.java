package org.hexabets.service;

import org.hexabets.dto.MinesStartRequest;
import org.hexabets.dto.MinesStartResponse;
import org.hexabets.exception.InvalidBetException;
import org.hexabets.exception.InvalidParametersException;
import org.hexabets.exception.StaleBoardException;
import org.hexabets.model.MinesBoard;
import org.hexabets.service.fair.CommitmentManager;
import org.hexabets.service.fair.NonceAllocator;
import org.hexabets.service.fair.RandomStream;
import org.hexabets.service.games.MinesRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MinesServiceTest {

    private static final String SESSION = "s1";

    private WalletService wallet;
    private MinesService mines;

    @BeforeEach
    void setUp() {
        CommitmentManager commitments = new CommitmentManager();
        wallet = new WalletService(new BigDecimal("10000"));
        BetService bets = new BetService(commitments, new NonceAllocator(commitments),
                new RandomStream(commitments), wallet, "client");
        mines = new MinesService(bets, wallet);
    }

    private static MinesStartRequest start(String amount) {
        MinesStartRequest req = new MinesStartRequest();
        req.betAmount = new BigDecimal(amount);
        return req;
    }

    private List<Integer> safeCells() {
        MinesBoard board = mines.getActive(SESSION);
        List<Integer> safe = new ArrayList<>();
        for (int c = 0; c < MinesRules.GRID; c++) if (!board.isMine(c)) safe.add(c);
        return safe;
    }

    private int mineCell() {
        return mines.getActive(SESSION).getMinedCells().iterator().next();
    }

    private MinesService.RevealResult reveal(int cell) {
        return mines.reveal(SESSION, cell % MinesRules.SIDE, cell / MinesRules.SIDE);
    }

    // --- START ---

    @Test
    void start_debitsStakeAndPublishesCommit() {
        MinesStartResponse res = mines.start(SESSION, start("10"));

        assertThat(res.solde).isEqualByComparingTo("9990.00");
        assertThat(res.gridSize).isEqualTo(25);
        assertThat(res.mines).isEqualTo(3);
        assertThat(res.nextMultiplier).isEqualTo(1.2);
        assertThat(res.commitHash).hasSize(64);
        assertThat(mines.getActive(SESSION).getMinedCells()).hasSize(3);
    }

    @Test
    void start_insufficientBalance_createsNoBoard() {
        assertThatThrownBy(() -> mines.start(SESSION, start("20000")))
                .isInstanceOf(InvalidBetException.class);
        assertThat(mines.getActive(SESSION)).isNull();
    }

    @Test
    void start_again_forfeitsPreviousBoard() {
        mines.start(SESSION, start("10"));
        MinesBoard first = mines.getActive(SESSION);

        mines.start(SESSION, start("10"));

        assertThat(first.isActive()).isFalse();
        assertThat(mines.getActive(SESSION)).isNotSameAs(first);
        assertThat(wallet.getSolde(SESSION)).isEqualByComparingTo("9980.00");
    }

    // --- REVEAL / CASHOUT ---

    @Test
    void fiveSafeReveals_thenCashout_paysDouble() {
        mines.start(SESSION, start("10"));
        List<Integer> safe = safeCells();

        MinesService.RevealResult last = null;
        for (int i = 0; i < 5; i++) last = reveal(safe.get(i));

        assertThat(last.mine).isFalse();
        assertThat(last.safeCount).isEqualTo(5);
        assertThat(last.currentMultiplier).isEqualTo(2.0);
        assertThat(last.potentialPayout).isEqualByComparingTo("20.00");

        MinesService.CashoutResult out = mines.cashout(SESSION);

        assertThat(out.payout).isEqualByComparingTo("20.00");
        assertThat(out.solde).isEqualByComparingTo("10010.00");
        assertThat(mines.getActive(SESSION)).isNull();
    }

    @Test
    void revealMine_forfeitsAndClosesBoard() {
        mines.start(SESSION, start("10"));
        int mine = mineCell();

        MinesService.RevealResult res = reveal(mine);

        assertThat(res.mine).isTrue();
        assertThat(res.finished).isTrue();
        assertThat(res.minedCells).hasSize(3).contains(mine);
        assertThat(res.solde).isEqualByComparingTo("9990.00");
        assertThatThrownBy(() -> reveal(0)).isInstanceOf(StaleBoardException.class);
    }

    @Test
    void revealAllSafeCells_settlesAutomatically() {
        mines.start(SESSION, start("10"));

        MinesService.RevealResult last = null;
        for (int cell : safeCells()) last = reveal(cell);

        assertThat(last.finished).isTrue();
        assertThat(last.currentMultiplier).isEqualTo(5.4);
        assertThat(last.solde).isEqualByComparingTo("10044.00");
        assertThat(mines.getActive(SESSION)).isNull();
    }

    @Test
    void cashout_withoutReveal_isRejected() {
        mines.start(SESSION, start("10"));

        assertThatThrownBy(() -> mines.cashout(SESSION)).isInstanceOf(IllegalStateException.class);
        assertThat(mines.getActive(SESSION)).isNotNull();
    }

    @Test
    void actions_withoutBoard_areStale() {
        assertThatThrownBy(() -> mines.reveal(SESSION, 0, 0)).isInstanceOf(StaleBoardException.class);
        assertThatThrownBy(() -> mines.cashout(SESSION)).isInstanceOf(StaleBoardException.class);
    }

    @Test
    void reveal_outsideGrid_isInvalid() {
        mines.start(SESSION, start("10"));

        assertThatThrownBy(() -> mines.reveal(SESSION, 5, 0)).isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> mines.reveal(SESSION, 0, -1)).isInstanceOf(InvalidParametersException.class);
    }

    // --- CONCURRENCE ---

    private static void runAll(int threads, List<Runnable> tasks) throws Exception {
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Runnable task : tasks) {
                futures.add(pool.submit(() -> {
                    go.await();
                    task.run();
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentReveals_onOneBoard_settleExactlyOnce() throws Exception {
        mines.start(SESSION, start("10"));
        MinesBoard board = mines.getActive(SESSION);
        List<Integer> safe = safeCells();
        Queue<MinesService.RevealResult> results = new ConcurrentLinkedQueue<>();

        List<Runnable> tasks = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            int offset = t;
            tasks.add(() -> {
                for (int i = 0; i < safe.size(); i++) {
                    try {
                        results.add(reveal(safe.get((i + offset) % safe.size())));
                    } catch (StaleBoardException settled) {
                        // grille déjà encaissée par un autre thread
                    }
                }
            });
        }
        runAll(8, tasks);

        assertThat(board.safeCount()).isEqualTo(safe.size());
        assertThat(board.isActive()).isFalse();
        assertThat(results).filteredOn(r -> r.finished).hasSize(1);
        assertThat(results).noneMatch(r -> r.mine);
        assertThat(results).allMatch(r -> r.safeCount <= safe.size());
        assertThat(wallet.getSolde(SESSION)).isEqualByComparingTo("10044.00");
    }

    @Test
    void startRacingReveals_leavesWalletConsistent() throws Exception {
        mines.start(SESSION, start("10"));
        MinesBoard first = mines.getActive(SESSION);
        List<Integer> safe = safeCells();
        Queue<MinesService.RevealResult> results = new ConcurrentLinkedQueue<>();

        List<Runnable> tasks = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            tasks.add(() -> {
                for (int cell : safe) {
                    try {
                        results.add(reveal(cell));
                    } catch (StaleBoardException ended) {
                        // grille remplacée, perdue ou encaissée
                    }
                }
            });
        }
        tasks.add(() -> mines.start(SESSION, start("10")));
        runAll(8, tasks);

        assertThat(first.isActive()).isFalse();
        long settlements = results.stream().filter(r -> r.finished && !r.mine).count();
        BigDecimal expected = new BigDecimal("9980.00").add(new BigDecimal("54.00").multiply(BigDecimal.valueOf(settlements)));
        assertThat(wallet.getSolde(SESSION)).isEqualByComparingTo(expected);
        assertThat(results).filteredOn(r -> r.finished && r.mine).hasSizeLessThanOrEqualTo(1);
    }
}
