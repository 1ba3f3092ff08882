package org.hexabets.service.crash;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.hexabets.dto.CrashEvent;
import org.hexabets.exception.InvalidBetException;
import org.hexabets.model.Commitment;
import org.hexabets.model.CrashPhase;
import org.hexabets.model.CrashRound;
import org.hexabets.service.fair.CommitmentManager;
import org.hexabets.service.fair.RandomStream;
import org.hexabets.service.games.Payouts;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * The single crash round of the process: IDLE -> RUNNING -> ENDED -> (delay) -> RUNNING.
 * One periodic task calls {@link #tick(long)}; ticks and cashouts share one lock, so a
 * cashout is always judged against a consistent view of what was broadcast.
 *
 * <p>Each round draws its crash point from its own commitment: the hash goes out with
 * {@code start}, the seed with {@code end}. Rotating the global seed therefore never
 * reveals the crash point of a round in progress.
 */
@Slf4j
@Service
public class CrashRoundScheduler {

    public static final String CRASH_SEED = "crash";

    private final Object lock = new Object();
    private final CommitmentManager commitments;
    private final RandomStream randomStream;
    private final CrashBroadcaster broadcaster;
    private final Settings settings;
    private final LongSupplier clock;

    private CrashRound round;   // null = IDLE
    private long nextRoundAt;
    private long roundCounter;
    private ScheduledExecutorService executor;

    public record Settings(long tickMs, long interRoundDelayMs, long firstRoundDelayMs,
                           double growthPerSecond, double crashScale, double maxMultiplier,
                           double houseFactor) {
        public static Settings defaults() {
            return new Settings(200, 3000, 1000, 1.2, 0.5, 1000, 0.99);
        }
    }

    @Autowired
    public CrashRoundScheduler(CommitmentManager commitments,
                               RandomStream randomStream,
                               CrashBroadcaster broadcaster,
                               @Value("${app.crash.tick-ms:200}") long tickMs,
                               @Value("${app.crash.inter-round-delay-ms:3000}") long interRoundDelayMs,
                               @Value("${app.crash.first-round-delay-ms:1000}") long firstRoundDelayMs,
                               @Value("${app.crash.growth-per-second:1.2}") double growthPerSecond,
                               @Value("${app.crash.scale:0.5}") double crashScale,
                               @Value("${app.crash.max-multiplier:1000}") double maxMultiplier,
                               @Value("${app.crash.house-factor:0.99}") double houseFactor) {
        this(commitments, randomStream, broadcaster,
                new Settings(tickMs, interRoundDelayMs, firstRoundDelayMs, growthPerSecond,
                        crashScale, maxMultiplier, houseFactor),
                System::currentTimeMillis);
    }

    public CrashRoundScheduler(CommitmentManager commitments, RandomStream randomStream,
                               CrashBroadcaster broadcaster, Settings settings, LongSupplier clock) {
        this.commitments = commitments;
        this.randomStream = randomStream;
        this.broadcaster = broadcaster;
        this.settings = settings;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        synchronized (lock) {
            if (executor != null) return;
            nextRoundAt = clock.getAsLong() + settings.firstRoundDelayMs();
            executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "crash-tick");
                t.setDaemon(true);
                return t;
            });
        }
        executor.scheduleAtFixedRate(() -> tick(clock.getAsLong()),
                settings.tickMs(), settings.tickMs(), TimeUnit.MILLISECONDS);
        log.info("Boucle crash démarrée (tick {} ms)", settings.tickMs());
    }

    @PreDestroy
    public void stop() {
        ScheduledExecutorService ex;
        synchronized (lock) {
            ex = executor;
            executor = null;
        }
        if (ex != null) ex.shutdownNow();
    }

    /** One step of the state machine at time {@code now}; never throws. */
    public void tick(long now) {
        try {
            synchronized (lock) {
                advance(now);
            }
        } catch (RuntimeException e) {
            // une exception stopperait scheduleAtFixedRate
            log.error("Tick crash en échec", e);
        }
    }

    private void advance(long now) {
        if (round == null) {
            if (now >= nextRoundAt) startRound(now);
            return;
        }
        if (round.getPhase() == CrashPhase.ENDED) {
            if (now >= round.getEndedAt() + settings.interRoundDelayMs()) {
                round = null;
                startRound(now);
            }
            return;
        }
        double current = multiplierAt(now - round.getStartedAt());
        if (current >= round.getCrashPoint()) {
            endRound(now);
        } else {
            round.recordBroadcast(now, current);
            publish(event("tick", round).build());
        }
    }

    private void startRound(long now) {
        long id = ++roundCounter;
        Commitment c = commitments.issue(id);
        double u = randomStream.deriveFraction(c, CRASH_SEED, id);
        round = new CrashRound(id, now, crashPointFor(u), c);
        round.recordBroadcast(now, 1.0);
        log.info("Manche {} lancée, commit {}", id, c.getCommitHash());
        publish(event("start", round).build());
        if (round.getCrashPoint() <= 1.0) {
            // 1.00x est atteint dès le départ : aucune fenêtre de cashout
            endRound(now);
        }
    }

    private void endRound(long now) {
        round.end(now);
        log.info("Manche {} terminée à {}x", round.getRoundId(), round.getCrashPoint());
        publish(event("end", round).revealedSeed(round.getCommitment().getSecretSeed()).build());
    }

    /**
     * Accepts the claim only if the current round was running when the request arrived
     * and the claim does not exceed what had been broadcast by then.
     */
    public CrashCashoutResult cashout(BigDecimal betAmount, double claimedMultiplier) {
        return cashout(betAmount, claimedMultiplier, clock.getAsLong());
    }

    public CrashCashoutResult cashout(BigDecimal betAmount, double claimedMultiplier, long arrivedAt) {
        if (betAmount == null || betAmount.signum() <= 0) throw new InvalidBetException("Montant invalide");
        synchronized (lock) {
            if (round == null) return CrashCashoutResult.rejected(0, CrashCashoutResult.Rejection.ROUND_NOT_RUNNING);
            long id = round.getRoundId();
            if (Double.isNaN(claimedMultiplier) || claimedMultiplier < 1.0) {
                return CrashCashoutResult.rejected(id, CrashCashoutResult.Rejection.INVALID_CLAIM);
            }
            if (!round.wasRunningAt(arrivedAt)) {
                return CrashCashoutResult.rejected(id, CrashCashoutResult.Rejection.ROUND_NOT_RUNNING);
            }
            Double observed = round.broadcastAtOrBefore(arrivedAt);
            if (observed == null || claimedMultiplier > observed) {
                log.warn("Cashout refusé manche {} : {}x réclamé, {}x diffusé", id, claimedMultiplier, observed);
                return CrashCashoutResult.rejected(id, CrashCashoutResult.Rejection.RACE_VIOLATION);
            }
            BigDecimal payout = Payouts.floor(betAmount, claimedMultiplier * settings.houseFactor());
            return new CrashCashoutResult(true, payout, id, null);
        }
    }

    /** État courant, envoyé à chaque nouvel abonné. */
    public CrashEvent snapshot() {
        synchronized (lock) {
            if (round == null) {
                return CrashEvent.builder().type("status").roundId(roundCounter)
                        .phase(CrashPhase.IDLE.name()).multiplier(1.0).build();
            }
            CrashEvent.CrashEventBuilder b = event("status", round);
            if (round.getPhase() == CrashPhase.ENDED) b.revealedSeed(round.getCommitment().getSecretSeed());
            return b.build();
        }
    }

    public double multiplierAt(long elapsedMs) {
        return Payouts.round2(1 + (elapsedMs / 1000.0) * settings.growthPerSecond());
    }

    public double crashPointFor(double u) {
        double raw = Payouts.round2(settings.crashScale() / (1 - u));
        return Math.min(settings.maxMultiplier(), Math.max(1.0, raw));
    }

    private static CrashEvent.CrashEventBuilder event(String type, CrashRound r) {
        return CrashEvent.builder()
                .type(type)
                .roundId(r.getRoundId())
                .phase(r.getPhase().name())
                .multiplier(r.getLastMultiplier())
                .commitHash(r.getCommitment().getCommitHash());
    }

    private void publish(CrashEvent e) {
        try {
            broadcaster.publish(e);
        } catch (RuntimeException ex) {
            log.warn("Diffusion crash '{}' en échec : {}", e.getType(), ex.getMessage());
        }
    }
}
