package org.hexabets.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Une manche de crash. Le point de crash est fixé à la création et ne change plus.
 * Pas thread-safe : toujours manipulée sous le verrou du scheduler.
 */
@Getter
public class CrashRound {
    private final long roundId;
    private final long startedAt;
    private final double crashPoint;
    private final Commitment commitment;
    private CrashPhase phase = CrashPhase.RUNNING;
    private long endedAt = -1;
    private double lastMultiplier = 1.0;

    @Getter(AccessLevel.NONE)
    private final NavigableMap<Long, Double> broadcasts = new TreeMap<>();

    public CrashRound(long roundId, long startedAt, double crashPoint, Commitment commitment) {
        this.roundId = roundId;
        this.startedAt = startedAt;
        this.crashPoint = crashPoint;
        this.commitment = commitment;
    }

    public void recordBroadcast(long at, double multiplier) {
        broadcasts.put(at, multiplier);
        lastMultiplier = multiplier;
    }

    /** Dernier multiplicateur diffusé à l'instant {@code at} ou avant, null si aucun. */
    public Double broadcastAtOrBefore(long at) {
        Map.Entry<Long, Double> e = broadcasts.floorEntry(at);
        return e == null ? null : e.getValue();
    }

    public void end(long at) {
        this.phase = CrashPhase.ENDED;
        this.endedAt = at;
        recordBroadcast(at, crashPoint);
    }

    public boolean wasRunningAt(long at) {
        return at >= startedAt && (phase == CrashPhase.RUNNING || at < endedAt);
    }
}
