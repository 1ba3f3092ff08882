package org.hexabets.dto;

import lombok.Builder;
import lombok.Data;

/** Message diffusé sur /topic/crash : start, tick, end, ou status à l'abonnement. */
@Data
@Builder
public class CrashEvent {
    private String type;
    private long roundId;
    private String phase;
    private double multiplier;
    private String commitHash;
    private String revealedSeed; // uniquement sur "end"
}
