package org.hexabets.service.crash;

import org.hexabets.dto.CrashEvent;

/** Diffusion à tous les abonnés ; ne doit jamais bloquer la boucle de ticks. */
public interface CrashBroadcaster {
    void publish(CrashEvent event);
}
