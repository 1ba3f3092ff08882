package org.hexabets.service.crash;

import lombok.RequiredArgsConstructor;
import org.hexabets.dto.CrashEvent;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Publie sur le simple broker STOMP. L'envoi vers chaque client passe par le
 * clientOutboundChannel (pool dédié), un client lent ne retient donc pas le tick.
 */
@Component
@RequiredArgsConstructor
public class StompCrashBroadcaster implements CrashBroadcaster {

    public static final String TOPIC = "/topic/crash";

    private final SimpMessagingTemplate broker;

    @Override
    public void publish(CrashEvent event) {
        broker.convertAndSend(TOPIC, event);
    }
}
