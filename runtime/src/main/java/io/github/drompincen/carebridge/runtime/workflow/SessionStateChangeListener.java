package io.github.drompincen.carebridge.runtime.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class SessionStateChangeListener {

    private static final Logger log = LoggerFactory.getLogger(SessionStateChangeListener.class);

    @EventListener
    public void onStateChanged(SessionStateChangedEvent event) {
        log.info("Session {} moved {} -> {} (transition={}, user={}, reason={})",
                event.sessionCouchId(), event.fromState(), event.toState(),
                event.transitionUuid(), event.userId(), event.reason());
    }
}
