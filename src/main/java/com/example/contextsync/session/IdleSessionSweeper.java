package com.example.contextsync.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
public class IdleSessionSweeper {

    private static final Logger logger = LoggerFactory.getLogger(IdleSessionSweeper.class);

    private final SessionRegistry sessionRegistry;
    private final Clock clock;

    public IdleSessionSweeper(SessionRegistry sessionRegistry, Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.context.session.sweep-interval:PT60S}",
            initialDelayString = "${app.context.session.sweep-interval:PT60S}")
    public void run() {
        try {
            List<String> removed = sessionRegistry.sweepIdle(clock.instant());
            if (!removed.isEmpty()) {
                logger.info("Idle sweep closed {} session(s): {}", removed.size(), removed);
            }
        } catch (RuntimeException e) {
            logger.error("Idle session sweep failed", e);
        }
    }
}
