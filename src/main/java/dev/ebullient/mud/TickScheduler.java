package dev.ebullient.mud;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.mud.model.Event;
import io.quarkus.runtime.Startup;

/**
 * Periodically lets wandering NPCs move. Runs on one dedicated thread, so ticks
 * never overlap; a failed tick is logged and the next one runs on schedule.
 */
@Startup
@Singleton
public class TickScheduler {
    private static final Logger log = Logger.getLogger(TickScheduler.class);

    @ConfigProperty(name = "mud.tick.interval", defaultValue = "30s")
    Duration interval;

    @ConfigProperty(name = "mud.tick.wander-probability", defaultValue = "0.25")
    double wanderProbability;

    @Inject
    WorldModel world;

    @Inject
    BroadcastRouter router;

    private ScheduledExecutorService scheduler;

    @PostConstruct
    void init() {
        if (interval.isZero() || interval.isNegative()) {
            log.info("NPC tick disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("mud-tick"));
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::tick, millis, millis, TimeUnit.MILLISECONDS);
        log.infof("NPC tick every %s (wander probability %.2f)", interval, wanderProbability);
    }

    @PreDestroy
    void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * Advance NPCs once and publish what happened.
     *
     * @return number of events published
     */
    public int tick() {
        try {
            List<Event> events = world.tickAdvanceNpcs(wanderProbability);
            router.publishAll(events);
            if (!events.isEmpty()) {
                log.debugf("Tick moved %d NPC(s)", events.size() / 2);
            }
            return events.size();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the fixed-rate schedule
            log.errorf(e, "NPC tick failed");
            return 0;
        }
    }
}
