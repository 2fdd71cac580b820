package dev.ebullient.mud;

import java.util.List;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import dev.ebullient.mud.model.Event;

/**
 * Delivers events to the live sessions matching their scope.
 * <p>
 * Recipients are resolved from the world at publish time; delivery itself happens
 * outside the world lock. A recipient that cannot take the text is disconnected,
 * and the remaining recipients still receive it.
 */
@Singleton
public class BroadcastRouter {
    private static final Logger log = Logger.getLogger(BroadcastRouter.class);

    @Inject
    WorldModel world;

    public BroadcastRouter() {
    }

    public BroadcastRouter(WorldModel world) {
        this.world = world;
    }

    /**
     * @return number of sessions the event was queued for
     */
    public int publish(Event event) {
        List<Recipient> recipients = world.recipientsFor(event);
        int delivered = 0;
        for (Recipient recipient : recipients) {
            if (deliver(recipient, event.text())) {
                delivered++;
            }
        }
        log.tracef("%s event to %s reached %d of %d sessions",
                event.scope(), event.target(), delivered, recipients.size());
        return delivered;
    }

    public void publishAll(List<Event> events) {
        for (Event event : events) {
            publish(event);
        }
    }

    private boolean deliver(Recipient recipient, String text) {
        try {
            if (recipient.deliver(text)) {
                return true;
            }
            log.warnf("Could not deliver to %s (%s); disconnecting", recipient.username(), recipient.sessionId());
            recipient.disconnect("outbound queue full or closed");
        } catch (RuntimeException e) {
            log.warnf(e, "Delivery to %s (%s) failed; disconnecting", recipient.username(), recipient.sessionId());
            try {
                recipient.disconnect("delivery failed: " + e.getMessage());
            } catch (RuntimeException ex) {
                log.debugf(ex, "Disconnect of %s also failed", recipient.sessionId());
            }
        }
        return false;
    }
}
