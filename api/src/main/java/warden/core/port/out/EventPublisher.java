package warden.core.port.out;

import warden.core.model.event.AuthEvent;

/**
 * Port interface for outbound authentication events.
 *
 * <p>Publishing is fire-and-forget: implementations must return immediately
 * and must never throw, so that delivery problems cannot fail the operation
 * that produced the event.
 */
public interface EventPublisher {

    void publish(AuthEvent event);
}
