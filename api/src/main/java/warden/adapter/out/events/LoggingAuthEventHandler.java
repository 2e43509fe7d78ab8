package warden.adapter.out.events;

import org.jboss.logging.Logger;

import warden.core.model.event.AuthEvent;
import warden.spi.AuthEventHandler;

/**
 * Built-in handler that logs every outbound event at INFO level.
 *
 * <p>Reset tokens are never written: {@link AuthEvent.PasswordResetRequested}
 * is logged through its redacting {@code toString()}.
 */
public class LoggingAuthEventHandler implements AuthEventHandler {

    private static final Logger LOG = Logger.getLogger("warden.events");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public void handle(AuthEvent event) {
        LOG.infof("%s user=%s detail=%s", event.eventName(), event.userId(), event);
    }
}
