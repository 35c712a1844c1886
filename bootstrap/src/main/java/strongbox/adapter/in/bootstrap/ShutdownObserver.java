package strongbox.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.ShutdownEvent;
import org.jboss.logging.Logger;

import strongbox.core.service.ShutdownSignal;

/**
 * Raises the shutdown signal when Quarkus shuts down so the polling loops stop.
 */
@ApplicationScoped
public class ShutdownObserver {

    private static final Logger LOG = Logger.getLogger(ShutdownObserver.class);

    private final ShutdownSignal shutdownSignal;

    @Inject
    public ShutdownObserver(ShutdownSignal shutdownSignal) {
        this.shutdownSignal = shutdownSignal;
    }

    void onStop(@Observes ShutdownEvent event) {
        LOG.debug("Shutdown requested");
        shutdownSignal.request();
    }
}
