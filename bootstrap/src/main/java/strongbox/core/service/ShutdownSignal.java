package strongbox.core.service;

import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import strongbox.core.model.SecretStoreException;

/**
 * Process-wide shutdown request observed by the polling loops.
 *
 * <p>Once requested the signal stays raised.
 */
@ApplicationScoped
public class ShutdownSignal {

    private final AtomicBoolean requested = new AtomicBoolean();

    public void request() {
        requested.set(true);
    }

    public boolean isRequested() {
        return requested.get();
    }

    /**
     * Fail with a TERMINAL error if a shutdown was requested.
     *
     * @param activity what the caller was waiting for, used in the error message
     */
    public void throwIfRequested(String activity) {
        if (isRequested()) {
            throw SecretStoreException.terminal("Shutdown requested while " + activity);
        }
    }
}
