package strongbox.adapter.in.bootstrap;

import jakarta.inject.Inject;

import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import org.jboss.logging.Logger;

import strongbox.core.model.BootstrapResult;
import strongbox.core.model.ErrorKind;
import strongbox.core.model.SecretStoreException;
import strongbox.core.port.in.SecretStoreBootstrap;

/**
 * Command entry point running one secret store bootstrap.
 *
 * <h2>Exit Status</h2>
 * <ul>
 *   <li>0 - provisioned, found in standby, or cancelled by a shutdown</li>
 *   <li>1 - the secret store could not be bootstrapped</li>
 * </ul>
 *
 * <p>Secrets are never logged; the audit log records only the outcome.
 */
@QuarkusMain
public class SecretStoreBootstrapCommand implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(SecretStoreBootstrapCommand.class);
    private static final Logger AUDIT = Logger.getLogger("strongbox.audit.bootstrap");

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final SecretStoreBootstrap bootstrap;

    @Inject
    public SecretStoreBootstrapCommand(SecretStoreBootstrap bootstrap) {
        this.bootstrap = bootstrap;
    }

    @Override
    public int run(String... args) {
        LOG.info("Starting secret store bootstrap");

        try {
            final BootstrapResult result = bootstrap.bootstrap().await().indefinitely();
            logResult(result);
            return EXIT_OK;
        } catch (SecretStoreException e) {
            if (e.kind() != ErrorKind.FATAL) {
                LOG.warnf("Secret store bootstrap ended early: %s", e.getMessage());
                AUDIT.infof("SECRET_STORE_BOOTSTRAP_ABORTED kind=%s", e.kind());
                return EXIT_OK;
            }
            logFailure(e);
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error during secret store bootstrap: %s", e.getMessage());
            AUDIT.info("SECRET_STORE_BOOTSTRAP_FAILED reason=unexpected");
            return EXIT_FAILURE;
        }
    }

    private void logResult(BootstrapResult result) {
        AUDIT.infof(
                "SECRET_STORE_BOOTSTRAP_COMPLETED status=%s credentials_uploaded=%d certificate_uploaded=%s",
                result.status(), result.credentialsUploaded(), result.certificateUploaded());

        switch (result.status()) {
            case PROVISIONED:
                LOG.infof(
                        "Secret store bootstrap done: %d credential path(s) uploaded, certificate uploaded=%s",
                        result.credentialsUploaded(), result.certificateUploaded());
                break;
            case STANDBY:
                LOG.info("Secret store is served by another node; nothing to do");
                break;
            case CANCELLED:
            default:
                LOG.info("Secret store bootstrap cancelled by shutdown");
                break;
        }
    }

    private void logFailure(SecretStoreException e) {
        LOG.error("========================================");
        LOG.errorf("SECRET STORE BOOTSTRAP FAILED: %s", e.getMessage());
        if (e.getCause() != null) {
            LOG.errorf("Caused by: %s", e.getCause().getMessage());
        }
        LOG.error("========================================");
        AUDIT.infof("SECRET_STORE_BOOTSTRAP_FAILED reason=fatal message=%s", e.getMessage());
    }
}
