package strongbox.core.service.vault;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.model.SecretPath;
import strongbox.core.model.SecretStoreException;
import strongbox.core.model.Token;
import strongbox.core.port.out.SecretStoreAdminClient;

/**
 * Makes sure a version 1 key-value engine is mounted where secrets are written.
 */
@ApplicationScoped
public class KvEngineEnabler {

    private static final Logger LOG = Logger.getLogger(KvEngineEnabler.class);

    static final String ENGINE_TYPE = "kv";
    static final String KV_VERSION = "1";

    private final SecretStoreAdminClient adminClient;

    @Inject
    public KvEngineEnabler(SecretStoreAdminClient adminClient) {
        this.adminClient = adminClient;
    }

    /**
     * Mount the key-value engine unless it is already installed.
     *
     * @param rootToken token with permission to manage mounts
     * @return Uni with true if the engine was mounted during this call
     */
    public Uni<Boolean> enable(Token rootToken) {
        return adminClient
                .isSecretsEngineInstalled(rootToken.value(), SecretPath.MOUNT + "/", ENGINE_TYPE)
                .onItem()
                .transformToUni(installed -> {
                    if (installed) {
                        LOG.infof("Key-value secrets engine already mounted at %s/", SecretPath.MOUNT);
                        return Uni.createFrom().item(false);
                    }
                    return adminClient
                            .enableKvSecretsEngine(rootToken.value(), SecretPath.MOUNT, KV_VERSION)
                            .invoke(() -> LOG.infof("Key-value secrets engine mounted at %s/", SecretPath.MOUNT))
                            .replaceWith(true);
                })
                .onFailure()
                .transform(error -> SecretStoreException.fatal(
                        "Could not enable the key-value secrets engine: " + error.getMessage(), error));
    }
}
