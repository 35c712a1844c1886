package strongbox.core.service.credential;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.config.CredentialConfig;
import strongbox.core.model.CredentialPair;
import strongbox.core.model.SecretPath;
import strongbox.core.model.SecretStoreException;
import strongbox.core.model.Token;
import strongbox.core.port.out.SecretStoreKvClient;

/**
 * Uploads database credentials for every configured service.
 *
 * <p>All services of one database share a single credential pair. Each pair
 * is written under the service-scoped path, read by the service, and the
 * database-scoped path, enumerated to configure the database. The
 * database's own bootstrap service reads the pair from its service-scoped
 * path.
 *
 * <p>Existing secrets are never overwritten, so running the provisioner
 * again uploads nothing.
 */
@ApplicationScoped
public class CredentialProvisioner {

    private static final Logger LOG = Logger.getLogger(CredentialProvisioner.class);

    private final CredentialConfig config;
    private final PasswordGenerator passwordGenerator;
    private final SecretStoreKvClient kvClient;

    @Inject
    public CredentialProvisioner(
            CredentialConfig config, PasswordGenerator passwordGenerator, SecretStoreKvClient kvClient) {
        this.config = config;
        this.passwordGenerator = passwordGenerator;
        this.kvClient = kvClient;
    }

    /**
     * Upload every credential not yet in the secret store.
     *
     * @param rootToken token used to read and write secrets
     * @return Uni with the number of paths written; fails with FATAL
     */
    public Uni<Integer> provision(Token rootToken) {
        final Map<String, List<String>> servicesByDatabase = servicesByDatabase();
        if (servicesByDatabase.isEmpty()) {
            LOG.info("No database credentials configured");
        }

        return Multi.createFrom()
                .iterable(servicesByDatabase.entrySet())
                .onItem()
                .transformToUniAndConcatenate(entry -> provisionDatabase(rootToken, entry.getKey(), entry.getValue()))
                .collect()
                .with(Collectors.summingInt(Integer::intValue))
                .onFailure(error -> !(error instanceof SecretStoreException))
                .transform(error -> SecretStoreException.fatal(
                        "Failed to provision database credentials: " + error.getMessage(), error));
    }

    private Uni<Integer> provisionDatabase(Token rootToken, String database, List<String> services) {
        return passwordGenerator
                .generate()
                .map(password -> new CredentialPair(config.username(), password))
                .onItem()
                .transformToUni(pair -> Multi.createFrom()
                        .iterable(pathsFor(database, services))
                        .onItem()
                        .transformToUniAndConcatenate(path -> addCredential(rootToken, path, pair))
                        .select()
                        .where(Boolean::booleanValue)
                        .collect()
                        .asList()
                        .map(List::size));
    }

    /**
     * Write the pair to the path unless something is already stored there.
     *
     * @return Uni with true if the pair was written
     */
    Uni<Boolean> addCredential(Token rootToken, SecretPath path, CredentialPair pair) {
        return alreadyInStore(rootToken, path).onItem().transformToUni(existing -> {
            if (existing) {
                LOG.infof("Credentials already present at path %s", path);
                return Uni.createFrom().item(false);
            }
            return uploadToStore(rootToken, path, pair).replaceWith(true);
        });
    }

    Uni<Boolean> alreadyInStore(Token rootToken, SecretPath path) {
        return kvClient.read(rootToken.value(), path).map(Optional::isPresent);
    }

    Uni<Void> uploadToStore(Token rootToken, SecretPath path, CredentialPair pair) {
        return kvClient
                .write(rootToken.value(), path, pair.toSecretData())
                .invoke(() -> LOG.infof("Uploaded credentials to path %s", path))
                .onFailure()
                .transform(error -> SecretStoreException.fatal(
                        "Failed to upload credential pair on path " + path + ": " + error.getMessage(), error));
    }

    private List<SecretPath> pathsFor(String database, List<String> services) {
        final Set<SecretPath> paths = new LinkedHashSet<>();
        for (String service : services) {
            paths.add(SecretPath.serviceScoped(service, database));
            paths.add(SecretPath.databaseScoped(database, service));
        }
        paths.add(SecretPath.serviceScoped(config.databaseBootstrapService(), database));
        return new ArrayList<>(paths);
    }

    private Map<String, List<String>> servicesByDatabase() {
        final Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (CredentialConfig.DatabaseEntry entry : config.databases().orElse(List.of())) {
            if (entry.service() == null || entry.service().isBlank()) {
                continue;
            }
            grouped.computeIfAbsent(entry.database(), db -> new ArrayList<>()).add(entry.service());
        }
        return grouped;
    }
}
