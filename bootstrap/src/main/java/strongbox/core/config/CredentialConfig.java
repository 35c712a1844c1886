package strongbox.core.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Database credentials provisioned into the secret store.
 *
 * <p>Configuration prefix: {@code strongbox.credentials}
 *
 * <pre>
 * strongbox.credentials.databases[0].service=core-data
 * strongbox.credentials.databases[1].service=core-metadata
 * strongbox.credentials.password-provider.name=default
 * </pre>
 */
@ConfigMapping(prefix = "strongbox.credentials")
public interface CredentialConfig {

    /**
     * Username shared by every service of a database.
     */
    @WithDefault("redis5")
    String username();

    /**
     * Service name under which the database itself reads its credentials,
     * stored at {@code edgex/<service>/<db>}.
     */
    @WithDefault("bootstrap-redis")
    String databaseBootstrapService();

    /**
     * Services that need database credentials.
     */
    Optional<List<DatabaseEntry>> databases();

    PasswordProvider passwordProvider();

    /**
     * One service that connects to one database.
     */
    interface DatabaseEntry {

        String service();

        @WithDefault("redisdb")
        String database();
    }

    /**
     * Strategy used to generate passwords.
     */
    interface PasswordProvider {

        /**
         * Provider name. {@code default} uses a built-in secure random
         * generator; any other value is run as an executable whose standard
         * output is the password.
         */
        @WithDefault("default")
        String name();

        Optional<List<String>> args();
    }
}
