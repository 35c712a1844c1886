package strongbox.core.model;

/**
 * Hierarchical key of a secret inside the key-value mount.
 *
 * <p>Credentials are stored under two shapes that reference the same pair:
 * {@code edgex/<service>/<db>} is read by the service itself, and
 * {@code edgex/<db>/<service>} is enumerated to configure the database.
 *
 * @param value path relative to the {@value #MOUNT} mount, without a leading slash
 */
public record SecretPath(String value) {

    public static final String MOUNT = "secret";
    private static final String PREFIX = "edgex";

    public SecretPath {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Secret path cannot be null or blank");
        }
        while (value.startsWith("/")) {
            value = value.substring(1);
        }
    }

    public static SecretPath of(String value) {
        return new SecretPath(value);
    }

    public static SecretPath serviceScoped(String service, String database) {
        return new SecretPath(PREFIX + "/" + service + "/" + database);
    }

    public static SecretPath databaseScoped(String database, String service) {
        return new SecretPath(PREFIX + "/" + database + "/" + service);
    }

    @Override
    public String toString() {
        return value;
    }
}
