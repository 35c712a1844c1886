package strongbox.core.model;

/**
 * Failure raised while bootstrapping the secret store.
 *
 * <p>Every instance carries an {@link ErrorKind} so callers dispatch on the
 * declared policy instead of inferring it from where the error happened.
 */
public class SecretStoreException extends RuntimeException {

    private final ErrorKind kind;

    public SecretStoreException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SecretStoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static SecretStoreException fatal(String message) {
        return new SecretStoreException(ErrorKind.FATAL, message);
    }

    public static SecretStoreException fatal(String message, Throwable cause) {
        return new SecretStoreException(ErrorKind.FATAL, message, cause);
    }

    public static SecretStoreException retryable(String message, Throwable cause) {
        return new SecretStoreException(ErrorKind.TRANSIENT, message, cause);
    }

    public static SecretStoreException bestEffort(String message, Throwable cause) {
        return new SecretStoreException(ErrorKind.BEST_EFFORT, message, cause);
    }

    public static SecretStoreException terminal(String message) {
        return new SecretStoreException(ErrorKind.TERMINAL, message);
    }

    /**
     * Check whether a throwable is a {@code SecretStoreException} of the given kind.
     */
    public static boolean hasKind(Throwable error, ErrorKind kind) {
        return error instanceof SecretStoreException e && e.kind() == kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
