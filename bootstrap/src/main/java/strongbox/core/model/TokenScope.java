package strongbox.core.model;

/**
 * Capability level of a token issued by the secret store.
 */
public enum TokenScope {
    ROOT,
    /** Issues further tokens, such as the token issuing token. */
    DELEGATE,
    /** Held by a single microservice and bound to its {@code edgex-service-*} policy. */
    SERVICE
}
