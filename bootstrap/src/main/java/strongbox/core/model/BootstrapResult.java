package strongbox.core.model;

/**
 * Result of one bootstrap run.
 *
 * @param status              how the run ended
 * @param credentialsUploaded number of credential paths written during this run
 * @param certificateUploaded whether the proxy certificate pair was written during this run
 */
public record BootstrapResult(Status status, int credentialsUploaded, boolean certificateUploaded) {

    public enum Status {
        /** Engine unsealed, tokens rotated, credentials and certificates in place. */
        PROVISIONED,
        /** Engine is served by another node; nothing was done. */
        STANDBY,
        /** A shutdown was requested before the engine became ready. */
        CANCELLED
    }

    public static BootstrapResult provisioned(int credentialsUploaded, boolean certificateUploaded) {
        return new BootstrapResult(Status.PROVISIONED, credentialsUploaded, certificateUploaded);
    }

    public static BootstrapResult standby() {
        return new BootstrapResult(Status.STANDBY, 0, false);
    }

    public static BootstrapResult cancelled() {
        return new BootstrapResult(Status.CANCELLED, 0, false);
    }

    /**
     * Whether the hosting process should keep running after the bootstrap.
     *
     * <p>Always false: the bootstrap is a terminal stage, including after a
     * successful run.
     */
    public boolean continueRunning() {
        return false;
    }
}
