package strongbox.core.model;

/**
 * Outcome of driving the secret store to an unsealed state.
 *
 * @param status   whether this node unsealed the engine or found it in standby
 * @param material the initialization material, null on standby
 */
public record ReadinessResult(Status status, InitMaterial material) {

    public enum Status {
        READY,
        STANDBY
    }

    public static ReadinessResult ready(InitMaterial material) {
        if (material == null) {
            throw new IllegalArgumentException("A ready secret store must come with its initialization material");
        }
        return new ReadinessResult(Status.READY, material);
    }

    public static ReadinessResult standby() {
        return new ReadinessResult(Status.STANDBY, null);
    }

    public boolean isReady() {
        return status == Status.READY;
    }
}
