package strongbox.core.model;

import java.util.Map;

/**
 * State of the secret store engine as reported by its health endpoint.
 *
 * <p>Classification is total: every status code maps to exactly one state and
 * anything that is not recognized (including a missing status because the
 * engine could not be reached) maps to {@link #UNREACHABLE}.
 */
public enum EngineState {
    UNINITIALIZED,
    SEALED,
    UNSEALED,
    STANDBY,
    UNREACHABLE;

    private static final Map<Integer, EngineState> BY_STATUS_CODE = Map.of(
            200, UNSEALED,
            429, STANDBY,
            501, UNINITIALIZED,
            503, SEALED);

    /**
     * Classify a health probe status code.
     *
     * @param statusCode the HTTP status returned by the health endpoint, or null if none was received
     * @return the engine state, never null
     */
    public static EngineState fromStatusCode(Integer statusCode) {
        if (statusCode == null) {
            return UNREACHABLE;
        }
        return BY_STATUS_CODE.getOrDefault(statusCode, UNREACHABLE);
    }
}
