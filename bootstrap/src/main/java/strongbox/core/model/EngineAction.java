package strongbox.core.model;

/**
 * What the state controller does after classifying the engine state.
 */
public enum EngineAction {
    /** Wait for the health interval and probe again. */
    RETRY_LATER,
    /** Engine is ready; load the persisted initialization material and stop. */
    LOAD_AND_FINISH,
    /** Another node is the active unsealer; stop without failing the process. */
    STOP_STANDBY,
    /** First start: initialize, persist the material, then unseal. */
    INITIALIZE_AND_UNSEAL,
    /** Restart: load the persisted material and unseal. */
    LOAD_AND_UNSEAL
}
