package udem.communities.detection;

public enum DriverState {
    INITIALIZING,
    PARTITION_PHASE,
    PARAMETER_PHASE,
    CONVERGED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == CONVERGED || this == EXHAUSTED;
    }
}
