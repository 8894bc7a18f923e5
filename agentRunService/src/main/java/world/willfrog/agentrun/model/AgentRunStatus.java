package world.willfrog.agentrun.model;

public enum AgentRunStatus {
    CREATED,
    RUNNING,
    COMPLETED,
    FAILED,
    STOPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }
}
