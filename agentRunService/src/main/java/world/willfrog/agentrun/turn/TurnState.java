package world.willfrog.agentrun.turn;

public enum TurnState {
    RUNNING,
    CONTINUING,
    STOPPED,
    ERRORED;

    public boolean isTerminal() {
        return this == STOPPED || this == ERRORED;
    }
}
