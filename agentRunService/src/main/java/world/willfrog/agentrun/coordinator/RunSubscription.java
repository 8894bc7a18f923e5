package world.willfrog.agentrun.coordinator;

public interface RunSubscription extends AutoCloseable {

    @Override
    void close();
}
