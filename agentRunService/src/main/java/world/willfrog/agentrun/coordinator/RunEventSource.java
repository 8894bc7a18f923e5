package world.willfrog.agentrun.coordinator;

import world.willfrog.agentrun.model.RunInvocation;
import world.willfrog.agentrun.turn.ResponseEventStream;

/**
 * 协调器消费的事件来源。返回的流由协调器在清理阶段关闭。
 */
public interface RunEventSource {

    ResponseEventStream open(RunInvocation invocation);
}
