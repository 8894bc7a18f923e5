package world.willfrog.agentrun.turn;

import world.willfrog.agentrun.llm.LlmResponse;
import world.willfrog.agentrun.model.ResponseEvent;

import java.util.Iterator;

/**
 * 把模型原始回复转成 {@link ResponseEvent} 流：落库消息、执行工具，并以 Finish 事件给出本次回复的结束原因。
 */
public interface ResponseEventProcessor {

    Iterator<ResponseEvent> process(LlmResponse response, TurnContext context);
}
