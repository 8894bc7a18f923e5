package world.willfrog.agentrun.turn;

import world.willfrog.agentrun.model.ResponseEvent;

import java.util.Iterator;

/**
 * 惰性事件流：每次 {@code hasNext()} 可能触发一次模型调用或工具执行，消费方可以在任意事件边界停止并关闭。
 */
public interface ResponseEventStream extends Iterator<ResponseEvent>, AutoCloseable {

    @Override
    void close();
}
