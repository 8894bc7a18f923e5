package world.willfrog.agentrun.coordinator;

import java.util.Collection;
import java.util.function.Consumer;

/**
 * 轻量的发布/订阅。消息只是唤醒信号，丢失后可以从 transcript 补读。
 */
public interface RunSignalBus {

    void publish(String channel, String message);

    /**
     * 订阅若干频道，回调在总线自己的线程上执行，实现方不得阻塞。
     */
    RunSubscription subscribe(Collection<String> channels, Consumer<String> listener);
}
