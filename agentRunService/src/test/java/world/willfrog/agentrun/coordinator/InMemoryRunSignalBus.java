package world.willfrog.agentrun.coordinator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 测试用的同步总线：publish 在调用线程上直接投递给当前订阅者。
 */
class InMemoryRunSignalBus implements RunSignalBus {

    private final List<Map.Entry<String, Consumer<String>>> subscribers = new CopyOnWriteArrayList<>();
    private final List<Map.Entry<String, String>> published = new CopyOnWriteArrayList<>();

    @Override
    public void publish(String channel, String message) {
        published.add(Map.entry(channel, message));
        for (Map.Entry<String, Consumer<String>> subscriber : subscribers) {
            if (subscriber.getKey().equals(channel)) {
                subscriber.getValue().accept(message);
            }
        }
    }

    @Override
    public RunSubscription subscribe(Collection<String> channels, Consumer<String> listener) {
        List<Map.Entry<String, Consumer<String>>> entries = new ArrayList<>();
        for (String channel : channels) {
            entries.add(Map.entry(channel, listener));
        }
        subscribers.addAll(entries);
        return () -> subscribers.removeAll(entries);
    }

    List<String> messagesOn(String channel) {
        List<String> messages = new ArrayList<>();
        for (Map.Entry<String, String> entry : published) {
            if (entry.getKey().equals(channel)) {
                messages.add(entry.getValue());
            }
        }
        return messages;
    }

    int subscriberCount() {
        return subscribers.size();
    }
}
