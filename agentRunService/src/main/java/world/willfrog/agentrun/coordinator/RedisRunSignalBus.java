package world.willfrog.agentrun.coordinator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

@Component
@RequiredArgsConstructor
@Slf4j
public class RedisRunSignalBus implements RunSignalBus {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;

    @Override
    public void publish(String channel, String message) {
        redisTemplate.convertAndSend(channel, message);
    }

    @Override
    public RunSubscription subscribe(Collection<String> channels, Consumer<String> listener) {
        List<Topic> topics = new ArrayList<>(channels.size());
        for (String channel : channels) {
            topics.add(new ChannelTopic(channel));
        }
        MessageListener messageListener = (message, pattern) -> {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            try {
                listener.accept(body);
            } catch (RuntimeException e) {
                log.warn("Signal listener failed: channel={}", new String(message.getChannel(), StandardCharsets.UTF_8), e);
            }
        };
        listenerContainer.addMessageListener(messageListener, topics);
        log.debug("Subscribed to {}", channels);
        return () -> listenerContainer.removeMessageListener(messageListener);
    }
}
