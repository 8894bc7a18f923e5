package world.willfrog.agentrun.coordinator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
@RequiredArgsConstructor
@Slf4j
public class RedisRunCoordinationStore implements RunCoordinationStore {

    // 比较持有者后再删除，避免误删其他实例重新获取的锁
    private static final DefaultRedisScript<Long> RELEASE_LOCK_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    @Override
    public boolean tryAcquireLock(String runId, String owner, Duration ttl) {
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(RunKeys.lock(runId), owner, ttl);
        return Boolean.TRUE.equals(acquired);
    }

    @Override
    public String lockOwner(String runId) {
        return redisTemplate.opsForValue().get(RunKeys.lock(runId));
    }

    @Override
    public boolean releaseLock(String runId, String owner) {
        Long deleted = redisTemplate.execute(RELEASE_LOCK_SCRIPT, Collections.singletonList(RunKeys.lock(runId)), owner);
        if (deleted == null || deleted == 0L) {
            log.warn("Lock not released, owner mismatch or already expired: runId={}, owner={}", runId, owner);
            return false;
        }
        return true;
    }

    @Override
    public void markAlive(String instanceId, String runId, Duration ttl) {
        redisTemplate.opsForValue().set(RunKeys.liveness(instanceId, runId), "running", ttl);
    }

    @Override
    public void clearAlive(String instanceId, String runId) {
        redisTemplate.delete(RunKeys.liveness(instanceId, runId));
    }

    @Override
    public Set<String> activeInstances(String runId) {
        Set<String> keys = redisTemplate.keys(RunKeys.livenessPattern(runId));
        if (keys == null || keys.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> instances = new LinkedHashSet<>();
        for (String key : keys) {
            String instanceId = RunKeys.instanceOf(key, runId);
            if (instanceId != null) {
                instances.add(instanceId);
            }
        }
        return instances;
    }

    @Override
    public long appendEvent(String runId, String eventJson) {
        Long size = redisTemplate.opsForList().rightPush(RunKeys.transcript(runId), eventJson);
        if (size == null) {
            throw new DurableWriteException("RPUSH returned no result for run " + runId);
        }
        return size;
    }

    @Override
    public List<String> readEvents(String runId, long fromIndex) {
        List<String> events = redisTemplate.opsForList().range(RunKeys.transcript(runId), Math.max(0L, fromIndex), -1);
        return events == null ? Collections.emptyList() : events;
    }

    @Override
    public void expireTranscript(String runId, Duration retention) {
        redisTemplate.expire(RunKeys.transcript(runId), retention);
    }
}
