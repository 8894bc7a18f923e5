package world.willfrog.agentrun.coordinator;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * 跨实例共享的 run 协调状态：锁、存活标记和 append-only transcript。
 */
public interface RunCoordinationStore {

    /**
     * 原子地获取锁，已被持有时返回 false。
     */
    boolean tryAcquireLock(String runId, String owner, Duration ttl);

    String lockOwner(String runId);

    /**
     * 只有持有者才能释放锁。
     *
     * @return 是否真正删除了锁
     */
    boolean releaseLock(String runId, String owner);

    void markAlive(String instanceId, String runId, Duration ttl);

    void clearAlive(String instanceId, String runId);

    /**
     * 当前正在执行该 run 的实例 ID。
     */
    Set<String> activeInstances(String runId);

    /**
     * 追加一条事件，返回追加后的长度。
     */
    long appendEvent(String runId, String eventJson);

    /**
     * 读取下标 fromIndex（含）之后的全部事件。
     */
    List<String> readEvents(String runId, long fromIndex);

    void expireTranscript(String runId, Duration retention);
}
