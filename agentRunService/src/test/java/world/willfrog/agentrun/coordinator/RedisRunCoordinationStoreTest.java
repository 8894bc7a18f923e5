package world.willfrog.agentrun.coordinator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisRunCoordinationStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;
    @Mock
    private ListOperations<String, String> listOperations;

    private RedisRunCoordinationStore store;

    @BeforeEach
    void setUp() {
        store = new RedisRunCoordinationStore(redisTemplate);
    }

    @Test
    void tryAcquireLock_shouldUseSetIfAbsentWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent("agent_run_lock:run-1", "inst-a", Duration.ofHours(24))).thenReturn(true, false);

        assertTrue(store.tryAcquireLock("run-1", "inst-a", Duration.ofHours(24)));
        assertFalse(store.tryAcquireLock("run-1", "inst-a", Duration.ofHours(24)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void releaseLock_shouldCompareOwnerInScript() {
        when(redisTemplate.execute(any(RedisScript.class), eq(List.of("agent_run_lock:run-1")), eq("inst-a"))).thenReturn(1L);
        when(redisTemplate.execute(any(RedisScript.class), eq(List.of("agent_run_lock:run-1")), eq("inst-b"))).thenReturn(0L);

        assertTrue(store.releaseLock("run-1", "inst-a"));
        assertFalse(store.releaseLock("run-1", "inst-b"));
    }

    @Test
    void activeInstances_shouldParseLivenessKeys() {
        when(redisTemplate.keys("active_run:*:run-1")).thenReturn(Set.of("active_run:inst-a:run-1", "bogus:run-1"));

        assertEquals(Set.of("inst-a"), store.activeInstances("run-1"));
    }

    @Test
    void appendAndRead_shouldUseTranscriptList() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.rightPush("agent_run:run-1:responses", "{}")).thenReturn(3L);
        when(listOperations.range("agent_run:run-1:responses", 1L, -1L)).thenReturn(List.of("{}", "{}"));

        assertEquals(3L, store.appendEvent("run-1", "{}"));
        assertEquals(2, store.readEvents("run-1", 1L).size());
    }

    @Test
    void appendEvent_whenRedisReturnsNothing_shouldThrow() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.rightPush("agent_run:run-1:responses", "{}")).thenReturn(null);

        assertThrows(DurableWriteException.class, () -> store.appendEvent("run-1", "{}"));
    }

    @Test
    void markAliveAndExpire_shouldSetTtls() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        store.markAlive("inst-a", "run-1", Duration.ofMinutes(5));
        store.expireTranscript("run-1", Duration.ofHours(24));

        verify(valueOperations).set("active_run:inst-a:run-1", "running", Duration.ofMinutes(5));
        verify(redisTemplate).expire("agent_run:run-1:responses", Duration.ofHours(24));
    }
}
