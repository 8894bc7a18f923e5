package world.willfrog.agentrun.coordinator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RunKeysTest {

    @Test
    void keys_shouldFollowSharedNaming() {
        assertEquals("agent_run_lock:r1", RunKeys.lock("r1"));
        assertEquals("active_run:i1:r1", RunKeys.liveness("i1", "r1"));
        assertEquals("agent_run:r1:responses", RunKeys.transcript("r1"));
        assertEquals("agent_run:r1:new_response", RunKeys.newResponseChannel("r1"));
        assertEquals("agent_run:r1:control:i1", RunKeys.instanceControlChannel("r1", "i1"));
        assertEquals("agent_run:r1:control", RunKeys.globalControlChannel("r1"));
    }

    @Test
    void instanceOf_shouldExtractInstanceFromLivenessKey() {
        assertEquals("i1", RunKeys.instanceOf("active_run:i1:r1", "r1"));
        assertNull(RunKeys.instanceOf("active_run::r1", "r1"));
        assertNull(RunKeys.instanceOf("active_run:i1:r2", "r1"));
    }
}
