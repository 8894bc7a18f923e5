package world.willfrog.agentrun.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.agentrun.coordinator.RunCoordinationStore;
import world.willfrog.agentrun.coordinator.RunSignalBus;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentRunControlServiceTest {

    @Mock
    private RunCoordinationStore coordinationStore;
    @Mock
    private RunSignalBus signalBus;

    @InjectMocks
    private AgentRunControlService service;

    @Test
    void requestStop_shouldNotifyGlobalAndEveryActiveInstance() {
        when(coordinationStore.activeInstances("run-1")).thenReturn(new LinkedHashSet<>(List.of("inst-a", "inst-b")));

        int notified = service.requestStop("run-1");

        assertEquals(2, notified);
        verify(signalBus).publish("agent_run:run-1:control", "STOP");
        verify(signalBus).publish("agent_run:run-1:control:inst-a", "STOP");
        verify(signalBus).publish("agent_run:run-1:control:inst-b", "STOP");
    }

    @Test
    void requestStop_whenNoActiveInstance_shouldStillPublishGlobal() {
        when(coordinationStore.activeInstances("run-1")).thenReturn(Set.of());

        assertEquals(0, service.requestStop("run-1"));
        verify(signalBus).publish("agent_run:run-1:control", "STOP");
    }

    @Test
    void requestStop_whenRunIdBlank_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> service.requestStop(" "));
        verifyNoInteractions(signalBus, coordinationStore);
    }
}
