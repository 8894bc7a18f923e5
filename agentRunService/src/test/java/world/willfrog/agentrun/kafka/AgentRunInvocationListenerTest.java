package world.willfrog.agentrun.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;
import world.willfrog.agentrun.coordinator.AgentRunCoordinator;
import world.willfrog.agentrun.coordinator.RunOutcome;
import world.willfrog.agentrun.model.AgentRunStatus;
import world.willfrog.agentrun.model.RunInvocation;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentRunInvocationListenerTest {

    private static final Duration REDELIVERY_DELAY = Duration.ofSeconds(5);

    @Mock
    private AgentRunCoordinator coordinator;
    @Mock
    private ExecutorService executor;
    @Mock
    private Acknowledgment acknowledgment;

    @Test
    void listenRunInvocation_shouldDispatchToCoordinatorAndAck() {
        doAnswer(invocation -> {
            ((Runnable) invocation.getArgument(0)).run();
            return null;
        }).when(executor).execute(any(Runnable.class));
        when(coordinator.execute(any(RunInvocation.class)))
                .thenReturn(RunOutcome.executed("run-1", AgentRunStatus.COMPLETED, 3));
        AgentRunInvocationListener listener = new AgentRunInvocationListener(coordinator, new ObjectMapper(), executor, REDELIVERY_DELAY);

        listener.listenRunInvocation(
                "{\"run_id\":\"run-1\",\"thread_id\":\"thread-1\",\"model_name\":\"gpt-4o\",\"extra\":1}",
                acknowledgment);

        ArgumentCaptor<RunInvocation> captor = ArgumentCaptor.forClass(RunInvocation.class);
        verify(coordinator).execute(captor.capture());
        assertEquals("thread-1", captor.getValue().getThreadId());
        assertEquals("gpt-4o", captor.getValue().getModelName());
        verify(acknowledgment).acknowledge();
    }

    @Test
    void listenRunInvocation_whenMalformed_shouldAckWithoutDispatch() {
        AgentRunInvocationListener listener = new AgentRunInvocationListener(coordinator, new ObjectMapper(), executor, REDELIVERY_DELAY);

        listener.listenRunInvocation("{not json", acknowledgment);

        verifyNoInteractions(executor, coordinator);
        verify(acknowledgment).acknowledge();
    }

    @Test
    void listenRunInvocation_whenThreadIdMissing_shouldAckWithoutDispatch() {
        AgentRunInvocationListener listener = new AgentRunInvocationListener(coordinator, new ObjectMapper(), executor, REDELIVERY_DELAY);

        listener.listenRunInvocation("{\"run_id\":\"run-1\"}", acknowledgment);

        verifyNoInteractions(executor, coordinator);
        verify(acknowledgment).acknowledge();
    }

    @Test
    void listenRunInvocation_whenExecutorRejects_shouldNackForRedeliveryWithoutRunningInline() {
        doThrow(new RejectedExecutionException("full")).when(executor).execute(any(Runnable.class));
        AgentRunInvocationListener listener = new AgentRunInvocationListener(coordinator, new ObjectMapper(), executor, REDELIVERY_DELAY);

        listener.listenRunInvocation("{\"run_id\":\"run-1\",\"thread_id\":\"thread-1\"}", acknowledgment);

        verifyNoInteractions(coordinator);
        verify(acknowledgment).nack(REDELIVERY_DELAY);
        verify(acknowledgment, never()).acknowledge();
    }

    @Test
    void listenRunInvocation_whenCoordinatorThrows_shouldNotPropagate() {
        doAnswer(invocation -> {
            ((Runnable) invocation.getArgument(0)).run();
            return null;
        }).when(executor).execute(any(Runnable.class));
        when(coordinator.execute(any(RunInvocation.class))).thenThrow(new IllegalStateException("redis down"));
        AgentRunInvocationListener listener = new AgentRunInvocationListener(coordinator, new ObjectMapper(), executor, REDELIVERY_DELAY);

        listener.listenRunInvocation("{\"run_id\":\"run-1\",\"thread_id\":\"thread-1\"}", acknowledgment);

        verify(acknowledgment).acknowledge();
    }
}
