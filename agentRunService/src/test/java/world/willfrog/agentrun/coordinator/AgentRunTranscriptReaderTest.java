package world.willfrog.agentrun.coordinator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import world.willfrog.agentrun.config.AgentRuntimeProperties;
import world.willfrog.agentrun.model.ControlSignal;
import world.willfrog.agentrun.model.ResponseEvent;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentRunTranscriptReaderTest {

    private static final String RUN_ID = "run-1";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryRunCoordinationStore store;
    private InMemoryRunSignalBus bus;
    private AgentRunTranscriptReader reader;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryRunCoordinationStore();
        bus = new InMemoryRunSignalBus();
        AgentRuntimeProperties properties = new AgentRuntimeProperties();
        properties.getCoordinator().setPollInterval(Duration.ofMillis(10));
        reader = new AgentRunTranscriptReader(store, bus, objectMapper, properties);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void follow_whenRunAlreadyFinished_shouldReplayWholeTranscript() throws Exception {
        append(new ResponseEvent.Content("a"));
        append(new ResponseEvent.Content("b"));
        append(ResponseEvent.Status.completed("Run completed"));
        List<ResponseEvent> received = new CopyOnWriteArrayList<>();

        long next = reader.follow(RUN_ID, 0, received::add, Duration.ofSeconds(5));

        assertEquals(3L, next);
        assertEquals(3, received.size());
        assertEquals(new ResponseEvent.Content("a"), received.get(0));
        assertInstanceOf(ResponseEvent.Status.class, received.get(2));
        assertEquals(0, bus.subscriberCount());
    }

    @Test
    void follow_fromIndex_shouldSkipEarlierEntries() throws Exception {
        append(new ResponseEvent.Content("a"));
        append(new ResponseEvent.Content("b"));
        append(ResponseEvent.Status.completed("Run completed"));
        List<ResponseEvent> received = new CopyOnWriteArrayList<>();

        long next = reader.follow(RUN_ID, 1, received::add, Duration.ofSeconds(5));

        assertEquals(3L, next);
        assertEquals(2, received.size());
        assertEquals(new ResponseEvent.Content("b"), received.get(0));
    }

    @Test
    void follow_whenNoTerminalEvent_shouldReturnAfterMaxWait() throws Exception {
        append(new ResponseEvent.Content("a"));
        List<ResponseEvent> received = new CopyOnWriteArrayList<>();

        long next = reader.follow(RUN_ID, 0, received::add, Duration.ofMillis(50));

        assertEquals(1L, next);
        assertEquals(1, received.size());
    }

    @Test
    void follow_whenUnreadableEntry_shouldSkipIt() throws Exception {
        store.appendEvent(RUN_ID, "not-json");
        append(ResponseEvent.Status.completed("Run completed"));
        List<ResponseEvent> received = new CopyOnWriteArrayList<>();

        long next = reader.follow(RUN_ID, 0, received::add, Duration.ofSeconds(5));

        assertEquals(2L, next);
        assertEquals(1, received.size());
    }

    @Test
    void follow_whenLive_shouldPickUpNewEventsUntilTerminal() throws Exception {
        List<ResponseEvent> received = new CopyOnWriteArrayList<>();
        Future<Long> following = executor.submit(() -> reader.follow(RUN_ID, 0, received::add, Duration.ofSeconds(10)));
        awaitSubscribed();

        append(new ResponseEvent.Content("live"));
        bus.publish(RunKeys.newResponseChannel(RUN_ID), RunKeys.NEW_RESPONSE_TOKEN);
        append(ResponseEvent.Status.stopped("Run stopped by user"));
        bus.publish(RunKeys.newResponseChannel(RUN_ID), RunKeys.NEW_RESPONSE_TOKEN);

        assertEquals(2L, following.get(5, TimeUnit.SECONDS));
        assertEquals(new ResponseEvent.Content("live"), received.get(0));
    }

    @Test
    void follow_whenControlSignal_shouldDrainAndStop() throws Exception {
        List<ResponseEvent> received = new CopyOnWriteArrayList<>();
        Future<Long> following = executor.submit(() -> reader.follow(RUN_ID, 0, received::add, Duration.ofSeconds(10)));
        awaitSubscribed();

        append(new ResponseEvent.Content("last"));
        bus.publish(RunKeys.globalControlChannel(RUN_ID), ControlSignal.END_STREAM.name());

        assertEquals(1L, following.get(5, TimeUnit.SECONDS));
        assertEquals(1, received.size());
    }

    private void append(ResponseEvent event) throws Exception {
        store.appendEvent(RUN_ID, objectMapper.writeValueAsString(event));
    }

    private void awaitSubscribed() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (bus.subscriberCount() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(bus.subscriberCount() >= 2);
    }
}
