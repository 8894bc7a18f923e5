package world.willfrog.agentrun.turn;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.agentrun.entity.AgentThreadMessage;
import world.willfrog.agentrun.model.AgentMessage;
import world.willfrog.agentrun.model.ContentBlock;
import world.willfrog.agentrun.model.MessageRole;
import world.willfrog.agentrun.model.ModelFamily;
import world.willfrog.agentrun.service.AgentThreadMessageService;
import world.willfrog.agentrun.service.ModelFamilyCatalog;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BrowserStateEphemeralProviderTest {

    private static final ModelFamilyCatalog.FamilyProfile WITH_IMAGES =
            new ModelFamilyCatalog.FamilyProfile(ModelFamily.GPT, 100_000, 4, 4_096, true);
    private static final ModelFamilyCatalog.FamilyProfile TEXT_ONLY =
            new ModelFamilyCatalog.FamilyProfile(ModelFamily.DEEPSEEK, 100_000, 4, 8_192, false);

    @Mock
    private AgentThreadMessageService messageService;

    private BrowserStateEphemeralProvider provider;

    @BeforeEach
    void setUp() {
        provider = new BrowserStateEphemeralProvider(messageService, new ObjectMapper());
    }

    @Test
    void build_whenNoBrowserState_shouldReturnEmpty() {
        when(messageService.findLatestPayload("t1", AgentThreadMessage.TYPE_BROWSER_STATE)).thenReturn(Optional.empty());

        assertTrue(provider.build("t1", WITH_IMAGES).isEmpty());
    }

    @Test
    void build_shouldStripScreenshotFromText() {
        when(messageService.findLatestPayload("t1", AgentThreadMessage.TYPE_BROWSER_STATE)).thenReturn(Optional.of(state()));

        AgentMessage message = provider.build("t1", TEXT_ONLY).orElseThrow();

        assertEquals(MessageRole.USER, message.getRole());
        assertEquals(1, message.getBlocks().size());
        String text = (String) message.getBlocks().get(0).field("text");
        assertTrue(text.startsWith(BrowserStateEphemeralProvider.STATE_PREFIX));
        assertTrue(text.contains("https://example.com"));
        assertFalse(text.contains("screenshot"));
    }

    @Test
    void build_whenFamilySupportsImages_shouldAttachScreenshot() {
        when(messageService.findLatestPayload("t1", AgentThreadMessage.TYPE_BROWSER_STATE)).thenReturn(Optional.of(state()));

        AgentMessage message = provider.build("t1", WITH_IMAGES).orElseThrow();

        assertEquals(2, message.getBlocks().size());
        ContentBlock image = message.getBlocks().get(1);
        assertTrue(image.isType(ContentBlock.TYPE_IMAGE_URL));
        assertEquals("data:image/jpeg;base64,QUJD", image.field("url"));
    }

    @Test
    void build_whenScreenshotUrlPresent_shouldPreferUrl() {
        Map<String, Object> state = state();
        state.put("screenshot_url", "https://cdn.example.com/shot.png");
        when(messageService.findLatestPayload("t1", AgentThreadMessage.TYPE_BROWSER_STATE)).thenReturn(Optional.of(state));

        AgentMessage message = provider.build("t1", WITH_IMAGES).orElseThrow();

        assertEquals("https://cdn.example.com/shot.png", message.getBlocks().get(1).field("url"));
    }

    private Map<String, Object> state() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("url", "https://example.com");
        state.put("title", "Example");
        state.put("screenshot_base64", "QUJD");
        return state;
    }
}
