package world.willfrog.agentrun.turn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.agentrun.entity.AgentThreadMessage;
import world.willfrog.agentrun.model.AgentMessage;
import world.willfrog.agentrun.model.ContentBlock;
import world.willfrog.agentrun.model.MessageKind;
import world.willfrog.agentrun.model.MessageRole;
import world.willfrog.agentrun.service.AgentThreadMessageService;
import world.willfrog.agentrun.service.ModelFamilyCatalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 用线程里最新一条 browser_state 消息构造临时 user 消息。
 * <p>
 * 截图字段不进入文本；模型家族支持图片时再单独附一个 image_url 块。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BrowserStateEphemeralProvider implements EphemeralMessageProvider {

    static final String STATE_PREFIX = "The following is the current state of the browser:\n";
    static final String SCREENSHOT_BASE64 = "screenshot_base64";
    static final String SCREENSHOT_URL = "screenshot_url";

    private final AgentThreadMessageService messageService;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<AgentMessage> build(String threadId, ModelFamilyCatalog.FamilyProfile profile) {
        Optional<Map<String, Object>> latest = messageService.findLatestPayload(threadId, AgentThreadMessage.TYPE_BROWSER_STATE);
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> state = new LinkedHashMap<>(latest.get());
        Object screenshotBase64 = state.remove(SCREENSHOT_BASE64);
        Object screenshotUrl = state.remove(SCREENSHOT_URL);

        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(state);
        } catch (JsonProcessingException e) {
            log.warn("Failed to render browser state: threadId={}", threadId, e);
            return Optional.empty();
        }

        List<ContentBlock> blocks = new ArrayList<>();
        blocks.add(ContentBlock.text(STATE_PREFIX + json));
        if (profile != null && profile.supportsImages()) {
            String imageUrl = imageUrl(screenshotUrl, screenshotBase64);
            if (imageUrl != null) {
                blocks.add(ContentBlock.imageUrl(imageUrl));
            }
        }
        return Optional.of(AgentMessage.builder()
                .role(MessageRole.USER)
                .kind(MessageKind.STRUCTURED)
                .blocks(List.copyOf(blocks))
                .build());
    }

    private String imageUrl(Object screenshotUrl, Object screenshotBase64) {
        if (screenshotUrl instanceof String url && !url.isBlank()) {
            return url;
        }
        if (screenshotBase64 instanceof String base64 && !base64.isBlank()) {
            return "data:image/jpeg;base64," + base64;
        }
        return null;
    }
}
