package world.willfrog.agentrun.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import org.junit.jupiter.api.Test;
import world.willfrog.agentrun.model.AgentMessage;
import world.willfrog.agentrun.model.ContentBlock;
import world.willfrog.agentrun.model.MessageKind;
import world.willfrog.agentrun.model.MessageRole;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmMessageConverterTest {

    private final LlmMessageConverter converter = new LlmMessageConverter(new ObjectMapper());

    @Test
    void toChatMessages_shouldPairToolCallsWithResults() {
        List<ChatMessage> messages = converter.toChatMessages(List.of(
                AgentMessage.system("sys"),
                AgentMessage.user("u1", "find it"),
                assistantWithCalls("a1", "c1"),
                toolResult("t1", "c1", "found")
        ));

        assertEquals(4, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(UserMessage.class, messages.get(1));
        AiMessage ai = assertInstanceOf(AiMessage.class, messages.get(2));
        assertTrue(ai.hasToolExecutionRequests());
        assertEquals("c1", ai.toolExecutionRequests().get(0).id());
        ToolExecutionResultMessage result = assertInstanceOf(ToolExecutionResultMessage.class, messages.get(3));
        assertEquals("c1", result.id());
        assertEquals("found", result.text());
    }

    @Test
    void toChatMessages_whenCallOrResultOmitted_shouldDegradeGracefully() {
        List<ChatMessage> messages = converter.toChatMessages(List.of(
                assistantWithCalls("a1", "c-missing"),
                toolResult("t1", "c-orphan", "late result")
        ));

        AiMessage ai = assertInstanceOf(AiMessage.class, messages.get(0));
        assertFalse(ai.hasToolExecutionRequests());
        assertEquals("calling", ai.text());
        UserMessage user = assertInstanceOf(UserMessage.class, messages.get(1));
        assertTrue(user.singleText().contains("late result"));
    }

    @Test
    void renderText_shouldJoinTextBlocksAndSerializeOthers() {
        AgentMessage message = AgentMessage.builder()
                .role(MessageRole.USER)
                .kind(MessageKind.STRUCTURED)
                .blocks(List.of(ContentBlock.text("hello"), ContentBlock.imageUrl("https://img")))
                .build();

        assertEquals("hello\n{\"type\":\"image_url\",\"url\":\"https://img\"}", converter.renderText(message));
    }

    private AgentMessage assistantWithCalls(String id, String callId) {
        return AgentMessage.builder()
                .id(id)
                .role(MessageRole.ASSISTANT)
                .text("calling")
                .metadata(Map.of(LlmMessageConverter.META_TOOL_CALLS,
                        List.of(Map.of("id", callId, "name", "search", "arguments", "{}"))))
                .build();
    }

    private AgentMessage toolResult(String id, String callId, String text) {
        return AgentMessage.builder()
                .id(id)
                .role(MessageRole.TOOL)
                .text(text)
                .metadata(Map.of(
                        LlmMessageConverter.META_TOOL_CALL_ID, callId,
                        LlmMessageConverter.META_TOOL_NAME, "search"))
                .build();
    }
}
