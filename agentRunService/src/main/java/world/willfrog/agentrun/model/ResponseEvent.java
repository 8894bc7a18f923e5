package world.willfrog.agentrun.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 一次 run 中产出的事件。写入持久化 transcript 时以 {@code type} 字段区分子类型。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ResponseEvent.Content.class, name = "content"),
        @JsonSubTypes.Type(value = ResponseEvent.ToolCall.class, name = "tool_call"),
        @JsonSubTypes.Type(value = ResponseEvent.ToolResult.class, name = "tool_result"),
        @JsonSubTypes.Type(value = ResponseEvent.Status.class, name = "status"),
        @JsonSubTypes.Type(value = ResponseEvent.Finish.class, name = "finish")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public interface ResponseEvent {

    record Content(String content) implements ResponseEvent {
    }

    record ToolCall(String toolCallId, String toolName, String arguments) implements ResponseEvent {
    }

    record ToolResult(String toolCallId,
                      String toolName,
                      String result,
                      boolean success,
                      boolean terminating) implements ResponseEvent {
    }

    /**
     * 状态事件。completed / failed / stopped / error 为终态，会结束 run。
     */
    record Status(String status, String message, String code) implements ResponseEvent {

        public static final String COMPLETED = "completed";
        public static final String FAILED = "failed";
        public static final String STOPPED = "stopped";
        public static final String ERROR = "error";

        public static Status completed(String message) {
            return new Status(COMPLETED, message, null);
        }

        public static Status stopped(String message) {
            return new Status(STOPPED, message, null);
        }

        public static Status error(String message) {
            return new Status(ERROR, message, null);
        }

        public static Status error(String message, String code) {
            return new Status(ERROR, message, code);
        }

        @JsonIgnore
        public boolean isTerminal() {
            return COMPLETED.equals(status) || FAILED.equals(status)
                    || STOPPED.equals(status) || ERROR.equals(status);
        }

        @JsonIgnore
        public boolean isError() {
            return ERROR.equals(status) || FAILED.equals(status);
        }
    }

    record Finish(FinishReason finishReason) implements ResponseEvent {
    }
}
