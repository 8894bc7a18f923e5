package world.willfrog.agentrun.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FinishReason {
    STOP("stop"),
    TOOL_CALLS("tool-calls"),
    TOOL_CALL_LIMIT_REACHED("tool-call-limit-reached");

    private final String code;

    FinishReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static FinishReason fromCode(String code) {
        for (FinishReason reason : values()) {
            if (reason.code.equals(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("unknown finish reason: " + code);
    }
}
