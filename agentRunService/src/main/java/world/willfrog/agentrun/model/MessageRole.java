package world.willfrog.agentrun.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageRole {
    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant"),
    TOOL("tool");

    private final String code;

    MessageRole(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static MessageRole fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("message role is blank");
        }
        for (MessageRole role : values()) {
            if (role.code.equalsIgnoreCase(code.trim())) {
                return role;
            }
        }
        throw new IllegalArgumentException("unknown message role: " + code);
    }
}
