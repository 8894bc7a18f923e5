package world.willfrog.agentrun.model;

/**
 * 控制频道上的信号。只做唤醒用途，不携带任何数据。
 */
public enum ControlSignal {
    STOP,
    END_STREAM,
    ERROR;

    public static ControlSignal parse(String token) {
        if (token == null) {
            return null;
        }
        for (ControlSignal signal : values()) {
            if (signal.name().equals(token.trim())) {
                return signal;
            }
        }
        return null;
    }
}
