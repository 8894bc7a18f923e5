package world.willfrog.agentrun.coordinator;

/**
 * 持久化写入（transcript 追加或状态落库）在有限重试后仍失败。
 */
public class DurableWriteException extends RuntimeException {

    public DurableWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    public DurableWriteException(String message) {
        super(message);
    }
}
