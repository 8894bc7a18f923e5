package world.willfrog.agentrun.llm;

/**
 * 供应商的暂时性错误。OVERLOADED 会触发编排层切换路由重试，RATE_LIMITED 直接结束当前 turn。
 */
public class TransientProviderException extends RuntimeException {

    public enum Kind {
        OVERLOADED,
        RATE_LIMITED
    }

    private final Kind kind;

    public TransientProviderException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public TransientProviderException(Kind kind, String message) {
        this(kind, message, null);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isOverloaded() {
        return kind == Kind.OVERLOADED;
    }
}
