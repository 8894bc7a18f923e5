package world.willfrog.agentrun.turn;

import lombok.Builder;
import lombok.Value;
import world.willfrog.agentrun.model.AgentMessage;

/**
 * 单个 turn 的调用参数。为 null 的数值项使用运行期配置的默认值。
 */
@Value
@Builder(toBuilder = true)
public class TurnOptions {
    String modelName;
    String endpointName;
    Double temperature;
    Integer maxTokens;
    Boolean stream;
    /** 0 表示关闭自动续写。 */
    Integer maxAutoContinues;
    Boolean enableContextManager;
    Integer maxToolCallsPerTurn;
    /** 仅在第一次子迭代注入、不落库的临时消息（如环境快照）。 */
    AgentMessage ephemeralMessage;
}
