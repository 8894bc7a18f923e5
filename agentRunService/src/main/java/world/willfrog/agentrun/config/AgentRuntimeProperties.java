package world.willfrog.agentrun.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Agent run 运行期配置属性
 *
 * 覆盖上下文压缩、单轮编排和跨实例协调三部分的数值参数。
 *
 * @see world.willfrog.agentrun.service.AgentContextCompressor
 * @see world.willfrog.agentrun.turn.AgentTurnOrchestrator
 * @see world.willfrog.agentrun.coordinator.AgentRunCoordinator
 */
@Data
@ConfigurationProperties(prefix = "agent.runtime")
public class AgentRuntimeProperties {

    private Context context = new Context();

    private Turn turn = new Turn();

    private Coordinator coordinator = new Coordinator();

    private Prompt prompt = new Prompt();

    @Data
    public static class Context {
        /**
         * 是否启用角色压缩/省略；关闭时仍会剥离工具参数
         */
        private boolean enabled = true;

        /**
         * 单条消息压缩阈值初值（token），每轮减半
         */
        private int initialMessageThreshold = 4096;

        /**
         * 阈值减半的最大轮数
         */
        private int maxRounds = 5;

        /**
         * 最新消息安全截断的字符上限
         */
        private int safeTruncateMaxChars = 100_000;

        /**
         * 省略阶段每批移除的消息数
         */
        private int omissionBatchSize = 10;

        /**
         * 省略阶段至少保留的非 system 消息数
         */
        private int minMessagesToKeep = 10;

        /**
         * 省略阶段的最大批次数
         */
        private int omissionSafetyLimit = 500;

        /**
         * middle-out 后的最大消息条数
         */
        private int maxMessages = 320;

        /**
         * 每条消息固定附加的 token 开销（role、分隔符等）
         */
        private int perMessageOverheadTokens = 4;
    }

    @Data
    public static class Turn {
        /**
         * 单轮最大自动续写次数，0 表示关闭自动续写
         */
        private int maxAutoContinues = 25;

        /**
         * 供应商过载时切换路由重试的上限
         */
        private int maxOverloadRetries = 3;

        /**
         * 过载后切换到的 endpoint 名
         */
        private String overloadFallbackEndpoint = "openrouter";

        /**
         * 单次模型回复最多执行的工具调用数，0 表示不限制
         */
        private int maxToolCallsPerTurn = 0;

        /**
         * run 内最多执行的 turn 数
         */
        private int maxIterations = 100;

        /**
         * 读取线程历史的分页大小
         */
        private int historyBatchSize = 1000;

        private double temperature = 0.0D;

        private boolean stream = true;

        /**
         * 产出结果后即结束 run 的工具名
         */
        private List<String> terminatingTools = new ArrayList<>(List.of("ask", "complete"));
    }

    @Data
    public static class Coordinator {
        /**
         * 当前 worker 实例 ID，未配置时启动时随机生成
         */
        private String instanceId = UUID.randomUUID().toString().replace("-", "").substring(0, 8);

        private Duration lockTtl = Duration.ofHours(24);

        private Duration livenessTtl = Duration.ofHours(24);

        /**
         * 控制信号轮询间隔
         */
        private Duration pollInterval = Duration.ofMillis(100);

        /**
         * 每隔多少次轮询刷新一次存活 key
         */
        private int livenessRefreshTicks = 50;

        /**
         * run 结束后 transcript 的保留时长
         */
        private Duration transcriptRetention = Duration.ofHours(24);

        /**
         * 清理阶段等待未完成写入的最长时间
         */
        private Duration writerAwaitTimeout = Duration.ofSeconds(30);

        private int statusRetryAttempts = 3;

        private int appendRetryAttempts = 3;
    }

    @Data
    public static class Prompt {
        private String systemPrompt = "You are a helpful autonomous agent. Use the provided tools to finish the task.";
    }
}
