package world.willfrog.agentrun.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 任务队列投递给 worker 的一次 run 调用。
 * <p>
 * 重复投递是正常情况：协调器依靠分布式锁和状态机把重复调用变成空操作。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunInvocation {

    @JsonProperty("run_id")
    private String runId;

    @JsonProperty("thread_id")
    private String threadId;

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("model_name")
    private String modelName;

    @JsonProperty("endpoint_name")
    private String endpointName;

    @JsonProperty("stream")
    private Boolean stream;

    /** 为空时使用配置中的默认自动续写次数。 */
    @JsonProperty("max_auto_continues")
    private Integer maxAutoContinues;

    @JsonProperty("enable_context_manager")
    private Boolean enableContextManager;

    @JsonProperty("request_id")
    private String requestId;
}
