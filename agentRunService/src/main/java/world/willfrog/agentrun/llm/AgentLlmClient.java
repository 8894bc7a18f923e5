package world.willfrog.agentrun.llm;

public interface AgentLlmClient {

    /**
     * 发起一次模型调用。
     *
     * @throws TransientProviderException 供应商过载或限流
     */
    LlmResponse call(LlmRequest request);
}
