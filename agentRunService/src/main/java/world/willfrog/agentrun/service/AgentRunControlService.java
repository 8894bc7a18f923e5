package world.willfrog.agentrun.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.coordinator.RunCoordinationStore;
import world.willfrog.agentrun.coordinator.RunKeys;
import world.willfrog.agentrun.coordinator.RunSignalBus;
import world.willfrog.agentrun.model.ControlSignal;

import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRunControlService {

    private final RunCoordinationStore coordinationStore;
    private final RunSignalBus signalBus;

    /**
     * 请求停止 run：向全局控制频道以及每个存活实例的专属频道发送 STOP。
     *
     * @return 收到专属通知的实例数
     */
    public int requestStop(String runId) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId is blank");
        }
        signalBus.publish(RunKeys.globalControlChannel(runId), ControlSignal.STOP.name());
        Set<String> instances = coordinationStore.activeInstances(runId);
        for (String instanceId : instances) {
            signalBus.publish(RunKeys.instanceControlChannel(runId, instanceId), ControlSignal.STOP.name());
        }
        log.info("Stop requested for run {}, active instances={}", runId, instances);
        return instances.size();
    }
}
