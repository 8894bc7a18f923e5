package world.willfrog.agentrun.turn;

import world.willfrog.agentrun.model.AgentMessage;
import world.willfrog.agentrun.service.ModelFamilyCatalog;

import java.util.Optional;

public interface EphemeralMessageProvider {

    Optional<AgentMessage> build(String threadId, ModelFamilyCatalog.FamilyProfile profile);
}
