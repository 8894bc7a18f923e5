package world.willfrog.agentrun.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.agentrun.config.AgentRuntimeProperties;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

@Component
@RequiredArgsConstructor
public class AgentPromptService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;

    private final AgentRuntimeProperties runtimeProperties;

    public String agentRunSystemPrompt() {
        String base = runtimeProperties.getPrompt().getSystemPrompt();
        String prompt = base == null ? "" : base.trim();
        return prompt + "\n\nCurrent date: " + LocalDate.now().format(DATE_FORMATTER);
    }
}
