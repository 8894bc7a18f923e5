package world.willfrog.agentrun;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("world.willfrog.agentrun.config")
@MapperScan("world.willfrog.agentrun.mapper")
public class AgentRunApplication {
    public static void main(String[] args) {
        SpringApplication.run(AgentRunApplication.class, args);
    }
}
