package world.willfrog.agentrun.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class RunExecutorConfig {

    /**
     * 执行 run 的线程池。队列满时直接拒绝，run 不会落到 Kafka 消费线程上执行。
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentRunExecutor(@Value("${agent.runtime.coordinator.run-threads:8}") int runThreads,
                                            @Value("${agent.runtime.coordinator.run-queue-capacity:100}") int queueCapacity) {
        int threads = Math.max(1, runThreads);
        return new ThreadPoolExecutor(
                threads,
                threads,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, queueCapacity)),
                namedFactory("agent-run-", false),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService runControlScheduler(@Value("${agent.runtime.coordinator.poller-threads:2}") int pollerThreads) {
        return Executors.newScheduledThreadPool(Math.max(1, pollerThreads), namedFactory("run-control-poller-", true));
    }

    private static ThreadFactory namedFactory(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
