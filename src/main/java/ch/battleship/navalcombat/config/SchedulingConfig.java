package ch.battleship.navalcombat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for task scheduling.
 *
 * <p>Provides the {@link TaskScheduler} used by {@code AiTurnScheduler} to defer AI moves
 * after a human action, so clients can show feedback before the next shot arrives.
 */
@Configuration
public class SchedulingConfig {

    /**
     * Creates a task scheduler with a small thread pool.
     *
     * <p>Configuration:
     * <ul>
     *   <li>Pool size: 4 threads</li>
     *   <li>Thread name prefix: "naval-scheduler-" for easier debugging</li>
     * </ul>
     *
     * @return configured task scheduler
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("naval-scheduler-");
        scheduler.initialize();
        return scheduler;
    }
}
