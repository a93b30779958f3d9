package com.sched;

import com.sched.adapter.source.InMemoryTaskSource;
import com.sched.config.SchedConfig;
import com.sched.config.SchedulerConfig;
import com.sched.core.DispatchLoop;
import com.sched.model.QueuedTask;
import com.sched.plugin.CustomScheduler;
import com.sched.plugin.PluginRegistry;
import com.sched.plugin.SchedulingStrategy;
import com.sched.plugin.gthulhu.GthulhuPlugin;
import com.sched.spring.EnableScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Example Spring Boot application running the configured scheduler against an in-memory task source.
 */
@SpringBootApplication
@EnableScheduler
public class SchedulerApplication {

    private static final Logger log = LoggerFactory.getLogger(SchedulerApplication.class);

    private static final int DEMO_TASKS = 16;

    public static void main(String[] args) {
        SpringApplication.run(SchedulerApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(CustomScheduler scheduler, PluginRegistry registry, SchedConfig config) {
        return args -> {
            log.info("=== Scheduler Demo Started ===");
            log.info("Registered modes: {}", registry.listRegistered());
            log.info("Active mode: {}", config.mode());

            // Simulated runnable tasks: varying weights and vtimes, 4 CPUs
            InMemoryTaskSource source = new InMemoryTaskSource();
            for (int i = 1; i <= DEMO_TASKS; i++) {
                long weight = i % 3 == 0 ? 200 : 100;
                long vtime = (DEMO_TASKS - i) * 1000L;
                source.submit(new QueuedTask(1000 + i, i % 4, 4, 0, 0, 0, 0, weight, vtime, 1000 + i));
            }

            if (scheduler instanceof GthulhuPlugin gthulhu) {
                // Pin the last task to the front with a 1ms slice
                gthulhu.updateStrategyMap(List.of(new SchedulingStrategy(true, 1_000_000L, 1000 + DEMO_TASKS)));
            }

            long defaultSlice = config.scheduler().sliceNsDefault() > 0
                    ? config.scheduler().sliceNsDefault()
                    : SchedulerConfig.DEFAULT_SLICE_NS;
            DispatchLoop loop = new DispatchLoop(scheduler, source, defaultSlice);
            List<DispatchLoop.Dispatch> dispatched = loop.run(DEMO_TASKS);

            for (DispatchLoop.Dispatch dispatch : dispatched) {
                log.info("{}", dispatch);
            }
            log.info("=== Dispatched {} tasks, {} failed, {} left in pool ===",
                    dispatched.size(), loop.getFailedCount(), scheduler.getPoolCount());
        };
    }
}
