package com.classsched.classsched_api.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.classsched.classsched_api.solver.TimetableSolver;
import com.classsched.classsched_api.solver.domain.SlotDomain;

@Configuration
public class SolverConfig {

    private static final Logger logger = LoggerFactory.getLogger(SolverConfig.class);

    @Bean
    public SlotDomain slotDomain() {
        SlotDomain domain = SlotDomain.standard();
        logger.info("Slot domain: {} weekdays x {} periods", domain.getWeekdays().size(), SlotDomain.PERIODS_PER_DAY);
        return domain;
    }

    @Bean
    public TimetableSolver timetableSolver(SlotDomain slotDomain) {
        return new TimetableSolver(slotDomain);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService schedulingJobExecutor(SchedulerProperties properties) {
        int threads = Math.max(1, properties.getJobThreads());
        AtomicInteger ids = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "scheduling-job-" + ids.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
