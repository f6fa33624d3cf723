package com.blogsmith.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provides the worker pool collaborator calls run on, so each call can be timed out.
 * <p>
 * The pool grows on demand: concurrent runs never queue behind each other's calls.
 */
@Configuration
public class StageExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(StageExecutorConfig.class);

    @Bean(name = "stageWorkers", destroyMethod = "shutdownNow")
    public ExecutorService stageWorkers(BlogsmithProperties properties) {
        log.info("Stage worker pool: on demand, stage timeout {}", properties.getPipeline().getStageTimeout());
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "blogsmith-stage-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
