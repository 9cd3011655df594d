package com.perfwatch.analytics.config;

import com.perfwatch.analytics.predict.ModelRegistry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalyticsEngineConfiguration {

    @Bean
    public Clock analyticsClock() {
        return Clock.systemUTC();
    }

    /**
     * Worker pool for independent per-metric analysis and model training.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor() {
        int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "analysis-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    @Bean
    public ModelRegistry modelRegistry(AnalyticsProperties properties, Clock analyticsClock) {
        return new ModelRegistry(properties.modelCacheTtl(), properties.retrainGrowthRatio(), analyticsClock);
    }
}
