package com.di.tablenova.config;

import com.di.tablenova.util.MdcPropagation;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. Every pool copies the submitting thread's MDC into its workers.
 * <ul>
 *   <li>{@link #JOB_EXECUTOR}: runs background batch and workflow jobs (one thread per running job).</li>
 *   <li>{@link #ANALYSIS_EXECUTOR}: runs per-table analyses; concurrency is further bounded per batch.</li>
 *   <li>{@link #PROVIDER_EXECUTOR}: runs provider calls so they can be interrupted on timeout;
 *   bounded, a full pool rejects further calls.</li>
 * </ul>
 */
@Configuration
public class AsyncConfig {

    public static final String JOB_EXECUTOR = "job-executor";
    public static final String ANALYSIS_EXECUTOR = "analysis-executor";
    public static final String PROVIDER_EXECUTOR = "provider-executor";

    @Bean(name = JOB_EXECUTOR)
    public Executor jobExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(50);
        e.setThreadNamePrefix("job-");
        e.setTaskDecorator(MdcPropagation::wrapRunnable);
        e.initialize();
        return e;
    }

    @Bean(name = ANALYSIS_EXECUTOR)
    public Executor analysisExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setThreadNamePrefix("analysis-");
        e.setTaskDecorator(MdcPropagation::wrapRunnable);
        e.initialize();
        return e;
    }

    @Bean(name = PROVIDER_EXECUTOR)
    public ThreadPoolTaskExecutor providerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(16);
        e.setThreadNamePrefix("provider-");
        e.setTaskDecorator(MdcPropagation::wrapRunnable);
        e.initialize();
        return e;
    }
}
