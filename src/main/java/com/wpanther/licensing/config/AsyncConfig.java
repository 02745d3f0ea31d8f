package com.wpanther.licensing.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.security.SecureRandom;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors and randomness shared by the request pipeline and the services.
 */
@Configuration
public class AsyncConfig {

    @Value("${app.auth.core-pool-size:8}")
    private int corePoolSize;

    @Value("${app.auth.max-pool-size:32}")
    private int maxPoolSize;

    @Value("${app.auth.queue-capacity:200}")
    private int queueCapacity;

    @Value("${app.auth.thread-name-prefix:auth-lookup-}")
    private String threadNamePrefix;

    /**
     * Runs permission lookups alongside license validation during authentication
     *
     * @return configured executor for authentication lookups
     */
    @Bean(name = "authLookupExecutor")
    public ThreadPoolTaskExecutor authLookupExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);

        // A saturated pool runs the lookup on the request thread instead of rejecting it
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.initialize();
        return executor;
    }

    /**
     * Provides a SecureRandom bean for license IVs and verification tokens
     *
     * @return a new SecureRandom instance
     */
    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}
