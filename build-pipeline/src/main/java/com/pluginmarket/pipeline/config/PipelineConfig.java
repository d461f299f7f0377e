package com.pluginmarket.pipeline.config;

import com.pluginmarket.pipeline.ingress.RateLimiter;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    public static final String TASK_EXECUTOR = "pipelineTaskExecutor";
    public static final String PUBLIC_RATE_LIMITER = "publicRateLimiter";
    public static final String API_RATE_LIMITER = "apiRateLimiter";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, PluginBuildsProperties properties) {
        return builder
                .setConnectTimeout(properties.getBuilder().getConnectTimeout())
                .setReadTimeout(properties.getBuilder().getReadTimeout())
                .build();
    }

    /**
     * Worker pool for fire-and-forget work (build dispatch, download tracking).
     * Nothing on the request path waits on it.
     */
    @Bean(name = TASK_EXECUTOR)
    public ThreadPoolTaskExecutor pipelineTaskExecutor(PluginBuildsProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getTasks().getPoolSize());
        executor.setMaxPoolSize(properties.getTasks().getPoolSize());
        executor.setQueueCapacity(properties.getTasks().getQueueCapacity());
        executor.setThreadNamePrefix("pipeline-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean(name = PUBLIC_RATE_LIMITER)
    public RateLimiter publicRateLimiter(PluginBuildsProperties properties, Clock clock) {
        PluginBuildsProperties.RateLimit rateLimit = properties.getRateLimit();
        return new RateLimiter("public", rateLimit.getPublicLimit(), rateLimit.getWindow(), clock);
    }

    @Bean(name = API_RATE_LIMITER)
    public RateLimiter apiRateLimiter(PluginBuildsProperties properties, Clock clock) {
        PluginBuildsProperties.RateLimit rateLimit = properties.getRateLimit();
        return new RateLimiter("api", rateLimit.getApiLimit(), rateLimit.getWindow(), clock);
    }
}
