package com.europeanalysis.stats.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

/**
 * Upstream HTTP client and the worker pool ingestion runs execute on.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, StatsCrawlerProperties properties) {
        StatsCrawlerProperties.Api api = properties.getApi();
        return builder
                .setConnectTimeout(api.getConnectTimeout())
                .setReadTimeout(api.getReadTimeout())
                .defaultHeader(HttpHeaders.USER_AGENT, api.getUserAgent())
                .build();
    }

    @Bean
    public ThreadPoolTaskExecutor ingestionExecutor(StatsCrawlerProperties properties) {
        int threads = properties.getIngestion().getWorkerThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }
}
