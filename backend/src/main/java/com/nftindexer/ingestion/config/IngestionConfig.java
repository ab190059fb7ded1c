package com.nftindexer.ingestion.config;

import com.nftindexer.ingestion.attribution.AttributionResolver;
import com.nftindexer.ingestion.attribution.NoAttributionResolver;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Ingestion wiring: normalization properties, the attribution fallback and two named thread pools.
 * resolver-executor runs bounded attribution/price calls; normalization-executor runs independent
 * transactions of a batch in parallel.
 */
@Configuration
@EnableConfigurationProperties(NormalizationProperties.class)
public class IngestionConfig {

    public static final String RESOLVER_EXECUTOR = "resolver-executor";
    public static final String NORMALIZATION_EXECUTOR = "normalization-executor";

    @Bean
    @ConditionalOnMissingBean(AttributionResolver.class)
    public AttributionResolver noAttributionResolver() {
        return new NoAttributionResolver();
    }

    /** Sized for one price and one attribution call in flight per normalization thread. */
    @Bean(name = RESOLVER_EXECUTOR)
    public Executor resolverExecutor(NormalizationProperties properties) {
        int threads = Math.max(2, properties.getParallelism() * 2);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix("resolver-");
        e.initialize();
        return e;
    }

    @Bean(name = NORMALIZATION_EXECUTOR)
    public Executor normalizationExecutor(NormalizationProperties properties) {
        int threads = Math.max(1, properties.getParallelism());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix("normalize-");
        e.initialize();
        return e;
    }
}
