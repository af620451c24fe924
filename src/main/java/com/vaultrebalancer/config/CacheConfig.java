package com.vaultrebalancer.config;

import com.vaultrebalancer.cache.CaffeineTtlCache;
import com.vaultrebalancer.cache.TtlCache;
import com.vaultrebalancer.domain.model.RecommendationSet;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    @Bean
    public TtlCache<String, RecommendationSet> recommendationCache(RecommenderConfig recommenderConfig, Clock clock) {
        return new CaffeineTtlCache<>(recommenderConfig.getCacheTtl(), 16, clock);
    }
}
