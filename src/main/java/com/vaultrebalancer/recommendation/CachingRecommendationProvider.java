package com.vaultrebalancer.recommendation;

import com.vaultrebalancer.cache.TtlCache;
import com.vaultrebalancer.domain.model.RecommendationSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Caches the ranking for the configured TTL (default 30 minutes).
 *
 * <p>Ranking takes minutes, so plan previews reuse the cached set. Scheduled rounds pass
 * {@code refresh=true} and always rank afresh.
 */
@Component
@Primary
public class CachingRecommendationProvider implements RecommendationProvider {

    private static final Logger log = LoggerFactory.getLogger(CachingRecommendationProvider.class);

    static final String CACHE_KEY = "recommendations";

    private final RecommendationProvider delegate;
    private final TtlCache<String, RecommendationSet> recommendationCache;

    public CachingRecommendationProvider(
            @Qualifier("remoteRecommendationProvider") RecommendationProvider delegate,
            TtlCache<String, RecommendationSet> recommendationCache) {
        this.delegate = delegate;
        this.recommendationCache = recommendationCache;
    }

    @Override
    public RecommendationSet getRecommendations(boolean refresh) {
        return recommendationCache.get(CACHE_KEY, refresh, () -> {
            log.debug("Recommendation cache miss (refresh={})", refresh);
            return delegate.getRecommendations(refresh);
        });
    }

    public void invalidate() {
        recommendationCache.invalidate(CACHE_KEY);
    }
}
