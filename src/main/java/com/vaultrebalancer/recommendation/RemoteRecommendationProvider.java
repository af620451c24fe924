package com.vaultrebalancer.recommendation;

import com.vaultrebalancer.domain.model.RecommendationSet;
import com.vaultrebalancer.exception.RecommendationUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.ArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches the ranked vault list from the external ranking service.
 *
 * <p>The ranking service does candidate discovery, scoring and the LLM passes; this class only
 * calls {@code GET /recommendations} and replaces missing buckets with empty lists.
 * Callers normally go through {@link CachingRecommendationProvider}.
 */
@Service
public class RemoteRecommendationProvider implements RecommendationProvider {

    private static final Logger log = LoggerFactory.getLogger(RemoteRecommendationProvider.class);

    private final RestClient recommenderRestClient;

    public RemoteRecommendationProvider(@Qualifier("recommenderRestClient") RestClient recommenderRestClient) {
        this.recommenderRestClient = recommenderRestClient;
    }

    @Override
    @CircuitBreaker(name = "recommender")
    @Retry(name = "recommender")
    public RecommendationSet getRecommendations(boolean refresh) {
        RecommendationSet set;
        try {
            set = recommenderRestClient
                    .get()
                    .uri(uri -> uri.path("/recommendations")
                            .queryParam("refresh", refresh)
                            .build())
                    .retrieve()
                    .body(RecommendationSet.class);
        } catch (RestClientException e) {
            log.error("Ranking service call failed: {}", e.getMessage());
            throw new RecommendationUnavailableException("Ranking service call failed: " + e.getMessage(), e);
        }

        if (set == null) {
            throw new RecommendationUnavailableException("Ranking service returned an empty body", null);
        }
        if (set.getHighConfidence() == null) {
            set.setHighConfidence(new ArrayList<>());
        }
        if (set.getLowConfidence() == null) {
            set.setLowConfidence(new ArrayList<>());
        }
        log.info(
                "Fetched recommendations: source={}, model={}, high={}, low={}",
                set.getSource(),
                set.getModel(),
                set.getHighConfidence().size(),
                set.getLowConfidence().size());
        return set;
    }
}
