package com.vaultrebalancer.recommendation;

import com.vaultrebalancer.domain.model.RecommendationSet;

/**
 * Source of the ranked vault list that drives a rebalance round.
 *
 * <p>Implementations must tolerate a ranking without {@code suggestedAllocations}; the
 * planner falls back to the configured barbell split in that case.
 */
public interface RecommendationProvider {

    /** Returns the current ranking, possibly from a cache. */
    default RecommendationSet getRecommendations() {
        return getRecommendations(false);
    }

    /**
     * Returns the current ranking.
     *
     * @param refresh when true, bypass any cached ranking and ask the ranking service again
     * @throws com.vaultrebalancer.exception.RecommendationUnavailableException if no ranking
     *     can be obtained
     */
    RecommendationSet getRecommendations(boolean refresh);
}
