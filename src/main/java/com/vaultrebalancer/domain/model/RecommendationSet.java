package com.vaultrebalancer.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The ranked output of the recommendation pipeline for one round.
 *
 * <p>Treated as immutable input by the rebalancing engine. suggestedAllocations is optional;
 * when absent the configured bucket percentages apply.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecommendationSet {

    private Instant generatedAt;

    /** "openai" or "heuristic". */
    private String source;

    private String model;

    @Builder.Default
    private List<Recommendation> highConfidence = new ArrayList<>();

    @Builder.Default
    private List<Recommendation> lowConfidence = new ArrayList<>();

    private SuggestedAllocations suggestedAllocations;

    /** Lowercased addresses of every recommended vault, high bucket first. */
    @JsonIgnore
    public Set<String> getRecommendedAddresses() {
        Set<String> addresses = new LinkedHashSet<>();
        for (Recommendation recommendation : nullSafe(highConfidence)) {
            addresses.add(normalize(recommendation.getVaultAddress()));
        }
        for (Recommendation recommendation : nullSafe(lowConfidence)) {
            addresses.add(normalize(recommendation.getVaultAddress()));
        }
        return addresses;
    }

    public static String normalize(String address) {
        return address == null ? "" : address.trim().toLowerCase(Locale.ROOT);
    }

    private static List<Recommendation> nullSafe(List<Recommendation> list) {
        return list != null ? list : List.of();
    }
}
