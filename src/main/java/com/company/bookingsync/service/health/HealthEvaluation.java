package com.company.bookingsync.service.health;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores computed by a provider strategy. Both scores are in {@code [0, 100]}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthEvaluation {
    private int healthScore;
    private int dataQualityScore;
    @Builder.Default
    private Map<String, Object> metrics = new LinkedHashMap<>();
}
