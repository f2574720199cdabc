package com.supplier.matching.api;

import com.supplier.matching.core.model.MatchingGroup;
import com.supplier.matching.core.model.MatchingWarning;
import com.supplier.matching.core.model.PairScore;
import com.supplier.matching.core.model.WarningType;

import java.util.List;
import java.util.Optional;

/**
 * Result of a matching run. Every input product belongs to exactly one group.
 *
 * @param runId      id of the run, also present in the log MDC
 * @param options    options the run used
 * @param groups     groups ordered by their first member's input position
 * @param pairScores scores of all candidate pairs, in candidate order
 * @param warnings   data quality warnings
 * @param statistics summary counts
 */
public record MatchingResult(
        String runId,
        MatchingOptions options,
        List<MatchingGroup> groups,
        List<PairScore> pairScores,
        List<MatchingWarning> warnings,
        MatchingStatistics statistics
) {
    public MatchingResult {
        groups = groups != null ? List.copyOf(groups) : List.of();
        pairScores = pairScores != null ? List.copyOf(pairScores) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /**
     * Finds the group containing a product.
     */
    public Optional<MatchingGroup> groupOf(String productId) {
        return groups.stream().filter(g -> g.contains(productId)).findFirst();
    }

    public List<MatchingGroup> multiMemberGroups() {
        return groups.stream().filter(g -> !g.isSingleton()).toList();
    }

    public List<MatchingWarning> warningsOfType(WarningType type) {
        return warnings.stream().filter(w -> w.type() == type).toList();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
