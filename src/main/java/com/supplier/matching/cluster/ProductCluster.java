package com.supplier.matching.cluster;

import com.supplier.matching.core.model.PairScore;
import com.supplier.matching.core.model.RawProduct;

import java.util.List;

/**
 * Members of one connected component plus every pair score computed between two of them,
 * including scores below the threshold.
 *
 * @param members      members in input order
 * @param directScores scores whose both products belong to this cluster
 */
public record ProductCluster(List<RawProduct> members, List<PairScore> directScores) {

    public ProductCluster {
        members = List.copyOf(members);
        directScores = directScores != null ? List.copyOf(directScores) : List.of();
    }

    public boolean isSingleton() {
        return members.size() == 1;
    }
}
