package com.supplier.matching.api;

/**
 * Summary counts of a run.
 *
 * @param productCount          products in the batch
 * @param supplierCount         distinct suppliers in the batch
 * @param candidatePairCount    pairs scored
 * @param matchedPairCount      pairs at or above the threshold
 * @param groupCount            groups produced, singletons included
 * @param multiMemberGroupCount groups with more than one member
 * @param averageConfidence     mean confidence of multi-member groups, 0 when there are none
 * @param warningCount          warnings raised
 * @param durationMillis        wall-clock duration of the run
 */
public record MatchingStatistics(
        int productCount,
        int supplierCount,
        int candidatePairCount,
        long matchedPairCount,
        int groupCount,
        int multiMemberGroupCount,
        double averageConfidence,
        int warningCount,
        long durationMillis
) {

    public int singletonCount() {
        return groupCount - multiMemberGroupCount;
    }

    /**
     * Share of products that ended up in a multi-member group.
     */
    public double matchRate(int productsInMultiMemberGroups) {
        return productCount == 0 ? 0.0 : (double) productsInMultiMemberGroups / productCount;
    }

    public static MatchingStatistics empty() {
        return new MatchingStatistics(0, 0, 0, 0, 0, 0, 0.0, 0, 0);
    }

    @Override
    public String toString() {
        return "MatchingStatistics{" +
                "products=" + productCount +
                ", suppliers=" + supplierCount +
                ", candidates=" + candidatePairCount +
                ", matched=" + matchedPairCount +
                ", groups=" + groupCount +
                ", multiMember=" + multiMemberGroupCount +
                ", avgConfidence=" + averageConfidence +
                ", warnings=" + warningCount +
                ", durationMs=" + durationMillis +
                '}';
    }
}
