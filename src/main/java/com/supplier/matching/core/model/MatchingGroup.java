package com.supplier.matching.core.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * A cluster of listings believed to describe the same physical product.
 * Groups are rebuilt from scratch on every run; {@link #getGroupId()} is only
 * stable for identical input.
 */
public class MatchingGroup {
    private final String groupId;
    private final List<RawProduct> members;
    private final String representativeName;
    private final BigDecimal minPrice;
    private final BigDecimal maxPrice;
    private final BigDecimal avgPrice;
    private final String currency;
    private final String bestMemberId;
    private final double confidenceScore;
    private final List<MatchingWarning> warnings;
    private final PriceComparison comparison;

    private MatchingGroup(Builder builder) {
        this.groupId = Objects.requireNonNull(builder.groupId, "groupId is required");
        this.members = List.copyOf(builder.members);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A matching group needs at least one member");
        }
        this.representativeName = builder.representativeName;
        this.minPrice = builder.minPrice;
        this.maxPrice = builder.maxPrice;
        this.avgPrice = builder.avgPrice;
        this.currency = builder.currency;
        this.bestMemberId = builder.bestMemberId;
        if (builder.confidenceScore < 0.0 || builder.confidenceScore > 1.0) {
            throw new IllegalArgumentException("confidenceScore must be between 0.0 and 1.0");
        }
        this.confidenceScore = builder.confidenceScore;
        this.warnings = builder.warnings != null ? List.copyOf(builder.warnings) : List.of();
        this.comparison = builder.comparison;
    }

    public String getGroupId() {
        return groupId;
    }

    public List<RawProduct> getMembers() {
        return members;
    }

    public List<String> getMemberIds() {
        return members.stream().map(RawProduct::getId).toList();
    }

    public int size() {
        return members.size();
    }

    public boolean isSingleton() {
        return members.size() == 1;
    }

    public boolean contains(String productId) {
        return members.stream().anyMatch(m -> m.getId().equals(productId));
    }

    public String getRepresentativeName() {
        return representativeName;
    }

    public BigDecimal getMinPrice() {
        return minPrice;
    }

    public BigDecimal getMaxPrice() {
        return maxPrice;
    }

    public BigDecimal getAvgPrice() {
        return avgPrice;
    }

    /**
     * Common currency of all members, or null when they disagree.
     */
    public String getCurrency() {
        return currency;
    }

    public boolean hasMixedCurrencies() {
        return currency == null;
    }

    public String getBestMemberId() {
        return bestMemberId;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public List<MatchingWarning> getWarnings() {
        return warnings;
    }

    /**
     * Price comparison for this group, or null before the reporter has run.
     */
    public PriceComparison getComparison() {
        return comparison;
    }

    /**
     * Returns a copy of this group with the given comparison embedded.
     */
    public MatchingGroup withComparison(PriceComparison comparison) {
        return builder(this).comparison(comparison).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MatchingGroup that = (MatchingGroup) o;
        return Objects.equals(groupId, that.groupId) && Objects.equals(getMemberIds(), that.getMemberIds());
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupId, getMemberIds());
    }

    @Override
    public String toString() {
        return "MatchingGroup{" +
                "groupId='" + groupId + '\'' +
                ", members=" + getMemberIds() +
                ", representativeName='" + representativeName + '\'' +
                ", minPrice=" + minPrice +
                ", maxPrice=" + maxPrice +
                ", bestMemberId='" + bestMemberId + '\'' +
                ", confidenceScore=" + confidenceScore +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(MatchingGroup group) {
        return new Builder()
                .groupId(group.groupId)
                .members(group.members)
                .representativeName(group.representativeName)
                .minPrice(group.minPrice)
                .maxPrice(group.maxPrice)
                .avgPrice(group.avgPrice)
                .currency(group.currency)
                .bestMemberId(group.bestMemberId)
                .confidenceScore(group.confidenceScore)
                .warnings(group.warnings)
                .comparison(group.comparison);
    }

    public static class Builder {
        private String groupId;
        private List<RawProduct> members = List.of();
        private String representativeName;
        private BigDecimal minPrice;
        private BigDecimal maxPrice;
        private BigDecimal avgPrice;
        private String currency;
        private String bestMemberId;
        private double confidenceScore = 1.0;
        private List<MatchingWarning> warnings;
        private PriceComparison comparison;

        public Builder groupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder members(List<RawProduct> members) {
            this.members = members;
            return this;
        }

        public Builder representativeName(String representativeName) {
            this.representativeName = representativeName;
            return this;
        }

        public Builder minPrice(BigDecimal minPrice) {
            this.minPrice = minPrice;
            return this;
        }

        public Builder maxPrice(BigDecimal maxPrice) {
            this.maxPrice = maxPrice;
            return this;
        }

        public Builder avgPrice(BigDecimal avgPrice) {
            this.avgPrice = avgPrice;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder bestMemberId(String bestMemberId) {
            this.bestMemberId = bestMemberId;
            return this;
        }

        public Builder confidenceScore(double confidenceScore) {
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder warnings(List<MatchingWarning> warnings) {
            this.warnings = warnings;
            return this;
        }

        public Builder comparison(PriceComparison comparison) {
            this.comparison = comparison;
            return this;
        }

        public MatchingGroup build() {
            return new MatchingGroup(this);
        }
    }
}
