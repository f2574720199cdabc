package com.supplier.matching.summary;

import com.supplier.matching.cluster.ProductCluster;
import com.supplier.matching.core.model.MatchingGroup;
import com.supplier.matching.core.model.MatchingWarning;
import com.supplier.matching.core.model.PairScore;
import com.supplier.matching.core.model.RawProduct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives price statistics, best member, confidence and representative name for a group.
 *
 * <p>Confidence is 1.0 for a singleton. For larger groups it is the mean hybrid score of
 * the pairs that were actually scored inside the group, below-threshold ones included.
 * Members joined only through transitive chaining therefore lower the confidence instead
 * of inheriting it.</p>
 *
 * <p>Prices are aggregated as raw amounts. When members disagree on currency the group
 * carries a {@code CURRENCY_MISMATCH_WITHIN_GROUP} warning and no common currency.</p>
 */
public class GroupSummarizer {
    private static final Logger log = LoggerFactory.getLogger(GroupSummarizer.class);

    static final int AVERAGE_SCALE = 4;

    /**
     * Cheapest first; equal prices ordered by supplier id, then product id.
     */
    public static final Comparator<RawProduct> BY_PRICE = Comparator
            .comparing((RawProduct p) -> p.getPrice().amount())
            .thenComparing(RawProduct::getSupplierId)
            .thenComparing(RawProduct::getId);

    private final RepresentativeNameSelector nameSelector;

    public GroupSummarizer() {
        this(new RepresentativeNameSelector());
    }

    public GroupSummarizer(RepresentativeNameSelector nameSelector) {
        this.nameSelector = nameSelector;
    }

    public MatchingGroup summarize(String groupId, ProductCluster cluster) {
        return summarize(groupId, cluster.members(), cluster.directScores());
    }

    /**
     * Summarizes a group.
     *
     * @param groupId      id to assign
     * @param members      group members, at least one
     * @param directScores pair scores computed between members
     */
    public MatchingGroup summarize(String groupId, List<RawProduct> members, List<PairScore> directScores) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("A group needs at least one member");
        }

        BigDecimal min = null;
        BigDecimal max = null;
        BigDecimal sum = BigDecimal.ZERO;
        Set<String> currencies = new LinkedHashSet<>();
        for (RawProduct member : members) {
            BigDecimal amount = member.getPrice().amount();
            min = min == null || amount.compareTo(min) < 0 ? amount : min;
            max = max == null || amount.compareTo(max) > 0 ? amount : max;
            sum = sum.add(amount);
            currencies.add(member.getPrice().currency());
        }
        BigDecimal avg = sum.divide(BigDecimal.valueOf(members.size()), AVERAGE_SCALE, RoundingMode.HALF_UP);

        RawProduct best = members.stream().min(BY_PRICE).orElseThrow();

        List<MatchingWarning> warnings = new ArrayList<>();
        String currency = null;
        if (currencies.size() == 1) {
            currency = currencies.iterator().next();
        } else {
            String message = "Group " + groupId + " mixes currencies " + currencies
                    + "; prices aggregated without conversion";
            warnings.add(MatchingWarning.currencyMismatch(groupId,
                    members.stream().map(RawProduct::getId).toList(), message));
            log.warn("group.currencyMismatch groupId={} currencies={}", groupId, currencies);
        }

        return MatchingGroup.builder()
                .groupId(groupId)
                .members(members)
                .representativeName(nameSelector.selectName(members))
                .minPrice(min)
                .maxPrice(max)
                .avgPrice(avg)
                .currency(currency)
                .bestMemberId(best.getId())
                .confidenceScore(confidence(members, directScores))
                .warnings(warnings)
                .build();
    }

    private double confidence(List<RawProduct> members, List<PairScore> directScores) {
        if (members.size() == 1) {
            return 1.0;
        }
        if (directScores == null || directScores.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (PairScore score : directScores) {
            total += score.hybridScore();
        }
        return Math.max(0.0, Math.min(1.0, total / directScores.size()));
    }
}
