package com.supplier.matching.report;

import com.supplier.matching.core.model.MatchingGroup;
import com.supplier.matching.core.model.PriceComparison;
import com.supplier.matching.core.model.RankedMember;
import com.supplier.matching.core.model.RawProduct;
import com.supplier.matching.summary.GroupSummarizer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a summarized group into a buyer-facing price comparison.
 */
public class PriceComparisonReporter {

    static final int PERCENT_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public PriceComparison compare(MatchingGroup group) {
        List<RawProduct> ordered = group.getMembers().stream()
                .sorted(GroupSummarizer.BY_PRICE)
                .toList();
        RawProduct best = ordered.get(0);
        BigDecimal bestPrice = best.getPrice().amount();

        BigDecimal min = group.getMinPrice() != null ? group.getMinPrice() : bestPrice;
        BigDecimal max = group.getMaxPrice() != null
                ? group.getMaxPrice()
                : ordered.get(ordered.size() - 1).getPrice().amount();
        BigDecimal savings = max.subtract(min);

        List<RankedMember> ranked = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            RawProduct p = ordered.get(i);
            ranked.add(new RankedMember(i + 1, p.getId(), p.getSupplierId(), p.getName(),
                    p.getPrice(), p.getUrl(), p.getPrice().amount().subtract(bestPrice)));
        }

        return new PriceComparison(
                group.getGroupId(),
                best.getId(),
                min,
                max,
                group.getCurrency(),
                savings,
                savingsPercent(savings, max),
                ranked);
    }

    /**
     * Returns the group with its comparison attached.
     */
    public MatchingGroup attach(MatchingGroup group) {
        return group.withComparison(compare(group));
    }

    /**
     * {@code savings / max * 100}, rounded half-up to four decimals; 0 when {@code max} is 0.
     */
    static double savingsPercent(BigDecimal savings, BigDecimal max) {
        if (max.signum() == 0) {
            return 0.0;
        }
        return savings.multiply(HUNDRED)
                .divide(max, PERCENT_SCALE, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
