package com.supplier.matching.summary;

import com.supplier.matching.core.model.RawProduct;
import com.supplier.matching.rules.NormalizationEngine;
import com.supplier.matching.rules.ProductNameRules;
import com.supplier.matching.similarity.LevenshteinSimilarity;

import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Picks the member whose name best represents a group: the medoid under Levenshtein
 * distance of normalized names. Ties go to the longest normalized name, then to the
 * smallest product id, so the choice never depends on input or iteration order.
 */
public class RepresentativeNameSelector {

    private final Function<RawProduct, String> normalizedName;

    public RepresentativeNameSelector() {
        this(ProductNameRules.createDefaultEngine());
    }

    public RepresentativeNameSelector(NormalizationEngine engine) {
        this(product -> product.getNormalizedName().orElseGet(() -> engine.normalize(product.getName())));
    }

    /**
     * @param normalizedName lookup of a member's normalized name, typically the run's features
     */
    public RepresentativeNameSelector(Function<RawProduct, String> normalizedName) {
        this.normalizedName = normalizedName;
    }

    /**
     * Returns the representative member.
     */
    public RawProduct select(List<RawProduct> members) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("members must not be empty");
        }
        if (members.size() == 1) {
            return members.get(0);
        }

        List<String> names = members.stream().map(normalizedName).toList();
        long[] totals = new long[members.size()];
        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                int d = LevenshteinSimilarity.distance(names.get(i), names.get(j));
                totals[i] += d;
                totals[j] += d;
            }
        }

        Comparator<Integer> order = Comparator.<Integer>comparingLong(i -> totals[i])
                .thenComparing(i -> -names.get(i).codePointCount(0, names.get(i).length()))
                .thenComparing(i -> members.get(i).getId());

        int best = 0;
        for (int i = 1; i < members.size(); i++) {
            if (order.compare(i, best) < 0) {
                best = i;
            }
        }
        return members.get(best);
    }

    /**
     * Returns the original name of the representative member.
     */
    public String selectName(List<RawProduct> members) {
        return select(members).getName();
    }
}
