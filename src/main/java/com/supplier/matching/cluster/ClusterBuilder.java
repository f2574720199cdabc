package com.supplier.matching.cluster;

import com.supplier.matching.core.model.MatchingGroup;
import com.supplier.matching.core.model.PairScore;
import com.supplier.matching.core.model.RawProduct;
import com.supplier.matching.summary.GroupSummarizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups products into connected components of matching pairs.
 *
 * <p>Every pair with {@code hybridScore >= threshold} is unioned. Union-find is
 * transitive: if A matches B and B matches C, A and C share a group even when A-C
 * alone scores far below the threshold. This favours recall over pairwise precision
 * and can chain false positives through a single ambiguous listing. The group's
 * confidence score exposes how strong the direct evidence was.</p>
 *
 * <p>A product with no qualifying pair becomes a singleton group. Groups are ordered by
 * their first member's position in the input; members keep input order.</p>
 */
public class ClusterBuilder {
    private static final Logger log = LoggerFactory.getLogger(ClusterBuilder.class);

    private final GroupSummarizer summarizer;

    public ClusterBuilder() {
        this(new GroupSummarizer());
    }

    public ClusterBuilder(GroupSummarizer summarizer) {
        this.summarizer = summarizer;
    }

    /**
     * Builds summarized matching groups.
     */
    public List<MatchingGroup> buildGroups(List<RawProduct> products, List<PairScore> pairScores,
                                           double threshold) {
        List<ProductCluster> clusters = cluster(products, pairScores, threshold);
        List<MatchingGroup> groups = new ArrayList<>(clusters.size());
        for (int i = 0; i < clusters.size(); i++) {
            groups.add(summarizer.summarize(groupId(i), clusters.get(i)));
        }
        return groups;
    }

    /**
     * Computes the connected components without summarizing them.
     */
    public List<ProductCluster> cluster(List<RawProduct> products, List<PairScore> pairScores,
                                        double threshold) {
        if (products == null || products.isEmpty()) {
            return List.of();
        }

        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < products.size(); i++) {
            indexById.put(products.get(i).getId(), i);
        }

        DisjointSet sets = new DisjointSet(products.size());
        int unions = 0;
        for (PairScore score : pairScores) {
            Integer a = indexById.get(score.productAId());
            Integer b = indexById.get(score.productBId());
            if (a == null || b == null) {
                log.warn("cluster.unknownPair a={} b={} ignored", score.productAId(), score.productBId());
                continue;
            }
            if (score.hybridScore() >= threshold && sets.union(a, b)) {
                unions++;
            }
        }

        // root -> member indices, roots visited in input order
        Map<Integer, List<Integer>> components = new LinkedHashMap<>();
        for (int i = 0; i < products.size(); i++) {
            components.computeIfAbsent(sets.find(i), k -> new ArrayList<>()).add(i);
        }

        Map<Integer, List<PairScore>> scoresByRoot = new HashMap<>();
        for (PairScore score : pairScores) {
            Integer a = indexById.get(score.productAId());
            Integer b = indexById.get(score.productBId());
            if (a != null && b != null && sets.connected(a, b)) {
                scoresByRoot.computeIfAbsent(sets.find(a), k -> new ArrayList<>()).add(score);
            }
        }

        List<ProductCluster> clusters = new ArrayList<>(components.size());
        for (Map.Entry<Integer, List<Integer>> entry : components.entrySet()) {
            List<RawProduct> members = entry.getValue().stream().map(products::get).toList();
            clusters.add(new ProductCluster(members, scoresByRoot.getOrDefault(entry.getKey(), List.of())));
        }

        log.debug("cluster.built products={} unions={} groups={} threshold={}",
                products.size(), unions, clusters.size(), threshold);
        return clusters;
    }

    static String groupId(int ordinal) {
        return String.format("group-%04d", ordinal + 1);
    }
}
