package com.supplier.matching.api;

import com.supplier.matching.candidate.CandidatePair;
import com.supplier.matching.core.model.MatchingMode;
import com.supplier.matching.core.model.MatchingWarning;
import com.supplier.matching.core.model.PairScore;
import com.supplier.matching.core.model.ProductFeatures;
import com.supplier.matching.image.HashVersionMismatchException;
import com.supplier.matching.similarity.CompositeSimilarityScorer;
import com.supplier.matching.similarity.HybridScorer;
import com.supplier.matching.similarity.ImageSimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * Scores one candidate pair. Stateless and safe to call from several threads.
 */
class PairScorer {
    private static final Logger log = LoggerFactory.getLogger(PairScorer.class);

    private final CompositeSimilarityScorer textScorer;
    private final ImageSimilarityScorer imageScorer;
    private final HybridScorer hybridScorer;
    private final MatchingMode mode;
    private final double threshold;

    PairScorer(MatchingOptions options) {
        this.textScorer = new CompositeSimilarityScorer(options.getSimilarityWeights());
        this.imageScorer = new ImageSimilarityScorer();
        this.hybridScorer = new HybridScorer(options.getHybridWeights());
        this.mode = options.getMode();
        this.threshold = options.getThreshold();
    }

    /**
     * @param score   the pair's score
     * @param warning hash mismatch warning for the pair, or null
     */
    record ScoredPair(PairScore score, MatchingWarning warning) {
    }

    ScoredPair score(CandidatePair pair) {
        ProductFeatures a = pair.first();
        ProductFeatures b = pair.second();

        double text = textScorer.compute(a.normalizedName(), b.normalizedName());

        OptionalDouble image = OptionalDouble.empty();
        MatchingWarning warning = null;
        if (mode != MatchingMode.TEXT) {
            try {
                image = imageScorer.compute(a.perceptualHash(), b.perceptualHash());
            } catch (HashVersionMismatchException e) {
                log.warn("pair.hashVersionMismatch a={} b={} error={}", a.id(), b.id(), e.getMessage());
                warning = MatchingWarning.hashVersionMismatch(a.id(), b.id(), e.getMessage());
            }
        }

        double hybrid = hybridScorer.score(mode, text, image);
        PairScore score = PairScore.of(a.id(), b.id(), text,
                image.isPresent() ? image.getAsDouble() : null, hybrid, threshold);
        log.debug("pair.scored a={} b={} text={} hybrid={}", a.id(), b.id(), text, hybrid);
        return new ScoredPair(score, warning);
    }
}
