package com.supplier.matching.api;

import com.supplier.matching.cache.ContentKeys;
import com.supplier.matching.cache.FeatureCache;
import com.supplier.matching.core.model.MatchingMode;
import com.supplier.matching.core.model.MatchingWarning;
import com.supplier.matching.core.model.ProductFeatures;
import com.supplier.matching.core.model.RawProduct;
import com.supplier.matching.image.ImageLoader;
import com.supplier.matching.image.PerceptualHash;
import com.supplier.matching.image.PerceptualHasher;
import com.supplier.matching.metrics.MetricsService;
import com.supplier.matching.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives normalized names and perceptual hashes for a batch.
 *
 * <p>Values precomputed on the product win. Otherwise the feature cache is consulted,
 * then the value is computed and stored. Images are only loaded outside
 * {@link MatchingMode#TEXT}; each distinct image reference is hashed at most once per
 * run. When a reference cannot be loaded or decoded, every product carrying it gets an
 * {@code IMAGE_UNAVAILABLE} warning and is matched without an image.</p>
 */
class FeatureExtractor {
    private static final Logger log = LoggerFactory.getLogger(FeatureExtractor.class);

    private final NormalizationEngine normalizationEngine;
    private final PerceptualHasher hasher;
    private final ImageLoader imageLoader;
    private final FeatureCache featureCache;
    private final MetricsService metricsService;

    FeatureExtractor(NormalizationEngine normalizationEngine, PerceptualHasher hasher, ImageLoader imageLoader,
                     FeatureCache featureCache, MetricsService metricsService) {
        this.normalizationEngine = normalizationEngine;
        this.hasher = hasher;
        this.imageLoader = imageLoader;
        this.featureCache = featureCache;
        this.metricsService = metricsService;
    }

    record Extraction(List<ProductFeatures> features, List<MatchingWarning> warnings) {
    }

    Extraction extract(List<RawProduct> products, MatchingMode mode) {
        String rulesFingerprint = normalizationEngine.fingerprint();
        Map<String, Optional<PerceptualHash>> hashesThisRun = new HashMap<>();
        Map<String, String> failedRefs = new HashMap<>();
        List<ProductFeatures> features = new ArrayList<>(products.size());
        List<MatchingWarning> warnings = new ArrayList<>();

        for (RawProduct product : products) {
            String normalized = product.getNormalizedName()
                    .orElseGet(() -> normalizedName(rulesFingerprint, product.getName()));
            PerceptualHash hash = null;
            if (mode != MatchingMode.TEXT) {
                hash = product.getPerceptualHash().orElse(null);
                if (hash == null && product.getImageRef().isPresent()) {
                    String ref = product.getImageRef().get();
                    hash = hashesThisRun.computeIfAbsent(ref, r -> imageHash(product, r, failedRefs))
                            .orElse(null);
                    // each product sharing a broken reference gets its own warning
                    String failure = failedRefs.get(ref);
                    if (failure != null) {
                        warnings.add(MatchingWarning.imageUnavailable(product.getId(), failure));
                    }
                }
            }
            features.add(new ProductFeatures(product, normalized, hash));
        }
        return new Extraction(features, warnings);
    }

    private String normalizedName(String rulesFingerprint, String rawName) {
        String key = ContentKeys.forName(rulesFingerprint, rawName);
        Optional<String> cached = featureCache.getNormalizedName(key);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get();
        }
        metricsService.recordCacheMiss();
        String normalized = normalizationEngine.normalize(rawName);
        featureCache.putNormalizedName(key, normalized);
        return normalized;
    }

    private Optional<PerceptualHash> imageHash(RawProduct product, String imageRef, Map<String, String> failedRefs) {
        String key = ContentKeys.forImage(hasher.getVersion(), imageRef);
        Optional<PerceptualHash> cached = featureCache.getImageHash(key);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached;
        }
        metricsService.recordCacheMiss();

        if (imageLoader == null) {
            failedRefs.put(imageRef, "No image loader configured for " + imageRef);
            return Optional.empty();
        }
        try {
            BufferedImage image = imageLoader.load(imageRef);
            PerceptualHash hash = hasher.hash(image);
            featureCache.putImageHash(key, hash);
            return Optional.of(hash);
        } catch (IOException | RuntimeException e) {
            log.warn("features.imageUnavailable productId={} imageRef={} error={}",
                    product.getId(), imageRef, e.getMessage());
            failedRefs.put(imageRef, "Image " + imageRef + " could not be loaded: " + e.getMessage());
            return Optional.empty();
        }
    }
}
