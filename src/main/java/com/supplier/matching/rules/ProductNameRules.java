package com.supplier.matching.rules;

import java.util.List;

/**
 * Built-in normalization rules for supplier listing names.
 */
public final class ProductNameRules {

    /**
     * Filler words that carry no product identity in Chinese listings.
     */
    public static final List<String> CHINESE_NOISE_WORDS = List.of("的", "了", "和", "与", "或", "及");

    private ProductNameRules() {
        // Utility class
    }

    /**
     * Creates the default engine: keeps letters of any script and decimal digits, nothing else.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getCommonRules());
        return engine;
    }

    /**
     * Creates the default engine plus removal of {@link #CHINESE_NOISE_WORDS}.
     */
    public static NormalizationEngine createEngineWithNoiseWords() {
        NormalizationEngine engine = createDefaultEngine();
        engine.addRules(getNoiseWordRules());
        return engine;
    }

    /**
     * Rules applied to every name.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // Punctuation, symbols and all whitespace: "2.4G" and "2 4 G" both become "24G"
                NormalizationRule.builder()
                        .name("common-non-alphanumeric")
                        .pattern("[^\\p{L}\\p{Nd}]+")
                        .replacement("")
                        .priority(100)
                        .build()
        );
    }

    /**
     * Rules removing Chinese filler words. Run before the common rules.
     */
    public static List<NormalizationRule> getNoiseWordRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("zh-noise-words")
                        .pattern("[" + String.join("", CHINESE_NOISE_WORDS) + "]")
                        .replacement("")
                        .priority(50)
                        .build()
        );
    }
}
