package com.supplier.matching.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = ProductNameRules.createDefaultEngine();
    }

    @ParameterizedTest
    @DisplayName("Punctuation and whitespace are removed, ASCII lower-cased")
    @CsvSource({
            "'无线鼠标 2.4G', 无线鼠标24g",
            "'无线鼠标2.4G黑色', 无线鼠标24g黑色",
            "'USB-C 数据线 (1m)', usbc数据线1m",
            "'  蓝牙耳机！！ ', 蓝牙耳机",
            "'Type-C/充电器 【快充】', typec充电器快充"
    })
    void normalizesProductNames(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @Test
    @DisplayName("Null and blank input yield an empty string")
    void nullAndBlank() {
        assertEquals("", engine.normalize(null));
        assertEquals("", engine.normalize(""));
        assertEquals("", engine.normalize("   "));
        assertEquals("", engine.normalize("!!! ---"));
    }

    @Test
    @DisplayName("Only ASCII letters are lower-cased")
    void asciiOnlyLowerCase() {
        // Greek capital sigma is a letter and is left alone
        assertEquals("abcΣ", engine.normalize("ABC Σ"));
    }

    @Test
    @DisplayName("Normalization is idempotent")
    void idempotent() {
        String[] inputs = {"无线鼠标 2.4G", "USB-C 数据线 (1m)", "Mixed Case 混合 123"};
        for (String input : inputs) {
            String once = engine.normalize(input);
            assertEquals(once, engine.normalize(once));
        }
    }

    @Test
    @DisplayName("Noise word rules strip Chinese particles")
    void noiseWords() {
        NormalizationEngine withNoise = ProductNameRules.createEngineWithNoiseWords();
        assertEquals("鼠标键盘套装", withNoise.normalize("鼠标和键盘的套装"));
        assertEquals("鼠标和键盘的套装", engine.normalize("鼠标和键盘的套装"));
    }

    @Test
    @DisplayName("Rules run in priority order and can be removed")
    void customRules() {
        NormalizationEngine custom = new NormalizationEngine();
        custom.addRule(NormalizationRule.builder()
                .name("strip-brand")
                .pattern("acme")
                .replacement("")
                .priority(10)
                .build());
        custom.addRules(ProductNameRules.getCommonRules());

        assertEquals("mouse", custom.normalize("ACME Mouse"));
        assertTrue(custom.removeRule("strip-brand"));
        assertEquals("acmemouse", custom.normalize("ACME Mouse"));
    }

    @Test
    @DisplayName("areEquivalent compares normalized forms")
    void equivalence() {
        assertTrue(engine.areEquivalent("无线鼠标 2.4G", "无线鼠标2.4g"));
        assertFalse(engine.areEquivalent("无线鼠标", "蓝牙耳机"));
    }

    @Test
    @DisplayName("Fingerprint changes with the rule set")
    void fingerprint() {
        assertEquals(engine.fingerprint(), ProductNameRules.createDefaultEngine().fingerprint());
        assertNotEquals(engine.fingerprint(), ProductNameRules.createEngineWithNoiseWords().fingerprint());

        // renaming a rule does not change what it does
        NormalizationEngine renamed = new NormalizationEngine(List.of(NormalizationRule.builder()
                .name("renamed")
                .pattern("[^\\p{L}\\p{Nd}]+")
                .priority(100)
                .build()));
        assertEquals(engine.fingerprint(), renamed.fingerprint());
    }
}
