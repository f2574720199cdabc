package com.supplier.matching.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Engine for applying normalization rules to product names.
 * Rules are applied in priority order (lower priority number = higher precedence),
 * after which ASCII letters are lower-cased. Scripts without case, such as Chinese,
 * pass through unchanged.
 *
 * <p>With the rules from {@link ProductNameRules} the result is deterministic and
 * idempotent: {@code normalize(normalize(x)).equals(normalize(x))}.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    /**
     * Adds a rule to the engine.
     */
    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    /**
     * Adds multiple rules to the engine.
     */
    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    /**
     * Removes a rule by name.
     */
    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes a raw product name. Null or blank input yields an empty string.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name;
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.debug("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        return lowerCaseAscii(result.strip());
    }

    /**
     * Checks if two names are equivalent after normalization.
     */
    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }

    /**
     * Describes the active rule set. Two engines with equal fingerprints normalize
     * identically, so memoized names can be keyed by it.
     */
    public String fingerprint() {
        StringBuilder sb = new StringBuilder();
        for (NormalizationRule rule : rules) {
            sb.append(rule.signature()).append(';');
        }
        return sb.toString();
    }

    private static String lowerCaseAscii(String s) {
        StringBuilder sb = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                if (sb == null) {
                    sb = new StringBuilder(s);
                }
                sb.setCharAt(i, (char) (c + ('a' - 'A')));
            }
        }
        return sb != null ? sb.toString() : s;
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
