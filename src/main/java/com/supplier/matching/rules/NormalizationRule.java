package com.supplier.matching.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A regex rewrite applied to product names. Lower priorities run first.
 * Patterns match case-insensitively with Unicode character classes, so {@code \w}
 * and friends cover CJK text.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
        this.replacement = builder.replacement;
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Rewrites every match in the name. Null stays null.
     */
    public String apply(String productName) {
        return productName == null ? null : pattern.matcher(productName).replaceAll(replacement);
    }

    /**
     * Everything that affects the output of {@link #apply}; the rule name is excluded.
     */
    String signature() {
        return priority + ":" + pattern.pattern() + "->" + replacement;
    }

    @Override
    public String toString() {
        return "NormalizationRule{" + name + " " + signature() + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement = "";
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        /**
         * Replacement text; defaults to removing the match.
         */
        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            return new NormalizationRule(this);
        }
    }
}
