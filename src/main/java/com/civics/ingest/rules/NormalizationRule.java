package com.civics.ingest.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A case-insensitive regex rewrite applied during normalization. Lower priority runs first.
 */
public final class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final RuleScope scope;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE);
        this.replacement = builder.replacement;
        this.scope = builder.scope;
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public RuleScope getScope() {
        return scope;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Rules without a scope apply to every kind of value.
     */
    public boolean appliesTo(RuleScope target) {
        return scope == null || scope == target;
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((NormalizationRule) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{name='" + name + "', pattern=" + pattern.pattern() + ", priority=" + priority + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement = "";
        private RuleScope scope;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder scope(RuleScope scope) {
            this.scope = scope;
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
