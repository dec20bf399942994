package com.identity.matching.rules;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One regex rewrite run over a field value before it is compared.
 * A rule with no fields listed runs for every {@link FieldType}.
 */
public final class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final Set<FieldType> fields;
    private final int priority;

    private NormalizationRule(String name, Pattern pattern, String replacement,
                              Set<FieldType> fields, int priority) {
        this.name = name;
        this.pattern = pattern;
        this.replacement = replacement;
        this.fields = fields;
        this.priority = priority;
    }

    public String getName() {
        return name;
    }

    /**
     * Lower runs first.
     */
    public int getPriority() {
        return priority;
    }

    public boolean appliesTo(FieldType field) {
        return fields.isEmpty() || fields.contains(field);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return name + "[/" + pattern.pattern() + "/ -> '" + replacement + "' on " + fields + ", p" + priority + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String regex;
        private String replacement;
        private final Set<FieldType> fields = EnumSet.noneOf(FieldType.class);
        private int priority = 100;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String regex) {
            this.regex = regex;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder applicableFields(FieldType... fieldTypes) {
            Collections.addAll(fields, fieldTypes);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a part is missing or the pattern does not compile
         */
        public NormalizationRule build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Normalization rule needs a name");
            }
            if (regex == null || replacement == null) {
                throw new IllegalArgumentException("Normalization rule '" + name + "' needs a pattern and a replacement");
            }
            Pattern compiled;
            try {
                compiled = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Normalization rule '" + name + "' has an invalid pattern", e);
            }
            Set<FieldType> scope = fields.isEmpty() ? Set.of() : Set.copyOf(fields);
            return new NormalizationRule(name, compiled, replacement, scope, priority);
        }
    }
}
