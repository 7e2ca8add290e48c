package com.business.deduplication.rules;

import com.business.deduplication.core.model.RecordField;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * A named regex rewrite of a field value. Rules run in ascending priority and may be
 * scoped to fields; an unscoped rule applies to every field.
 *
 * <p>Rules are identified by name: two rules with the same name are equal.</p>
 */
public final class NormalizationRule {
    static final int DEFAULT_PRIORITY = 100;

    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final Set<RecordField> fields;
    private final int priority;

    private NormalizationRule(String name, Pattern pattern, String replacement, Set<RecordField> fields, int priority) {
        this.name = name;
        this.pattern = pattern;
        this.replacement = replacement;
        this.fields = fields;
        this.priority = priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Fields this rule is scoped to; empty when it applies to every field.
     */
    public Set<RecordField> getFields() {
        return fields;
    }

    public boolean appliesTo(RecordField field) {
        return fields.isEmpty() || fields.contains(field);
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NormalizationRule other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name + "[" + pattern.pattern() + " -> '" + replacement + "', priority=" + priority
                + (fields.isEmpty() ? "" : ", fields=" + fields) + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String regex;
        private String replacement = "";
        private boolean literal;
        private final Set<RecordField> fields = EnumSet.noneOf(RecordField.class);
        private int priority = DEFAULT_PRIORITY;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * A regular expression, matched case-insensitively.
         */
        public Builder pattern(String regex) {
            this.regex = regex;
            return this;
        }

        /**
         * Matches any of the given words as whole words, e.g. a suffix or abbreviation table.
         */
        public Builder wholeWords(Collection<String> words) {
            if (words == null || words.isEmpty()) {
                throw new IllegalArgumentException("wholeWords requires at least one word");
            }
            this.regex = "\\b(?:" + words.stream().map(Pattern::quote).collect(Collectors.joining("|")) + ")\\b";
            return this;
        }

        /**
         * Replacement with {@code $n} group references.
         */
        public Builder replacement(String replacement) {
            this.replacement = replacement;
            this.literal = false;
            return this;
        }

        /**
         * Replacement inserted verbatim.
         */
        public Builder literalReplacement(String replacement) {
            this.replacement = replacement;
            this.literal = true;
            return this;
        }

        public Builder applicableFields(RecordField... scope) {
            for (RecordField field : scope) {
                fields.add(Objects.requireNonNull(field, "field"));
            }
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the name or pattern is missing or the pattern does not compile
         */
        public NormalizationRule build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Rule name is required");
            }
            if (regex == null) {
                throw new IllegalArgumentException("Rule " + name + " has no pattern");
            }
            Objects.requireNonNull(replacement, "replacement is required");
            Pattern compiled;
            try {
                compiled = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Rule " + name + " has an invalid pattern: " + e.getDescription(), e);
            }
            String effective = literal ? Matcher.quoteReplacement(replacement) : replacement;
            Set<RecordField> scope = fields.isEmpty() ? Set.of() : Set.copyOf(fields);
            return new NormalizationRule(name, compiled, effective, scope, priority);
        }
    }
}
