package com.business.deduplication.rules;

import com.business.deduplication.core.model.RecordField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies {@link NormalizationRule}s to field values in priority order
 * (lower priority number runs first). Safe for concurrent use.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    // Immutable sorted snapshot, swapped on every change
    private volatile List<NormalizationRule> rules = List.of();

    public NormalizationEngine() {
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        addRules(rules);
    }

    public void addRule(NormalizationRule rule) {
        addRules(List.of(rule));
    }

    public synchronized void addRules(List<NormalizationRule> newRules) {
        List<NormalizationRule> merged = new ArrayList<>(rules);
        merged.addAll(newRules);
        merged.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        rules = List.copyOf(merged);
    }

    public synchronized boolean removeRule(String ruleName) {
        List<NormalizationRule> remaining = new ArrayList<>(rules);
        boolean removed = remaining.removeIf(r -> r.getName().equals(ruleName));
        rules = List.copyOf(remaining);
        return removed;
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes a value of the given field. Returns an empty string for null or blank input.
     */
    public String normalize(String value, RecordField field) {
        if (value == null || value.isBlank()) {
            return "";
        }

        String result = value.toLowerCase(Locale.ROOT);
        for (NormalizationRule rule : rules) {
            if (field == null || rule.appliesTo(field)) {
                String before = result;
                result = rule.apply(result);
                if (log.isTraceEnabled() && !before.equals(result)) {
                    log.trace("normalize.rule rule={} field={} before='{}' after='{}'",
                            rule.getName(), field, before, result);
                }
            }
        }

        return result.trim().replaceAll("\\s+", " ");
    }

    /**
     * Checks if two values of a field are equal after normalization.
     */
    public boolean areEquivalent(String value1, String value2, RecordField field) {
        return normalize(value1, field).equals(normalize(value2, field));
    }
}
