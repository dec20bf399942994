package com.identity.matching.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Runs the field-scoped {@link NormalizationRule}s over a value, lowest priority
 * number first, then lowercases it and collapses whitespace.
 *
 * <p>The rule list is swapped as a whole on every change, so one engine can be
 * shared by concurrent matching passes while rules are being edited.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Comparator<NormalizationRule> BY_PRIORITY =
            Comparator.comparingInt(NormalizationRule::getPriority);

    private volatile List<NormalizationRule> rules = List.of();

    public NormalizationEngine() {
    }

    public NormalizationEngine(List<NormalizationRule> initial) {
        addRules(initial);
    }

    public void addRule(NormalizationRule rule) {
        addRules(List.of(rule));
    }

    /**
     * Adds rules, replacing any existing rule of the same name.
     */
    public synchronized void addRules(List<NormalizationRule> added) {
        List<NormalizationRule> next = new ArrayList<>(rules);
        for (NormalizationRule rule : added) {
            next.removeIf(existing -> existing.getName().equals(rule.getName()));
            next.add(rule);
        }
        next.sort(BY_PRIORITY);
        rules = List.copyOf(next);
        log.debug("normalization.rules.updated count={}", next.size());
    }

    public synchronized boolean removeRule(String ruleName) {
        List<NormalizationRule> next = new ArrayList<>(rules);
        if (!next.removeIf(r -> r.getName().equals(ruleName))) {
            return false;
        }
        rules = List.copyOf(next);
        return true;
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalized form of a value of the given field; null or blank gives "".
     */
    public String normalize(String value, FieldType field) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String current = value;
        for (NormalizationRule rule : rules) {
            if (!rule.appliesTo(field)) {
                continue;
            }
            String rewritten = rule.apply(current);
            if (log.isTraceEnabled() && !rewritten.equals(current)) {
                log.trace("normalization.rule.applied rule={} field={} before='{}' after='{}'",
                        rule.getName(), field, current, rewritten);
            }
            current = rewritten;
        }
        return WHITESPACE_RUN.matcher(current.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    public boolean areEquivalent(String a, String b, FieldType field) {
        return normalize(a, field).equals(normalize(b, field));
    }
}
