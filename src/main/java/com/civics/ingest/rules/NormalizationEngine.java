package com.civics.ingest.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies {@link NormalizationRule}s in priority order and finishes with lowercase,
 * trim and whitespace collapse.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules = new ArrayList<>();

    public NormalizationEngine() {
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        addRules(rules);
    }

    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    public String normalize(String value, RuleScope scope) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String result = value;
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(scope)) {
                String before = result;
                result = rule.apply(result);
                if (log.isTraceEnabled() && !before.equals(result)) {
                    log.trace("normalize.rule name={} before='{}' after='{}'", rule.getName(), before, result);
                }
            }
        }
        return result.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    public String normalizeName(String name) {
        return normalize(name, RuleScope.PERSON_NAME);
    }

    public String normalizeOffice(String office) {
        return normalize(office, RuleScope.OFFICE_TITLE);
    }
}
