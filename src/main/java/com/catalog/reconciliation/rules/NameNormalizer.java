package com.catalog.reconciliation.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps a display name to the comparison key used for matching.
 *
 * <p>Rules are applied in priority order, then the result is lower-cased,
 * whitespace runs are collapsed to one space and the ends are trimmed.
 * The default rule set removes every character that is not a letter, a digit or whitespace,
 * so {@code "Massage   Therapy!"} and {@code "massage therapy"} share the key
 * {@code "massage therapy"}.</p>
 *
 * <p>Normalization is total: null or blank input yields the empty string.
 * An empty key never matches anything, including another empty key.</p>
 */
public class NameNormalizer {
    private static final Logger log = LoggerFactory.getLogger(NameNormalizer.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final List<NormalizationRule> rules;

    public NameNormalizer() {
        this.rules = new ArrayList<>();
    }

    public NameNormalizer(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    /**
     * Creates a normalizer with the default catalog rules.
     */
    public static NameNormalizer createDefault() {
        return new NameNormalizer(defaultRules());
    }

    /**
     * Default rules: drop punctuation and symbols, keeping letters, digits and whitespace.
     */
    public static List<NormalizationRule> defaultRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("strip-special-chars")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement("")
                        .priority(100)
                        .build()
        );
    }

    /**
     * Adds a rule to the normalizer.
     */
    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    /**
     * Adds multiple rules to the normalizer.
     */
    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes a display name into its comparison key.
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

        return WHITESPACE.matcher(result.toLowerCase(Locale.ROOT))
                .replaceAll(" ")
                .strip();
    }

    /**
     * Checks if two names share a non-empty comparison key.
     */
    public boolean areEquivalent(String name1, String name2) {
        String normalized1 = normalize(name1);
        return !normalized1.isEmpty() && normalized1.equals(normalize(name2));
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
