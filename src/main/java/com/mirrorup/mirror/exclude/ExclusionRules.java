package com.mirrorup.mirror.exclude;

import com.mirrorup.mirror.model.MirrorRecord;
import com.mirrorup.mirror.util.MirrorUrls;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered, immutable set of exclusion rules. When several rules match a mirror the one defined
 * last decides, so a later rule can re-admit a mirror banned by an earlier, broader one.
 */
public class ExclusionRules {
    private final List<ExclusionRule> rules;

    public ExclusionRules(List<ExclusionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static ExclusionRules none() {
        return new ExclusionRules(List.of());
    }

    public List<ExclusionRule> getRules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public boolean isExcluded(MirrorRecord mirror) {
        if (rules.isEmpty() || mirror == null) {
            return false;
        }
        String domain = MirrorUrls.host(mirror.url());
        String country = lower(mirror.country());
        String countryCode = lower(mirror.countryCode());
        for (int i = rules.size() - 1; i >= 0; i--) {
            ExclusionRule rule = rules.get(i);
            if (rule.matches(domain, country, countryCode)) {
                return !rule.negate();
            }
        }
        return false;
    }

    /**
     * Returns a rule set whose rules follow this one's, giving {@code other} precedence.
     */
    public ExclusionRules then(ExclusionRules other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        List<ExclusionRule> merged = new ArrayList<>(rules);
        merged.addAll(other.rules);
        return new ExclusionRules(merged);
    }

    public static ExclusionRules of(Collection<String> literals) {
        List<ExclusionRule> parsed = new ArrayList<>();
        if (literals == null) {
            return new ExclusionRules(parsed);
        }
        for (String literal : literals) {
            try {
                ExclusionRule.parse(literal).ifPresent(parsed::add);
            } catch (ExclusionRuleException e) {
                throw new ExclusionRuleException("Invalid exclusion '" + literal + "': " + e.getMessage(), e);
            }
        }
        return new ExclusionRules(parsed);
    }

    public static ExclusionRules parse(String text) {
        if (text == null || text.isBlank()) {
            return none();
        }
        List<ExclusionRule> parsed = new ArrayList<>();
        String[] lines = text.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            Optional<ExclusionRule> rule;
            try {
                rule = ExclusionRule.parse(lines[i]);
            } catch (ExclusionRuleException e) {
                throw new ExclusionRuleException("Line " + (i + 1) + ": " + e.getMessage(), e);
            }
            rule.ifPresent(parsed::add);
        }
        return new ExclusionRules(parsed);
    }

    public static ExclusionRules fromFile(Path file) {
        if (file == null) {
            return none();
        }
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExclusionRuleException("Could not read excluded mirror file `" + file + "`", e);
        }
        try {
            return parse(text);
        } catch (ExclusionRuleException e) {
            throw new ExclusionRuleException("Invalid excluded mirror file `" + file + "`: " + e.getMessage(), e);
        }
    }

    private static String lower(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return rules.toString();
    }
}
