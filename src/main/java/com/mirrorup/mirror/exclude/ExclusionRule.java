package com.mirrorup.mirror.exclude;

import java.util.Locale;
import java.util.Optional;

/**
 * A single exclusion entry. Values are stored lowercase and compared against lowercase keys
 * derived from a mirror.
 */
public record ExclusionRule(Kind kind, String value, boolean negate) {

    public enum Kind {
        DOMAIN("domain"),
        COUNTRY("country"),
        COUNTRY_CODE("country_code");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        static Kind fromKeyword(String keyword) {
            for (Kind kind : values()) {
                if (kind.keyword.equals(keyword)) {
                    return kind;
                }
            }
            return null;
        }
    }

    public ExclusionRule {
        if (kind == null) {
            throw new IllegalArgumentException("Exclusion rule kind is required");
        }
        value = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    public static ExclusionRule domain(String value) {
        return new ExclusionRule(Kind.DOMAIN, value, false);
    }

    public static ExclusionRule country(String value) {
        return new ExclusionRule(Kind.COUNTRY, value, false);
    }

    public static ExclusionRule countryCode(String value) {
        return new ExclusionRule(Kind.COUNTRY_CODE, value, false);
    }

    public ExclusionRule negated() {
        return new ExclusionRule(kind, value, !negate);
    }

    /**
     * Parses one line of rule text. Blank and comment-only lines yield an empty result.
     *
     * @throws ExclusionRuleException when a keyworded rule has no value
     */
    public static Optional<ExclusionRule> parse(String rawLine) {
        if (rawLine == null) {
            return Optional.empty();
        }
        String line = stripComment(rawLine).trim().toLowerCase(Locale.ROOT);
        if (line.isEmpty()) {
            return Optional.empty();
        }

        boolean negate = false;
        if (line.startsWith("!")) {
            negate = true;
            line = line.substring(1).trim();
            if (line.isEmpty()) {
                throw new ExclusionRuleException("Negation marker without a rule");
            }
        }

        int eqIdx = line.indexOf('=');
        if (eqIdx > 0) {
            Kind kind = Kind.fromKeyword(line.substring(0, eqIdx).trim());
            if (kind != null) {
                String value = line.substring(eqIdx + 1).trim();
                if (value.isEmpty()) {
                    throw new ExclusionRuleException("Missing value for '" + kind.keyword() + "' rule");
                }
                return Optional.of(new ExclusionRule(kind, value, negate));
            }
        }
        // No recognized keyword: the whole token is a domain.
        return Optional.of(new ExclusionRule(Kind.DOMAIN, line, negate));
    }

    public boolean matches(String domain, String country, String countryCode) {
        String key = switch (kind) {
            case DOMAIN -> domain;
            case COUNTRY -> country;
            case COUNTRY_CODE -> countryCode;
        };
        return key != null && key.equals(value);
    }

    private static String stripComment(String line) {
        int idx = -1;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '#' || c == ';') {
                idx = i;
                break;
            }
        }
        return idx >= 0 ? line.substring(0, idx) : line;
    }

    @Override
    public String toString() {
        return (negate ? "!" : "") + kind.keyword() + "=" + value;
    }
}
