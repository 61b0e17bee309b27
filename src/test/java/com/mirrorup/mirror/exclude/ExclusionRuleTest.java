package com.mirrorup.mirror.exclude;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExclusionRuleTest {

    @Test
    void commentAndBlankLinesYieldNoRule() {
        assertThat(ExclusionRule.parse("# This is comment")).isEmpty();
        assertThat(ExclusionRule.parse(" # This is comment")).isEmpty();
        assertThat(ExclusionRule.parse("; This is comment")).isEmpty();
        assertThat(ExclusionRule.parse("")).isEmpty();
        assertThat(ExclusionRule.parse("   ")).isEmpty();
    }

    @Test
    void parsesKeywordedRulesWithOrWithoutSpacesAroundEquals() {
        assertThat(ExclusionRule.parse("domain=ban.this.mirror"))
            .contains(ExclusionRule.domain("ban.this.mirror"));
        assertThat(ExclusionRule.parse("domain=ban.this.mirror # Comment"))
            .contains(ExclusionRule.domain("ban.this.mirror"));
        assertThat(ExclusionRule.parse("domain = ban.this.mirror"))
            .contains(ExclusionRule.domain("ban.this.mirror"));
        assertThat(ExclusionRule.parse("domain = ban.this.mirror ; Comment"))
            .contains(ExclusionRule.domain("ban.this.mirror"));
        assertThat(ExclusionRule.parse("country = SomeCountry"))
            .contains(ExclusionRule.country("somecountry"));
        assertThat(ExclusionRule.parse("country_code = SC"))
            .contains(ExclusionRule.countryCode("sc"));
    }

    @Test
    void countryValuesMayContainSpaces() {
        assertThat(ExclusionRule.parse("country = United States"))
            .contains(ExclusionRule.country("united states"));
    }

    @Test
    void bareTokenIsADomainRule() {
        assertThat(ExclusionRule.parse("ban.this.mirror")).contains(ExclusionRule.domain("ban.this.mirror"));
        assertThat(ExclusionRule.parse("Ban.This.Mirror # Comment")).contains(ExclusionRule.domain("ban.this.mirror"));
    }

    @Test
    void leadingBangNegates() {
        assertThat(ExclusionRule.parse("!domain=keep.this.mirror"))
            .contains(ExclusionRule.domain("keep.this.mirror").negated());
        assertThat(ExclusionRule.parse("! country_code = DE"))
            .contains(ExclusionRule.countryCode("de").negated());
        assertThat(ExclusionRule.parse("!keep.this.mirror"))
            .contains(new ExclusionRule(ExclusionRule.Kind.DOMAIN, "keep.this.mirror", true));
    }

    @Test
    void keywordWithoutValueIsRejected() {
        assertThatThrownBy(() -> ExclusionRule.parse("country ="))
            .isInstanceOf(ExclusionRuleException.class)
            .hasMessageContaining("country");
        assertThatThrownBy(() -> ExclusionRule.parse("!"))
            .isInstanceOf(ExclusionRuleException.class);
    }

    @Test
    void matchesOnlyTheKeyOfItsKind() {
        ExclusionRule rule = ExclusionRule.countryCode("de");
        assertThat(rule.matches("de", "germany", "fr")).isFalse();
        assertThat(rule.matches("mirror.example", "germany", "de")).isTrue();
    }
}
