package com.cred.freestyle.repricer.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for rule code resolution and condition matching.
 */
@DisplayName("PricingRule Tests")
class PricingRuleTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "less_than_abs,     LESS_THAN_ABS",
            "LESS_THAN_PCT,     LESS_THAN_PCT",
            "more_than_abs,     GREATER_THAN_ABS",
            "greater_than_abs,  GREATER_THAN_ABS",
            "more_than_pct,     GREATER_THAN_PCT",
            "equals,            EQUALS",
            "between,           UNKNOWN"
    })
    @DisplayName("WhenCondition.fromCode - Resolves codes and aliases")
    void whenConditionFromCode(String code, WhenCondition expected) {
        assertThat(WhenCondition.fromCode(code)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "increase_price, INCREASE",
            "reduce_price,   DECREASE",
            "decrease_price, DECREASE",
            "change_price,   SET",
            "set_price,      SET",
            "teleport,       UNKNOWN"
    })
    @DisplayName("ThenAction.fromCode - Resolves action codes")
    void thenActionFromCode(String code, ThenAction expected) {
        assertThat(ThenAction.fromCode(code)).isEqualTo(expected);
    }

    @Test
    @DisplayName("ThenMode.fromCode - Percentage spellings, anything else is fixed")
    void thenModeFromCode() {
        assertThat(ThenMode.fromCode("percentage")).isEqualTo(ThenMode.PERCENTAGE);
        assertThat(ThenMode.fromCode("percent")).isEqualTo(ThenMode.PERCENTAGE);
        assertThat(ThenMode.fromCode("absolute")).isEqualTo(ThenMode.FIXED);
        assertThat(ThenMode.fromCode(null)).isEqualTo(ThenMode.FIXED);
    }

    @Test
    @DisplayName("WhenCondition.matches - Strict comparisons against the threshold")
    void whenConditionMatches() {
        BigDecimal ten = BigDecimal.TEN;
        assertThat(WhenCondition.LESS_THAN_ABS.matches(9, ten)).isTrue();
        assertThat(WhenCondition.LESS_THAN_ABS.matches(10, ten)).isFalse();
        assertThat(WhenCondition.GREATER_THAN_ABS.matches(11, ten)).isTrue();
        assertThat(WhenCondition.GREATER_THAN_ABS.matches(10, ten)).isFalse();
        assertThat(WhenCondition.EQUALS.matches(10, ten)).isTrue();
        assertThat(WhenCondition.UNKNOWN.matches(10, ten)).isFalse();
    }

    @Test
    @DisplayName("Percentage conditions compare raw inventory like absolute ones")
    void percentageCondition_ComparesRawInventory() {
        assertThat(WhenCondition.LESS_THAN_PCT.matches(5, new BigDecimal("20"))).isTrue();
        assertThat(WhenCondition.LESS_THAN_PCT.matches(25, new BigDecimal("20"))).isFalse();
    }

    @Test
    @DisplayName("Decimal accessors treat unparsable values as zero")
    void decimalAccessors_Unparsable_Zero() {
        // Given
        PricingRule rule = PricingRule.builder()
                .whenValue("ten")
                .thenValue(" 5.5 ")
                .build();

        // When / Then
        assertThat(rule.whenValueAsDecimal()).isEqualByComparingTo("0");
        assertThat(rule.thenValueAsDecimal()).isEqualByComparingTo("5.5");
        assertThat(rule.shouldChangeCompareAt()).isFalse();
    }
}
