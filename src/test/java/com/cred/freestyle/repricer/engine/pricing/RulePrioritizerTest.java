package com.cred.freestyle.repricer.engine.pricing;

import com.cred.freestyle.repricer.domain.model.PricingRule;
import com.cred.freestyle.repricer.engine.state.RuleEvaluation;
import com.cred.freestyle.repricer.engine.state.RuleTransition;
import com.cred.freestyle.repricer.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for RulePrioritizer.
 */
@DisplayName("RulePrioritizer Tests")
class RulePrioritizerTest {

    private static RuleMatch match(String ruleId, int position, String condition, String threshold) {
        PricingRule rule = TestDataBuilder.rule(ruleId, position, condition, threshold, "increase_price", "absolute", "1");
        RuleEvaluation evaluation = RuleEvaluation.evaluated(rule, new RuleTransition(true, "matched", null));
        return new RuleMatch(rule, evaluation);
    }

    private static List<String> ids(List<RuleMatch> matches) {
        return matches.stream().map(m -> m.getRule().getRuleId()).collect(Collectors.toList());
    }

    @Test
    @DisplayName("selectWinner - less_than 10 beats less_than 20 regardless of declaration order")
    void selectWinner_SmallerLessThanThresholdWins() {
        // Given
        List<RuleMatch> applicable = List.of(
                match("lt20", 0, "less_than_abs", "20"),
                match("lt10", 1, "less_than_abs", "10"));

        // When
        RuleMatch winner = RulePrioritizer.selectWinner(applicable);

        // Then
        assertThat(winner.getRule().getRuleId()).isEqualTo("lt10");
        assertThat(winner.getReason()).isEqualTo("matched");
    }

    @Test
    @DisplayName("selectWinner - greater_than 100 beats greater_than 50")
    void selectWinner_LargerGreaterThanThresholdWins() {
        // Given
        List<RuleMatch> applicable = List.of(
                match("gt50", 0, "greater_than_abs", "50"),
                match("gt100", 1, "more_than_abs", "100"));

        // When / Then
        assertThat(RulePrioritizer.selectWinner(applicable).getRule().getRuleId()).isEqualTo("gt100");
    }

    @Test
    @DisplayName("prioritize - Families keep their slots, members reorder inside them")
    void prioritize_MixedFamilies_SlotsPreserved() {
        // Given
        List<RuleMatch> applicable = List.of(
                match("lt20", 0, "less_than_abs", "20"),
                match("gt5", 1, "greater_than_abs", "5"),
                match("lt10", 2, "less_than_abs", "10"),
                match("gt9", 3, "greater_than_abs", "9"));

        // When
        List<RuleMatch> ordered = RulePrioritizer.prioritize(applicable);

        // Then
        assertThat(ids(ordered)).containsExactly("lt10", "gt9", "lt20", "gt5");
    }

    @Test
    @DisplayName("prioritize - Equals and unknown rules keep declaration order")
    void prioritize_OtherFamilies_DeclarationOrder() {
        // Given
        List<RuleMatch> applicable = List.of(
                match("eq3", 2, "equals", "3"),
                match("eq1", 1, "equals", "1"),
                match("eq7", 0, "equals", "7"));

        // When
        List<RuleMatch> ordered = RulePrioritizer.prioritize(applicable);

        // Then
        assertThat(ids(ordered)).containsExactly("eq7", "eq1", "eq3");
    }

    @Test
    @DisplayName("prioritize - Equal thresholds are stable by position")
    void prioritize_EqualThresholds_Stable() {
        // Given
        List<RuleMatch> applicable = List.of(
                match("b", 1, "less_than_abs", "10"),
                match("a", 0, "less_than_abs", "10.0"));

        // When / Then
        assertThat(ids(RulePrioritizer.prioritize(applicable))).containsExactly("a", "b");
    }

    @Test
    @DisplayName("selectWinner - Empty input returns null")
    void selectWinner_Empty_Null() {
        assertThat(RulePrioritizer.selectWinner(Collections.emptyList())).isNull();
    }
}
