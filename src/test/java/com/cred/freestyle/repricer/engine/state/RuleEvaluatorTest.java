package com.cred.freestyle.repricer.engine.state;

import com.cred.freestyle.repricer.config.EngineProperties;
import com.cred.freestyle.repricer.domain.model.Campaign;
import com.cred.freestyle.repricer.domain.model.PricingRule;
import com.cred.freestyle.repricer.domain.model.RuleExecutionState;
import com.cred.freestyle.repricer.domain.model.RuleExecutionState.RuleState;
import com.cred.freestyle.repricer.repository.RuleExecutionStateRepository;
import com.cred.freestyle.repricer.testutil.MutableClock;
import com.cred.freestyle.repricer.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RuleEvaluator, including the degraded fallback path.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RuleEvaluator Tests")
class RuleEvaluatorTest {

    @Mock
    private RuleExecutionStateRepository stateRepository;

    private RuleEvaluator ruleEvaluator;
    private PricingRule rule;
    private Campaign campaign;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2024-01-01T12:00:00Z");
        ruleEvaluator = new RuleEvaluator(stateRepository, clock, EngineProperties.defaults());
        rule = TestDataBuilder.rule("rule-1", 0, "less_than_abs", "10", "increase_price", "absolute", "5");
        campaign = TestDataBuilder.campaign("campaign-1", rule);
    }

    @Test
    @DisplayName("evaluate - Crossing with stored prior state executes and persists TRIGGERED")
    void evaluate_Crossing_ExecutesAndPersists() {
        // Given
        RuleExecutionState prior = RuleExecutionState.builder()
                .campaignId("campaign-1")
                .ruleId("rule-1")
                .variantId(TestDataBuilder.VARIANT_ID)
                .state(RuleState.INACTIVE)
                .lastInventoryValue(15)
                .triggerCount(0)
                .build();
        when(stateRepository.findByCampaignIdAndRuleIdAndVariantId("campaign-1", "rule-1", TestDataBuilder.VARIANT_ID))
                .thenReturn(Optional.of(prior));

        // When
        RuleEvaluation evaluation = ruleEvaluator.evaluate(rule, campaign, TestDataBuilder.snapshot(8, "20.00"));

        // Then
        assertThat(evaluation.isDegraded()).isFalse();
        assertThat(evaluation.shouldExecute()).isTrue();
        assertThat(evaluation.getReason()).contains("15 -> 8");

        ArgumentCaptor<RuleExecutionState> saved = ArgumentCaptor.forClass(RuleExecutionState.class);
        verify(stateRepository).save(saved.capture());
        assertThat(saved.getValue().getState()).isEqualTo(RuleState.TRIGGERED);
        assertThat(saved.getValue().getTriggerCount()).isEqualTo(1);
        assertThat(saved.getValue().getLastInventoryValue()).isEqualTo(8);
    }

    @Test
    @DisplayName("evaluate - Sustained condition does not execute")
    void evaluate_SustainedCondition_DoesNotExecute() {
        // Given
        RuleExecutionState prior = RuleExecutionState.builder()
                .campaignId("campaign-1")
                .ruleId("rule-1")
                .variantId(TestDataBuilder.VARIANT_ID)
                .state(RuleState.TRIGGERED)
                .lastInventoryValue(8)
                .triggerCount(1)
                .build();
        when(stateRepository.findByCampaignIdAndRuleIdAndVariantId(anyString(), anyString(), anyString()))
                .thenReturn(Optional.of(prior));

        // When
        RuleEvaluation evaluation = ruleEvaluator.evaluate(rule, campaign, TestDataBuilder.snapshot(7, "25.00"));

        // Then
        assertThat(evaluation.shouldExecute()).isFalse();
        assertThat(evaluation.getState().getTriggerCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("evaluate - Load failure falls back to a level check marked DEGRADED")
    void evaluate_LoadFailure_Degraded() {
        // Given
        when(stateRepository.findByCampaignIdAndRuleIdAndVariantId(anyString(), anyString(), anyString()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When
        RuleEvaluation evaluation = ruleEvaluator.evaluate(rule, campaign, TestDataBuilder.snapshot(8, "20.00"));

        // Then
        assertThat(evaluation.isDegraded()).isTrue();
        assertThat(evaluation.getMode()).isEqualTo(EvaluationMode.DEGRADED);
        assertThat(evaluation.shouldExecute()).isTrue();
        assertThat(evaluation.getReason()).startsWith(RuleEvaluation.FALLBACK_PREFIX);
        assertThat(evaluation.getError().getOperation()).isEqualTo("load");
        assertThat(evaluation.getError().getErrorType()).isEqualTo("DataAccessResourceFailureException");
        assertThat(evaluation.getState()).isNull();
        verify(stateRepository, never()).save(any());
    }

    @Test
    @DisplayName("evaluate - Save failure is DEGRADED; condition false means no execution")
    void evaluate_SaveFailure_DegradedConditionFalse() {
        // Given
        when(stateRepository.findByCampaignIdAndRuleIdAndVariantId(anyString(), anyString(), anyString()))
                .thenReturn(Optional.empty());
        when(stateRepository.save(any(RuleExecutionState.class)))
                .thenThrow(new DataAccessResourceFailureException("disk full"));

        // When
        RuleEvaluation evaluation = ruleEvaluator.evaluate(rule, campaign, TestDataBuilder.snapshot(25, "20.00"));

        // Then
        assertThat(evaluation.isDegraded()).isTrue();
        assertThat(evaluation.shouldExecute()).isFalse();
        assertThat(evaluation.getError().getOperation()).isEqualTo("save");
        assertThat(evaluation.getReason()).contains("is not");
    }
}
