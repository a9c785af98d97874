package com.cred.freestyle.repricer.engine.pricing;

import com.cred.freestyle.repricer.domain.model.PricingRule;
import com.cred.freestyle.repricer.domain.model.ThenAction;
import com.cred.freestyle.repricer.domain.model.ThenMode;
import com.cred.freestyle.repricer.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for PriceCalculator.
 */
@DisplayName("PriceCalculator Tests")
class PriceCalculatorTest {

    @ParameterizedTest(name = "{0} {1} {2} {3} on {4} = {5}")
    @CsvSource({
            "less_than_abs, increase_price, percentage, 10, 25.00, 27.50",
            "less_than_abs, increase_price, absolute,   5,  20.00, 25.00",
            "less_than_abs, reduce_price,   absolute,   10, 25.00, 15.00",
            "less_than_abs, reduce_price,   percentage, 15, 19.99, 16.99",
            "less_than_abs, reduce_price,   absolute,   20, 5.00,  0.00",
            "less_than_abs, change_price,   absolute,   12.5, 30.00, 12.50",
            "less_than_abs, change_price,   percentage, 80, 30.00, 24.00"
    })
    @DisplayName("computePrice - action and mode arithmetic")
    void computePrice_Arithmetic(String condition, String action, String mode, String value,
                                 String current, String expected) {
        // Given
        PricingRule rule = TestDataBuilder.rule(condition, "10", action, mode, value);

        // When
        BigDecimal result = PriceCalculator.computePrice(new BigDecimal(current), rule);

        // Then
        assertThat(result).isEqualByComparingTo(expected);
        assertThat(result.scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("computePrice - Rounds half up to cents")
    void computePrice_RoundsHalfUp() {
        // Given: 10.10 * 1.05 = 10.605
        PricingRule rule = TestDataBuilder.rule("less_than_abs", "10", "increase_price", "percentage", "5");

        // When
        BigDecimal result = PriceCalculator.computePrice(new BigDecimal("10.10"), rule);

        // Then
        assertThat(result).isEqualByComparingTo("10.61");
    }

    @Test
    @DisplayName("computePrice - Unknown action leaves the price unchanged")
    void computePrice_UnknownAction_Unchanged() {
        // Given
        PricingRule rule = TestDataBuilder.rule("less_than_abs", "10", "discount_everything", "absolute", "5");

        // When
        BigDecimal result = PriceCalculator.computePrice(new BigDecimal("20.00"), rule);

        // Then
        assertThat(result).isEqualByComparingTo("20.00");
    }

    @Test
    @DisplayName("apply - Percentage decrease beyond 100% floors at zero")
    void apply_PercentageBeyondHundred_FloorsAtZero() {
        // When
        BigDecimal result = PriceCalculator.apply(
                new BigDecimal("40.00"), ThenAction.DECREASE, ThenMode.PERCENTAGE, new BigDecimal("150"));

        // Then
        assertThat(result).isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("computeCompareAt - Null when the rule does not change compare-at prices")
    void computeCompareAt_RuleDoesNotChangeCompareAt_Null() {
        // Given
        PricingRule rule = TestDataBuilder.rule("less_than_abs", "10", "increase_price", "absolute", "5");

        // When / Then
        assertThat(PriceCalculator.computeCompareAt(new BigDecimal("30.00"), new BigDecimal("20.00"), rule)).isNull();
    }

    @Test
    @DisplayName("computeCompareAt - Applies the action to the existing compare-at price")
    void computeCompareAt_ExistingCompareAt() {
        // Given
        PricingRule rule = TestDataBuilder.rule("less_than_abs", "10", "increase_price", "percentage", "10");
        rule.setChangeCompareAt(true);

        // When
        BigDecimal result = PriceCalculator.computeCompareAt(new BigDecimal("30.00"), new BigDecimal("20.00"), rule);

        // Then
        assertThat(result).isEqualByComparingTo("33.00");
    }

    @Test
    @DisplayName("computeCompareAt - Falls back to the original price when there is no compare-at")
    void computeCompareAt_NoCompareAt_UsesOriginalPrice() {
        // Given
        PricingRule rule = TestDataBuilder.rule("less_than_abs", "10", "increase_price", "absolute", "5");
        rule.setChangeCompareAt(true);

        // When
        BigDecimal result = PriceCalculator.computeCompareAt(null, new BigDecimal("20.00"), rule);

        // Then
        assertThat(result).isEqualByComparingTo("25.00");
    }
}
