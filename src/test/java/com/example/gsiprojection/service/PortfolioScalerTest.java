package com.example.gsiprojection.service;

import static com.example.gsiprojection.service.ProjectionFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.example.gsiprojection.domain.CreditPosition;
import com.example.gsiprojection.domain.OptionPosition;
import com.example.gsiprojection.domain.ReferencePortfolio;
import com.example.gsiprojection.domain.ScaledState;
import com.example.gsiprojection.exception.ProjectionValidationException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PortfolioScalerTest {

    private PortfolioScaler scaler;

    @BeforeEach
    void setUp() {
        scaler = new PortfolioScaler();
    }

    @Test
    void investmentEqualToMasterCostBasis_reproducesReferenceValues() {
        ScaledState state = scaler.scale(referencePortfolio(), MASTER_COST_BASIS);

        assertThat(state.creditValue()).isCloseTo(CREDIT_VALUE, within(1e-6));
        assertThat(state.optionValue()).isCloseTo(OPTION_VALUE, within(1e-6));
        assertThat(state.optionQuantity()).isCloseTo(QUANTITY, within(1e-9));
        assertThat(state.weightedStrike()).isEqualTo(STRIKE);
        assertThat(state.initialNav()).isCloseTo(CREDIT_VALUE + OPTION_VALUE, within(1e-6));
        assertThat(state.initialNotional(STRIKE)).isCloseTo(CREDIT_VALUE + QUANTITY * STRIKE, within(1e-6));
    }

    @Test
    void halfInvestment_halvesValuesAndQuantityButNotStrike() {
        ScaledState state = scaler.scale(referencePortfolio(), MASTER_COST_BASIS / 2);

        assertThat(state.creditValue()).isCloseTo(CREDIT_VALUE / 2, within(1e-6));
        assertThat(state.optionValue()).isCloseTo(OPTION_VALUE / 2, within(1e-6));
        assertThat(state.optionQuantity()).isCloseTo(QUANTITY / 2, within(1e-9));
        assertThat(state.weightedStrike()).isEqualTo(STRIKE);
    }

    @Test
    void multipleRows_accumulateByKindAndLastStrikeWins() {
        ReferencePortfolio portfolio = new ReferencePortfolio(List.of(
                new CreditPosition(100, 110),
                new OptionPosition(50, 40, 500, 10, null),
                new CreditPosition(200, 190),
                new OptionPosition(50, 60, 550, 30, null)
        ), 400);

        ScaledState state = scaler.scale(portfolio, 800);

        assertThat(state.creditValue()).isCloseTo(600, within(1e-9));
        assertThat(state.optionValue()).isCloseTo(200, within(1e-9));
        assertThat(state.optionQuantity()).isCloseTo(80, within(1e-9));
        assertThat(state.weightedStrike()).isEqualTo(550);
    }

    @Test
    void nonPositiveMasterCostBasis_isRejected() {
        ReferencePortfolio portfolio = new ReferencePortfolio(referencePortfolio().getPositions(), 0);

        assertThatThrownBy(() -> scaler.scale(portfolio, 1_000_000))
                .isInstanceOf(ProjectionValidationException.class)
                .hasMessageContaining("Master cost basis");
    }

    @Test
    void nonPositiveInvestment_isRejected() {
        assertThatThrownBy(() -> scaler.scale(referencePortfolio(), -1))
                .isInstanceOf(ProjectionValidationException.class)
                .hasMessageContaining("Investment");
    }

    @Test
    void portfolioWithoutOption_isRejected() {
        ReferencePortfolio creditOnly = new ReferencePortfolio(List.of(new CreditPosition(100, 100)), 100);

        assertThatThrownBy(() -> scaler.scale(creditOnly, 100))
                .isInstanceOf(ProjectionValidationException.class)
                .hasMessageContaining("OPTION");
    }

    @Test
    void nonPositiveStrike_isRejectedBeforeScaling() {
        ReferencePortfolio zeroStrike = new ReferencePortfolio(List.of(
                new CreditPosition(100, 100),
                new OptionPosition(100, 80, 0, 10, null)
        ), 200);

        assertThatThrownBy(() -> scaler.scale(zeroStrike, 200))
                .isInstanceOf(ProjectionValidationException.class)
                .hasMessageContaining("strike")
                .satisfies(e -> assertThat(((ProjectionValidationException) e).getDetails())
                        .containsKey("strike"));
    }

    @Test
    void negativeQuantity_isRejectedBeforeScaling() {
        ReferencePortfolio shortOptions = new ReferencePortfolio(List.of(
                new CreditPosition(100, 100),
                new OptionPosition(100, 80, 500, -10, null)
        ), 200);

        assertThatThrownBy(() -> scaler.scale(shortOptions, 200))
                .isInstanceOf(ProjectionValidationException.class)
                .hasMessageContaining("quantity");
    }
}
