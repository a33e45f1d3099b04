package com.example.gsiprojection.service;

import com.example.gsiprojection.domain.OptionPosition;
import com.example.gsiprojection.domain.PositionKind;
import com.example.gsiprojection.domain.ReferencePortfolio;
import com.example.gsiprojection.domain.ReferencePosition;
import com.example.gsiprojection.domain.ScaledState;
import com.example.gsiprojection.exception.ProjectionValidationException;
import org.springframework.stereotype.Component;

/**
 * Resizes the reference portfolio to a requested investment. Every value and quantity is
 * multiplied by investment / masterCostBasis; the strike is a price and stays unscaled.
 */
@Component
public class PortfolioScaler {

    public ScaledState scale(ReferencePortfolio portfolio, double investment) {
        if (!(portfolio.getMasterCostBasis() > 0)) {
            throw new ProjectionValidationException("masterCostBasis", portfolio.getMasterCostBasis(),
                    "Master cost basis must be positive");
        }
        if (!(investment > 0)) {
            throw new ProjectionValidationException("investment", investment, "Investment must be positive");
        }
        boolean hasOption = false;
        for (ReferencePosition position : portfolio.getPositions()) {
            if (position.kind() == PositionKind.OPTION) {
                validateOption((OptionPosition) position);
                hasOption = true;
            }
        }
        if (!hasOption) {
            throw new ProjectionValidationException("Reference portfolio needs at least one OPTION position");
        }

        double ratio = investment / portfolio.getMasterCostBasis();
        ScaledState state = new ScaledState(0.0, 0.0, 0.0, 0.0);
        for (ReferencePosition position : portfolio.getPositions()) {
            state = accumulate(state, position, ratio);
        }
        return state;
    }

    // Strike feeds ln(S/K) every quarter; checked here so nothing is computed on a bad row
    private static void validateOption(OptionPosition option) {
        if (!(option.strike() > 0)) {
            throw new ProjectionValidationException("strike", option.strike(), "OPTION position strike must be positive");
        }
        if (!(option.quantity() >= 0)) {
            throw new ProjectionValidationException("quantity", option.quantity(),
                    "OPTION position quantity must not be negative");
        }
    }

    private static ScaledState accumulate(ScaledState acc, ReferencePosition position, double ratio) {
        return switch (position.kind()) {
            case CREDIT -> new ScaledState(
                    acc.creditValue() + position.currentValue() * ratio,
                    acc.optionValue(),
                    acc.optionQuantity(),
                    acc.weightedStrike());
            case OPTION -> {
                OptionPosition option = (OptionPosition) position;
                // last OPTION row wins: the sleeve is modelled with a single strike
                yield new ScaledState(
                        acc.creditValue(),
                        acc.optionValue() + option.currentValue() * ratio,
                        acc.optionQuantity() + option.quantity() * ratio,
                        option.strike());
            }
        };
    }
}
