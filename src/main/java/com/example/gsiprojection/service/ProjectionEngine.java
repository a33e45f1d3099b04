package com.example.gsiprojection.service;

import com.example.gsiprojection.api.dto.ProjectionDtos.ProjectionInputs;
import com.example.gsiprojection.domain.ScaledState;
import com.example.gsiprojection.pricing.OptionPricer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Quarterly projection of the strategy.
 *
 * Every quarter is computed from the elapsed time and the initial scaled state only, never from
 * the previous quarter's output, so any single point can be recomputed in isolation.
 * Per quarter: grow spot and credit, re-price the option sleeve with a linearly shrinking
 * time to expiry, apply the management drag, then take carry on profit above the investment,
 * split between the sleeves in proportion to their values.
 */
@Component
public class ProjectionEngine {

    private static final Logger log = LoggerFactory.getLogger(ProjectionEngine.class);

    static final double QUARTER = 0.25;

    // Option pricer shared by every quarter (stateless)
    private final OptionPricer optionPricer;

    public ProjectionEngine(OptionPricer optionPricer) {
        this.optionPricer = optionPricer;
    }

    public List<QuarterPoint> project(ProjectionInputs in, ScaledState state) {
        int steps = in.steps();
        List<QuarterPoint> points = new ArrayList<>(steps + 1);
        points.add(initialPoint(in, state));
        for (int q = 1; q <= steps; q++) {
            points.add(quarter(in, state, q));
        }
        return points;
    }

    // Starting point: marks as supplied, no growth, no fees
    QuarterPoint initialPoint(ProjectionInputs in, ScaledState state) {
        double intrinsic = optionPricer.intrinsic(in.currentSpot(), state.weightedStrike()) * state.optionQuantity();
        return new QuarterPoint(0, 0.0, in.currentSpot(), state.creditValue(), state.optionValue(), intrinsic, 0.0);
    }

    QuarterPoint quarter(ProjectionInputs in, ScaledState state, int q) {
        double t = q * QUARTER;

        double spot = in.currentSpot() * Math.pow(1.0 + in.spxPriceReturn() / 100.0, t);
        double creditGross = state.creditValue() * Math.pow(1.0 + in.creditYield() / 100.0, t);

        // Reaches exactly 0 on the last quarter, where the pricer falls back to intrinsic
        double remaining = Math.max(0.0, in.years() - t);
        double optionGross = optionPricer.price(spot, state.weightedStrike(), remaining,
                in.riskFreeRate() / 100.0, in.volatility() / 100.0) * state.optionQuantity();
        double intrinsicGross = optionPricer.intrinsic(spot, state.weightedStrike()) * state.optionQuantity();

        double drag = Math.pow(1.0 - in.mgmtFee() / 100.0, t);
        double credit = creditGross * drag;
        double option = optionGross * drag;
        // same drag on the intrinsic line so it stays comparable with the priced line
        double intrinsic = intrinsicGross * drag;

        double carry = 0.0;
        double profit = (credit + option) - in.investment();
        if (profit > 0) {
            double combined = credit + option;
            if (combined > 0) {
                carry = profit * in.carryFee() / 100.0;
                double creditShare = credit / combined;
                double optionShare = 1.0 - creditShare;
                credit -= carry * creditShare;
                option -= carry * optionShare;
                intrinsic -= carry * optionShare;
            } else {
                log.debug("Skipping carry at quarter {}: combined sleeve value {} cannot be split", q, combined);
            }
        }

        return new QuarterPoint(q, t, spot, credit, option, intrinsic, carry);
    }
}
