package com.example.gsiprojection.service;

import com.example.gsiprojection.exception.ProjectionValidationException;
import org.springframework.stereotype.Component;

/**
 * Multiple on invested capital and annualized return. The IRR here is the geometric mean
 * growth rate between the investment and the final value, not a cash-flow IRR.
 */
@Component
public class MetricsCalculator {

    public double moic(double finalValue, double investment) {
        if (!(investment > 0)) {
            throw new ProjectionValidationException("investment", investment, "Investment must be positive");
        }
        return finalValue / investment;
    }

    /** @return annualized return in percent, e.g. 7.5 for 7.5% */
    public double irrPercent(double moic, int years) {
        if (years <= 0) {
            throw new ProjectionValidationException("years", years, "Years must be positive");
        }
        return (Math.pow(moic, 1.0 / years) - 1.0) * 100.0;
    }
}
