package com.example.gsiprojection.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

public class ProjectionDtos {
    // Primary input for a projection request. Rates and fees are percentages (8 means 8%)
    public record ProjectionInputs(
            @Positive double investment,
            @Positive double currentSpot,
            @DecimalMin(value = "-100", inclusive = false) double spxPriceReturn, // price-only annual growth
            double spxDivYield,
            @DecimalMin(value = "-100", inclusive = false) double creditYield,
            @PositiveOrZero double volatility,
            @PositiveOrZero @DecimalMax(value = "100", inclusive = false) double mgmtFee, // annual drag
            @DecimalMin("0") @DecimalMax("100") double carryFee, // share of profit above the investment
            double riskFreeRate,
            @Positive @Max(100) int years // quarters = years * 4
    ) {
        public int steps() {
            return years * 4;
        }
    }

    // Parallel arrays, one entry per quarter including t=0; all have length years * 4 + 1
    public record ProjectionSeries(
            List<String> labels,
            List<Double> gsi,       // strategy total value net of fees and carry
            List<Double> credit,    // credit sleeve net
            List<Double> options,   // option sleeve net, priced
            List<Double> intrinsic, // option sleeve at intrinsic, same fee and carry load as options
            List<Double> spx,
            List<Double> pe,
            List<Double> bonds
    ) {}

    // Summary figures derived from the final points of the series
    public record ProjectionMetrics(
            double initialNav,
            double initialNotional,
            double finalValue,
            double moic,
            double irr,        // percent per year
            double spxFinal,
            double spxMoic,
            double spxIrr      // percent per year
    ) {}

    // Top-level response: chart series + metrics
    public record ProjectionResult(
            ProjectionSeries series,
            ProjectionMetrics metrics
    ) {}
}
