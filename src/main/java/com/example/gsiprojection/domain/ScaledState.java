package com.example.gsiprojection.domain;

/**
 * Starting point of a projection: the reference portfolio resized to the requested investment.
 *
 * @param creditValue    credit sleeve value at t=0
 * @param optionValue    option sleeve value at t=0
 * @param optionQuantity number of contracts after scaling
 * @param weightedStrike single strike representing the whole option sleeve (not scaled)
 */
public record ScaledState(
        double creditValue,
        double optionValue,
        double optionQuantity,
        double weightedStrike
) {

    /** @return net asset value at t=0 (credit + option marks) */
    public double initialNav() {
        return creditValue + optionValue;
    }

    /** @return nominal exposure at t=0: credit value plus contracts times spot */
    public double initialNotional(double spot) {
        return creditValue + optionQuantity * spot;
    }
}
