package com.example.gsiprojection.service;

/**
 * Strategy values at one point of the quarterly grid, after management drag and carry.
 *
 * @param index     quarter number, 0 for the starting point
 * @param years     elapsed time in years (index * 0.25)
 * @param spot      projected underlying price
 * @param credit    credit sleeve value
 * @param option    option sleeve value, priced
 * @param intrinsic option sleeve at intrinsic, carrying the same drag and carry as {@code option}
 * @param carry     performance fee deducted at this point, 0 when there is no profit
 */
public record QuarterPoint(
        int index,
        double years,
        double spot,
        double credit,
        double option,
        double intrinsic,
        double carry
) {

    /** @return strategy value: credit plus priced option sleeve */
    public double total() {
        return credit + option;
    }
}
