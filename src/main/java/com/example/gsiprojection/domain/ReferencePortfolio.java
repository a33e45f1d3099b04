package com.example.gsiprojection.domain;

import java.util.List;

/**
 * Immutable reference portfolio the projection is scaled from.
 *
 * The master cost basis is the total amount invested at reference scale; a requested
 * investment is mapped onto the portfolio through the ratio investment / masterCostBasis.
 */
public class ReferencePortfolio {
    // Rows in their configured order; the last OPTION row supplies the weighted strike
    private final List<ReferencePosition> positions;
    // Sum of all cost bases at reference scale, must be strictly positive to scale against
    private final double masterCostBasis;

    public ReferencePortfolio(List<ReferencePosition> positions, double masterCostBasis) {
        this.positions = List.copyOf(positions);
        this.masterCostBasis = masterCostBasis;
    }

    /** @return positions in configured order */
    public List<ReferencePosition> getPositions() {
        return positions;
    }

    /** @return total cost basis at reference scale */
    public double getMasterCostBasis() {
        return masterCostBasis;
    }
}
