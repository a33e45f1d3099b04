package com.example.gsiprojection.domain;

/**
 * One row of the reference portfolio. Implementations are immutable and tagged by {@link #kind()}
 * so the scaler can fold over a mixed list without instanceof checks.
 */
public interface ReferencePosition {

    /** @return sleeve this row contributes to */
    PositionKind kind();

    /** @return amount originally paid for the row, at reference scale */
    double costBasis();

    /** @return marked value of the row today, at reference scale */
    double currentValue();
}
