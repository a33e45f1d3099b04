package com.example.gsiprojection.domain;

/**
 * Identifies which sleeve of the structured investment a reference position belongs to.
 * CREDIT: fixed-income-like sleeve growing at the credit yield.
 * OPTION: leveraged call-option sleeve re-priced every quarter.
 */
public enum PositionKind {
    CREDIT, // grows at creditYield
    OPTION  // re-priced with the option pricer
}
