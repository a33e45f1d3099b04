package com.example.gsiprojection.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

// Credit sleeve row: only cost basis and current value matter
public record CreditPosition(double costBasis, double currentValue) implements ReferencePosition {

    @Override
    @JsonProperty("type")
    public PositionKind kind() {
        return PositionKind.CREDIT;
    }
}
