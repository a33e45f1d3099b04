package com.example.gsiprojection.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

// Option sleeve row: contracts held at a single strike, expiring on expirationDate
public record OptionPosition(
        double costBasis,
        double currentValue,
        double strike,
        double quantity,
        LocalDate expirationDate
) implements ReferencePosition {

    @Override
    @JsonProperty("type")
    public PositionKind kind() {
        return PositionKind.OPTION;
    }
}
