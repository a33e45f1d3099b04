package com.example.gsiprojection.config;

import com.example.gsiprojection.domain.PositionKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Reference portfolio as configured under {@code gsi.reference}. Values are at reference scale;
 * a projection rescales them to the requested investment.
 */
@Component
@ConfigurationProperties(prefix = "gsi.reference")
public class ReferencePortfolioProperties {

    private double masterCostBasis;
    private List<Position> positions = new ArrayList<>();

    public double getMasterCostBasis() { return masterCostBasis; }
    public void setMasterCostBasis(double masterCostBasis) { this.masterCostBasis = masterCostBasis; }

    public List<Position> getPositions() { return positions; }
    public void setPositions(List<Position> positions) { this.positions = positions; }

    public static class Position {
        private PositionKind type;
        private double costBasis;
        private double currentValue;
        // OPTION rows only
        private Double strike;
        private Double quantity;
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate expirationDate;

        public PositionKind getType() { return type; }
        public void setType(PositionKind type) { this.type = type; }

        public double getCostBasis() { return costBasis; }
        public void setCostBasis(double costBasis) { this.costBasis = costBasis; }

        public double getCurrentValue() { return currentValue; }
        public void setCurrentValue(double currentValue) { this.currentValue = currentValue; }

        public Double getStrike() { return strike; }
        public void setStrike(Double strike) { this.strike = strike; }

        public Double getQuantity() { return quantity; }
        public void setQuantity(Double quantity) { this.quantity = quantity; }

        public LocalDate getExpirationDate() { return expirationDate; }
        public void setExpirationDate(LocalDate expirationDate) { this.expirationDate = expirationDate; }
    }
}
