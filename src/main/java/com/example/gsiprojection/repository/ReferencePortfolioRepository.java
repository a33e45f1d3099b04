package com.example.gsiprojection.repository;

import com.example.gsiprojection.config.ReferencePortfolioProperties;
import com.example.gsiprojection.domain.CreditPosition;
import com.example.gsiprojection.domain.OptionPosition;
import com.example.gsiprojection.domain.ReferencePortfolio;
import com.example.gsiprojection.domain.ReferencePosition;
import com.example.gsiprojection.exception.ProjectionValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
public class ReferencePortfolioRepository {

    private static final Logger log = LoggerFactory.getLogger(ReferencePortfolioRepository.class);

    // Built once from configuration at startup and never mutated afterwards
    private final ReferencePortfolio portfolio;

    public ReferencePortfolioRepository(ReferencePortfolioProperties properties) {
        List<ReferencePosition> positions = new ArrayList<>();
        for (ReferencePortfolioProperties.Position p : properties.getPositions()) {
            positions.add(toDomain(p));
        }
        this.portfolio = new ReferencePortfolio(positions, properties.getMasterCostBasis());
        log.info("Loaded reference portfolio: {} positions, master cost basis {}",
                positions.size(), properties.getMasterCostBasis());
    }

    // The configured reference portfolio used to scale every projection
    public ReferencePortfolio get() {
        return portfolio;
    }

    private static ReferencePosition toDomain(ReferencePortfolioProperties.Position p) {
        if (p.getType() == null) {
            throw new ProjectionValidationException("Reference position is missing its type");
        }
        return switch (p.getType()) {
            case CREDIT -> new CreditPosition(p.getCostBasis(), p.getCurrentValue());
            case OPTION -> {
                if (p.getStrike() == null || p.getQuantity() == null) {
                    throw new ProjectionValidationException("OPTION reference position needs strike and quantity");
                }
                yield new OptionPosition(p.getCostBasis(), p.getCurrentValue(),
                        p.getStrike(), p.getQuantity(), p.getExpirationDate());
            }
        };
    }
}
