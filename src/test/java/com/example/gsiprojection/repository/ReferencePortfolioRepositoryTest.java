package com.example.gsiprojection.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.gsiprojection.config.ReferencePortfolioProperties;
import com.example.gsiprojection.domain.CreditPosition;
import com.example.gsiprojection.domain.OptionPosition;
import com.example.gsiprojection.domain.PositionKind;
import com.example.gsiprojection.domain.ReferencePortfolio;
import com.example.gsiprojection.exception.ProjectionValidationException;
import com.example.gsiprojection.service.ProjectionFixtures;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReferencePortfolioRepositoryTest {

    @Test
    void buildsTaggedPositionsInConfiguredOrder() {
        ReferencePortfolio portfolio =
                new ReferencePortfolioRepository(ProjectionFixtures.referenceProperties()).get();

        assertThat(portfolio.getMasterCostBasis()).isEqualTo(7289316.47);
        assertThat(portfolio.getPositions())
                .extracting(p -> p.kind())
                .containsExactly(PositionKind.CREDIT, PositionKind.OPTION);
        assertThat(portfolio.getPositions().get(0)).isEqualTo(new CreditPosition(3489323.60, 3489323.60));
        assertThat(portfolio.getPositions().get(1)).isEqualTo(
                new OptionPosition(3799992.87, 3126483.16, 563.22, 33871, LocalDate.of(2036, 1, 15)));
    }

    @Test
    void optionWithoutStrike_isRejected() {
        ReferencePortfolioProperties.Position option = new ReferencePortfolioProperties.Position();
        option.setType(PositionKind.OPTION);
        option.setCurrentValue(100);
        option.setQuantity(10.0);
        ReferencePortfolioProperties properties = new ReferencePortfolioProperties();
        properties.setMasterCostBasis(100);
        properties.setPositions(List.of(option));

        assertThatThrownBy(() -> new ReferencePortfolioRepository(properties))
                .isInstanceOf(ProjectionValidationException.class)
                .hasMessageContaining("strike");
    }

    @Test
    void positionWithoutType_isRejected() {
        ReferencePortfolioProperties properties = new ReferencePortfolioProperties();
        properties.setMasterCostBasis(100);
        properties.setPositions(List.of(new ReferencePortfolioProperties.Position()));

        assertThatThrownBy(() -> new ReferencePortfolioRepository(properties))
                .isInstanceOf(ProjectionValidationException.class);
    }
}
