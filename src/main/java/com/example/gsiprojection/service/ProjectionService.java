package com.example.gsiprojection.service;

import com.example.gsiprojection.api.dto.ProjectionDtos.*;
import com.example.gsiprojection.domain.ReferencePortfolio;
import com.example.gsiprojection.domain.ScaledState;
import com.example.gsiprojection.exception.ProjectionValidationException;
import com.example.gsiprojection.repository.ReferencePortfolioRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Service
public class ProjectionService {

    private static final Logger log = LoggerFactory.getLogger(ProjectionService.class);

    // Configured reference portfolio, used when the caller does not supply one
    private final ReferencePortfolioRepository portfolioRepository;
    private final PortfolioScaler scaler;
    private final ProjectionEngine projectionEngine;
    private final BenchmarkEngine benchmarkEngine;
    private final MetricsCalculator metricsCalculator;
    private final PeriodLabeler periodLabeler;
    // Bean Validation for in-process callers that bypass the controller's @Valid
    private final Validator validator;

    public ProjectionService(ReferencePortfolioRepository portfolioRepository,
                             PortfolioScaler scaler,
                             ProjectionEngine projectionEngine,
                             BenchmarkEngine benchmarkEngine,
                             MetricsCalculator metricsCalculator,
                             PeriodLabeler periodLabeler,
                             Validator validator) {
        this.portfolioRepository = portfolioRepository;
        this.scaler = scaler;
        this.projectionEngine = projectionEngine;
        this.benchmarkEngine = benchmarkEngine;
        this.metricsCalculator = metricsCalculator;
        this.periodLabeler = periodLabeler;
        this.validator = validator;
    }

    public ProjectionResult project(ProjectionInputs inputs) {
        return project(inputs, portfolioRepository.get());
    }

    public ProjectionResult project(ProjectionInputs in, ReferencePortfolio portfolio) {
        // Reject bad inputs up front, nothing below runs on a partially valid request
        validate(in);
        ScaledState state = scaler.scale(portfolio, in.investment());
        log.debug("Scaled state for investment {}: {}", in.investment(), state);

        List<QuarterPoint> strategy = projectionEngine.project(in, state);
        List<BenchmarkPoint> benchmarks = benchmarkEngine.project(in);
        List<String> labels = periodLabeler.labels(in.steps());

        int size = strategy.size();
        List<Double> gsi = new ArrayList<>(size);
        List<Double> credit = new ArrayList<>(size);
        List<Double> options = new ArrayList<>(size);
        List<Double> intrinsic = new ArrayList<>(size);
        for (QuarterPoint p : strategy) {
            gsi.add(p.total());
            credit.add(p.credit());
            options.add(p.option());
            intrinsic.add(p.intrinsic());
        }
        List<Double> spx = new ArrayList<>(size);
        List<Double> pe = new ArrayList<>(size);
        List<Double> bonds = new ArrayList<>(size);
        for (BenchmarkPoint b : benchmarks) {
            spx.add(b.spx());
            pe.add(b.pe());
            bonds.add(b.bonds());
        }
        ProjectionSeries series = new ProjectionSeries(List.copyOf(labels), List.copyOf(gsi), List.copyOf(credit),
                List.copyOf(options), List.copyOf(intrinsic), List.copyOf(spx), List.copyOf(pe), List.copyOf(bonds));

        double finalValue = gsi.get(size - 1);
        double moic = metricsCalculator.moic(finalValue, in.investment());
        double spxFinal = spx.get(size - 1);
        double spxMoic = metricsCalculator.moic(spxFinal, in.investment());
        ProjectionMetrics metrics = new ProjectionMetrics(
                state.initialNav(),
                state.initialNotional(in.currentSpot()),
                finalValue,
                moic,
                metricsCalculator.irrPercent(moic, in.years()),
                spxFinal,
                spxMoic,
                metricsCalculator.irrPercent(spxMoic, in.years())
        );

        log.info("Projected {} quarters for investment {}: final {} (MOIC {}), index MOIC {}",
                in.steps(), in.investment(), finalValue, moic, spxMoic);
        return new ProjectionResult(series, metrics);
    }

    private void validate(ProjectionInputs in) {
        Set<ConstraintViolation<ProjectionInputs>> violations = validator.validate(in);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        // Fractional powers of a non-positive growth base are NaN
        double indexRate = benchmarkEngine.indexNetRate(in);
        if (!(1.0 + indexRate > 0)) {
            throw new ProjectionValidationException("spxPriceReturn", in.spxPriceReturn(),
                    "Index growth base must be positive, got net rate " + indexRate);
        }
        double peRate = benchmarkEngine.peNetRate(in);
        if (!(1.0 + peRate > 0)) {
            throw new ProjectionValidationException("spxPriceReturn", in.spxPriceReturn(),
                    "Private-equity proxy growth base must be positive, got net rate " + peRate);
        }
    }
}
