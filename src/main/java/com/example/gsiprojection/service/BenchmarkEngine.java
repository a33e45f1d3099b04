package com.example.gsiprojection.service;

import com.example.gsiprojection.api.dto.ProjectionDtos.ProjectionInputs;
import com.example.gsiprojection.config.BenchmarkProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference trajectories on the same quarterly grid as the strategy:
 * an index fund (total return less a small drag), a leveraged private-equity proxy
 * (management fee, then a single carry on profit) and a fixed-rate bond.
 * Each point is a closed-form function of elapsed time.
 */
@Component
public class BenchmarkEngine {

    private final BenchmarkProperties properties;

    public BenchmarkEngine(BenchmarkProperties properties) {
        this.properties = properties;
    }

    public List<BenchmarkPoint> project(ProjectionInputs in) {
        int steps = in.steps();
        List<BenchmarkPoint> points = new ArrayList<>(steps + 1);
        points.add(new BenchmarkPoint(0, in.investment(), in.investment(), in.investment()));
        for (int q = 1; q <= steps; q++) {
            points.add(quarter(in, q));
        }
        return points;
    }

    BenchmarkPoint quarter(ProjectionInputs in, int q) {
        double t = q * ProjectionEngine.QUARTER;
        double investment = in.investment();

        double spx = investment * Math.pow(1.0 + indexNetRate(in), t);

        double pe = investment * Math.pow(1.0 + peNetRate(in), t);
        double peProfit = pe - investment;
        if (peProfit > 0) {
            pe -= peProfit * properties.getPeCarry();
        }

        double bonds = investment * Math.pow(1.0 + properties.getBondRate(), t);
        return new BenchmarkPoint(q, spx, pe, bonds);
    }

    /** @return annual index growth: price return plus dividends, less the fund drag */
    public double indexNetRate(ProjectionInputs in) {
        return (in.spxPriceReturn() + in.spxDivYield()) / 100.0 - properties.getIndexDrag();
    }

    /** @return annual PE proxy growth before carry: levered index rate less management fee */
    public double peNetRate(ProjectionInputs in) {
        return indexNetRate(in) * properties.getPeBeta() - properties.getPeMgmtFee();
    }
}
