package com.example.gsiprojection.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Constants of the three benchmark trajectories. All rates are annual decimals.
 */
@Component
@ConfigurationProperties(prefix = "gsi.benchmark")
public class BenchmarkProperties {

    // Tracking cost of the index fund (3 bps)
    private double indexDrag = 0.0003;
    // Leverage of the private-equity proxy over the net index rate
    private double peBeta = 1.2;
    private double peMgmtFee = 0.015;
    // Share of final profit kept by the PE sponsor
    private double peCarry = 0.20;
    private double bondRate = 0.062;

    public double getIndexDrag() { return indexDrag; }
    public void setIndexDrag(double indexDrag) { this.indexDrag = indexDrag; }

    public double getPeBeta() { return peBeta; }
    public void setPeBeta(double peBeta) { this.peBeta = peBeta; }

    public double getPeMgmtFee() { return peMgmtFee; }
    public void setPeMgmtFee(double peMgmtFee) { this.peMgmtFee = peMgmtFee; }

    public double getPeCarry() { return peCarry; }
    public void setPeCarry(double peCarry) { this.peCarry = peCarry; }

    public double getBondRate() { return bondRate; }
    public void setBondRate(double bondRate) { this.bondRate = bondRate; }
}
