package com.example.gsiprojection.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Chart axis labels ("Feb 26") for the quarterly grid, counted from today.
 */
@Component
public class PeriodLabeler {

    private static final DateTimeFormatter LABEL = DateTimeFormatter.ofPattern("MMM yy", Locale.US);

    private final Clock clock;

    public PeriodLabeler(Clock clock) {
        this.clock = clock;
    }

    public List<String> labels(int steps) {
        LocalDate start = LocalDate.now(clock);
        List<String> labels = new ArrayList<>(steps + 1);
        for (int q = 0; q <= steps; q++) {
            labels.add(start.plusMonths(3L * q).format(LABEL));
        }
        return labels;
    }
}
