package com.example.gsiprojection.service;

// Benchmark values at one quarter; all three start at the investment
public record BenchmarkPoint(int index, double spx, double pe, double bonds) {}
