package com.tony.franchiseSimulator.service;

import org.apache.commons.math3.random.RandomGenerator;

/** Adaptateur vers un générateur Commons Math (MersenneTwister par défaut). */
public class CommonsMathRandomSource implements RandomSource {

    private final RandomGenerator generator;

    public CommonsMathRandomSource(RandomGenerator generator) {
        this.generator = generator;
    }

    @Override
    public double next() {
        return generator.nextDouble();
    }
}
