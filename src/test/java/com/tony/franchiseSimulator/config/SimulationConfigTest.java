package com.tony.franchiseSimulator.config;

import com.tony.franchiseSimulator.service.RandomSource;
import org.apache.commons.math3.random.MersenneTwister;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class SimulationConfigTest {

    private static final long SEED = 2024L;
    private static final int THREADS = 8;
    private static final int DRAWS_PER_THREAD = 5_000;

    @Test
    @DisplayName("Graine fixée : même suite de tirages que le MersenneTwister seul")
    void seededSourceIsReproducible() {
        RandomSource source = new SimulationConfig().randomSource(seeded());
        MersenneTwister reference = new MersenneTwister(SEED);

        for (int i = 0; i < 100; i++) {
            assertThat(source.next()).isEqualTo(reference.nextDouble());
        }
    }

    @Test
    @DisplayName("Tirages concurrents : aucune valeur perdue ni dupliquée par rapport à la suite séquentielle")
    void concurrentDrawsConsumeTheSequenceExactlyOnce() throws Exception {
        // ARRANGE
        RandomSource shared = new SimulationConfig().randomSource(seeded());
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        List<Callable<List<Double>>> tasks = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            tasks.add(() -> {
                List<Double> draws = new ArrayList<>(DRAWS_PER_THREAD);
                for (int i = 0; i < DRAWS_PER_THREAD; i++) {
                    draws.add(shared.next());
                }
                return draws;
            });
        }

        // ACT
        List<Double> concurrent = new ArrayList<>();
        try {
            for (Future<List<Double>> future : pool.invokeAll(tasks)) {
                concurrent.addAll(future.get());
            }
        } finally {
            pool.shutdownNow();
        }

        // ASSERT
        MersenneTwister reference = new MersenneTwister(SEED);
        List<Double> sequential = new ArrayList<>();
        for (int i = 0; i < THREADS * DRAWS_PER_THREAD; i++) {
            sequential.add(reference.nextDouble());
        }
        Collections.sort(concurrent);
        Collections.sort(sequential);
        assertThat(concurrent).isEqualTo(sequential);
    }

    private SimulationProperties seeded() {
        SimulationProperties properties = new SimulationProperties();
        properties.setRandomSeed(SEED);
        return properties;
    }
}
