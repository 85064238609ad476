package com.tony.franchiseSimulator.config;

import com.tony.franchiseSimulator.service.CommonsMathRandomSource;
import com.tony.franchiseSimulator.service.RandomSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.SynchronizedRandomGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class SimulationConfig {

    @Bean
    public TierCatalog tierCatalog() {
        return TierCatalog.defaults();
    }

    @Bean
    public AiTeamCatalog aiTeamCatalog() {
        return AiTeamCatalog.defaults();
    }

    /**
     * Source partagée par toutes les requêtes : le MersenneTwister n'étant pas thread-safe,
     * il est enveloppé dans un générateur synchronisé.
     */
    @Bean
    public RandomSource randomSource(SimulationProperties properties) {
        MersenneTwister generator;
        if (properties.getRandomSeed() != null) {
            log.info("🎲 Aléatoire reproductible (graine {})", properties.getRandomSeed());
            generator = new MersenneTwister(properties.getRandomSeed());
        } else {
            generator = new MersenneTwister();
        }
        return new CommonsMathRandomSource(new SynchronizedRandomGenerator(generator));
    }
}
