package com.tony.franchiseSimulator.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Primitives d'échantillonnage partagées par tous les générateurs.
 * Sans état : l'aléatoire est toujours fourni par l'appelant.
 */
@Component
public class RatingSampler {

    public static final int MIN_RATING = 20;
    public static final int MAX_RATING = 80;

    /**
     * Note entière tirée d'une loi normale (mean, stdDev), bornée à [20, 80].
     */
    public int sample(double mean, double stdDev, RandomSource random) {
        return clampRating((int) Math.round(normal(mean, stdDev, random)));
    }

    /**
     * Transformation de Box-Muller. Un premier tirage nul est rejeté (log(0) indéfini).
     */
    public double normal(double mean, double stdDev, RandomSource random) {
        double u1 = random.next();
        while (u1 <= 0.0) {
            u1 = random.next();
        }
        double u2 = random.next();
        double z = Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2.0 * Math.PI * u2);
        return mean + z * stdDev;
    }

    /** Entier uniforme dans [min, max] (bornes incluses). */
    public int uniformInt(int min, int max, RandomSource random) {
        if (max < min) {
            throw new IllegalArgumentException("Intervalle vide : [" + min + ", " + max + "]");
        }
        int value = min + (int) Math.floor(random.next() * (max - min + 1));
        return Math.min(value, max);
    }

    /** Réel uniforme dans [min, max). */
    public double uniform(double min, double max, RandomSource random) {
        return min + random.next() * (max - min);
    }

    public boolean chance(double probability, RandomSource random) {
        return random.next() < probability;
    }

    /**
     * Tirage catégoriel pondéré. L'ordre d'itération de la map fixe l'ordre des classes
     * (utiliser une map ordonnée pour un résultat reproductible).
     */
    public <T> T weightedChoice(Map<T, Double> weights, RandomSource random) {
        if (weights.isEmpty()) {
            throw new IllegalArgumentException("Aucune catégorie à tirer");
        }
        double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        double roll = random.next() * total;
        T last = null;
        for (Map.Entry<T, Double> entry : weights.entrySet()) {
            last = entry.getKey();
            roll -= entry.getValue();
            if (roll < 0) {
                return entry.getKey();
            }
        }
        // Arrondi flottant : on retombe sur la dernière classe
        return last;
    }

    /** Mélange de Fisher-Yates, en place. */
    public <T> void shuffle(List<T> list, RandomSource random) {
        for (int i = list.size() - 1; i > 0; i--) {
            int j = (int) Math.floor(random.next() * (i + 1));
            T tmp = list.get(i);
            list.set(i, list.get(j));
            list.set(j, tmp);
        }
    }

    public static int clampRating(int value) {
        return Math.max(MIN_RATING, Math.min(MAX_RATING, value));
    }
}
