package com.tony.franchiseSimulator.config;

import com.tony.franchiseSimulator.model.ScoutingAccuracy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "simulation")
@Data
public class SimulationProperties {
    // Graine optionnelle : null = tirages non reproductibles
    private Long randomSeed;

    private Draft draft = new Draft();
    private Scouting scouting = new Scouting();
    private Training training = new Training();
    private Finance finance = new Finance();
    private Progression progression = new Progression();
    private Season season = new Season();
    private Contracts contracts = new Contracts();

    @Data
    public static class Draft {
        private int totalPlayers = 800;
        private int rounds = 40;

        // --- Génération des prospects ---
        private double potentialMean = 50.0;
        private double potentialStdDev = 15.0;
        private int minRatingGap = 5;
        private int maxRatingGap = 20;
        private double toolStdDev = 8.0;
        private double injuryProneChance = 0.20;
        private int minHiddenTrait = 30;
        private int maxHiddenTrait = 70;

        // --- Classement médiatique ---
        private double mediaPotentialWeight = 0.75;
        private double mediaCurrentWeight = 0.25;
        private double mediaNoise = 8.0;
        private double mediaAgeNoisePerYear = 2.0;

        // --- Archétypes ---
        private int balancedHitterSpread = 12;
        private int balancedPitcherSpread = 8;
        private int strongToolThreshold = 55;
        private int rawTalentGap = 15;
    }

    @Data
    public static class Scouting {
        private ScoutingTier low = new ScoutingTier(2000, 15, 0.30);
        private ScoutingTier medium = new ScoutingTier(4000, 8, 0.60);
        private ScoutingTier high = new ScoutingTier(8000, 3, 0.90);

        // Chances indépendantes, une fois les traits débloqués
        private double injuryRevealChance = 0.5;
        private double coachabilityRevealChance = 0.7;
        private double clutchRevealChance = 0.5;

        public ScoutingTier forAccuracy(ScoutingAccuracy accuracy) {
            return switch (accuracy) {
                case LOW -> low;
                case MEDIUM -> medium;
                case HIGH -> high;
            };
        }
    }

    @Data
    public static class ScoutingTier {
        private long cost;
        private int errorBound;
        private double traitRevealChance;

        public ScoutingTier() {
        }

        public ScoutingTier(long cost, int errorBound, double traitRevealChance) {
            this.cost = cost;
            this.errorBound = errorBound;
            this.traitRevealChance = traitRevealChance;
        }
    }

    @Data
    public static class Training {
        private double baseXpPerGame = 2.0;
        private double injuredMultiplier = 0.25;
        private double reserveMultiplier = 0.7;
        // ±20% sur le gain final
        private double jitter = 0.2;

        private double poorWorkEthic = 0.6;
        private double averageWorkEthic = 1.0;
        private double excellentWorkEthic = 1.4;

        private double minProgressionRate = 0.5;
        private double maxProgressionRate = 2.0;
    }

    @Data
    public static class Finance {
        private double concessionPerFan = 12.0;
        private double parkingShare = 0.25;
        private double parkingPrice = 20.0;
        private double merchandisePerFan = 8.0;
        private double maintenanceRate = 0.05;
        private double debtInterestRate = 0.08;

        // Sponsoring (min / max par palier)
        private long localSponsorMin = 25_000L;
        private long localSponsorMax = 500_000L;
        private long regionalSponsorMin = 150_000L;
        private long regionalSponsorMax = 2_000_000L;
        private long nationalSponsorMin = 2_000_000L;
        private long nationalSponsorMax = 10_000_000L;

        // Ratios dette / budget annuel
        private double warningDebtRatio = 0.5;
        private double criticalDebtRatio = 1.0;
        private double imminentDebtRatio = 1.5;
        private double bankruptcyDebtRatio = 2.0;
    }

    @Data
    public static class Season {
        private int playoffTeams = 4;
        private double coachingWeight = 0.15;
        private double moraleWeight = 0.1;
        private double runsPerGame = 4.5;
        private double pythagoreanExponent = 2.0;

        // Bornes du pourcentage de victoires attendu
        private double minExpectedWinPct = 0.25;
        private double maxExpectedWinPct = 0.75;

        // Variance match par match
        private double gameVarianceStdDev = 0.03;
        private double gameVarianceBound = 0.08;
        private double minGameWinProbability = 0.15;
        private double maxGameWinProbability = 0.85;

        // Blessures (joueurs fragiles uniquement)
        private double injuryChance = 0.20;
        private int minGamesLost = 30;
        private int maxGamesLost = 60;
        private int gamesPerWeek = 6;
    }

    @Data
    public static class Contracts {
        // Plafond salarial = part du budget annuel du niveau
        private double salaryCapShare = 0.7;
        private double luxuryTaxFactor = 1.2;
    }

    @Data
    public static class Progression {
        private int promotionPrideBoost = 15;
    }
}
