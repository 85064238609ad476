package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.model.*;
import com.tony.franchiseSimulator.model.result.BatchTrainingResult;
import com.tony.franchiseSimulator.model.result.TrainingProjection;
import com.tony.franchiseSimulator.model.result.TrainingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Progression des joueurs au fil des matchs : gain d'XP multi-facteurs, puis +1 sur un outil tous les 100 XP.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrainingService {

    public static final int XP_PER_LEVEL = 100;
    private static final int NO_LEVEL_UP_ESTIMATE = 999;
    private static final int MIN_ROOM_FOR_RECOMMENDATION = 5;

    private final RatingSampler sampler;
    private final SimulationProperties properties;
    private final RandomSource randomSource;

    public TrainingResult processPlayerTraining(Player player, DistrictBonuses bonuses, FacilityLevel facility,
                                                int gamesSimulated) {
        return processPlayerTraining(player, bonuses, facility, gamesSimulated, randomSource);
    }

    public TrainingResult processPlayerTraining(Player player, DistrictBonuses bonuses, FacilityLevel facility,
                                                int gamesSimulated, RandomSource random) {
        if (gamesSimulated < 0) {
            throw new IllegalArgumentException("Nombre de matchs négatif : " + gamesSimulated);
        }

        double jitter = properties.getTraining().getJitter();
        double expected = expectedXp(player, bonuses, facility, gamesSimulated);
        int xpGained = (int) Math.max(0, Math.round(expected * (1.0 + sampler.uniform(-jitter, jitter, random))));

        int previousXp = player.getCurrentXp();
        int total = previousXp + xpGained;

        TrainingResult.TrainingResultBuilder result = TrainingResult.builder()
                .playerId(player.getId())
                .previousXp(previousXp)
                .xpGained(xpGained);

        if (total < XP_PER_LEVEL) {
            return result.newXp(total).leveledUp(false).build();
        }

        // Une seule progression par appel : le reliquat reste sous le seuil
        int remainder = Math.min(total - XP_PER_LEVEL, XP_PER_LEVEL - 1);
        Tool tool = selectToolToImprove(player);
        int previousValue = player.getAttribute(tool);
        int newValue = Math.min(RatingSampler.MAX_RATING, previousValue + 1);

        log.debug("⬆️ {} : {} {} -> {}", player.getId(), tool, previousValue, newValue);
        return result.newXp(remainder)
                .leveledUp(true)
                .attributeImproved(tool)
                .previousValue(previousValue)
                .newValue(newValue)
                .build();
    }

    /**
     * XP attendue avant la variation aléatoire finale.
     */
    public double expectedXp(Player player, DistrictBonuses bonuses, FacilityLevel facility, int gamesSimulated) {
        SimulationProperties.Training cfg = properties.getTraining();
        DistrictBonuses district = bonuses != null ? bonuses : DistrictBonuses.neutral();
        FacilityLevel level = facility != null ? facility : FacilityLevel.BASIC;

        double xp = cfg.getBaseXpPerGame() * gamesSimulated;
        xp *= ageMultiplier(player.getAge());
        xp *= moraleMultiplier(player.getMorale());
        xp *= workEthicMultiplier(player.getHiddenTraits());
        xp *= level.getTrainingMultiplier();
        if (player.isInjured()) xp *= cfg.getInjuredMultiplier();
        if (player.getRosterStatus() == RosterStatus.RESERVE) xp *= cfg.getReserveMultiplier();
        xp *= district.trainingMultiplier();
        xp *= player.getProgressionRate();
        return xp;
    }

    private double ageMultiplier(int age) {
        if (age <= 21) return 1.5;
        if (age <= 25) return 1.2;
        if (age <= 28) return 1.0;
        return 0.6;
    }

    private double moraleMultiplier(int morale) {
        if (morale <= 30) return 0.7;
        if (morale <= 60) return 1.0;
        return 1.2;
    }

    private double workEthicMultiplier(HiddenTraits traits) {
        SimulationProperties.Training cfg = properties.getTraining();
        if (traits == null || traits.workEthic() == null) return cfg.getAverageWorkEthic();
        return switch (traits.workEthic()) {
            case POOR -> cfg.getPoorWorkEthic();
            case AVERAGE -> cfg.getAverageWorkEthic();
            case EXCELLENT -> cfg.getExcellentWorkEthic();
        };
    }

    /**
     * Outil ciblé par l'axe de travail. En OVERALL (ou si l'axe ne correspond pas au type du joueur),
     * l'outil le plus éloigné du potentiel ; à égalité, le premier dans l'ordre d'entraînement du type.
     */
    public Tool selectToolToImprove(Player player) {
        TrainingFocus focus = player.getTrainingFocus() != null ? player.getTrainingFocus() : TrainingFocus.OVERALL;
        if (focus.tool().isPresent() && focus.tool().get().belongsTo(player.getPlayerType())) {
            return focus.tool().get();
        }

        Tool best = null;
        int bestRoom = Integer.MIN_VALUE;
        for (Tool tool : player.getPlayerType().trainingOrder()) {
            int room = player.getPotential() - player.getAttribute(tool);
            if (room > bestRoom) {
                bestRoom = room;
                best = tool;
            }
        }
        return best;
    }

    /** Copie du joueur avec l'XP et l'outil mis à jour. */
    public Player applyTraining(Player player, TrainingResult result) {
        Map<Tool, Integer> attributes = new EnumMap<>(Tool.class);
        attributes.putAll(player.getAttributes());
        if (result.isLeveledUp() && result.getAttributeImproved() != null) {
            attributes.put(result.getAttributeImproved(), result.getNewValue());
        }
        return player.toBuilder()
                .currentXp(result.getNewXp())
                .attributes(attributes)
                .build();
    }

    public BatchTrainingResult processBatchTraining(List<Player> players, DistrictBonuses bonuses,
                                                    FacilityLevel facility, int gamesSimulated) {
        return processBatchTraining(players, bonuses, facility, gamesSimulated, randomSource);
    }

    public BatchTrainingResult processBatchTraining(List<Player> players, DistrictBonuses bonuses,
                                                    FacilityLevel facility, int gamesSimulated, RandomSource random) {
        List<TrainingResult> results = new ArrayList<>();
        List<Player> updated = new ArrayList<>();
        int totalXp = 0;
        int leveledUp = 0;

        for (Player player : players) {
            if (!player.isOnRoster()) {
                updated.add(player);
                continue;
            }
            TrainingResult result = processPlayerTraining(player, bonuses, facility, gamesSimulated, random);
            results.add(result);
            updated.add(applyTraining(player, result));
            totalXp += result.getXpGained();
            if (result.isLeveledUp()) leveledUp++;
        }

        log.info("🏋️ Entraînement sur {} matchs : {} joueurs, {} XP, {} progressions",
                gamesSimulated, results.size(), totalXp, leveledUp);
        return new BatchTrainingResult(results, updated, totalXp, leveledUp);
    }

    /**
     * Multiplicateur caché de vitesse de développement, calculé une fois à la création
     * puis à chaque intersaison.
     */
    public double calculateProgressionRate(int age, int potential, int currentRating) {
        double ageFactor;
        if (age <= 21) ageFactor = 1.5;
        else if (age <= 25) ageFactor = 1.2;
        else if (age <= 28) ageFactor = 1.0;
        else ageFactor = 0.7;

        double potentialFactor;
        if (potential >= 70) potentialFactor = 1.3;
        else if (potential >= 60) potentialFactor = 1.1;
        else if (potential >= 50) potentialFactor = 1.0;
        else potentialFactor = 0.8;

        int gap = potential - currentRating;
        double ceilingFactor;
        if (gap >= 15) ceilingFactor = 1.2;
        else if (gap >= 10) ceilingFactor = 1.0;
        else if (gap >= 5) ceilingFactor = 0.8;
        else ceilingFactor = 0.5;

        SimulationProperties.Training cfg = properties.getTraining();
        double rate = ageFactor * potentialFactor * ceilingFactor;
        return Math.round(Math.max(cfg.getMinProgressionRate(), Math.min(cfg.getMaxProgressionRate(), rate)) * 100.0) / 100.0;
    }

    /**
     * Outil au meilleur rapport marge × rareté ; OVERALL si aucun outil n'a plus de 5 points de marge.
     */
    public TrainingFocus recommendTrainingFocus(Player player) {
        Tool best = null;
        double bestScore = 0.0;
        for (Tool tool : player.getPlayerType().trainingOrder()) {
            int value = player.getAttribute(tool);
            int room = player.getPotential() - value;
            if (room <= MIN_ROOM_FOR_RECOMMENDATION) continue;
            double score = room * (100.0 - value) / 100.0;
            if (score > bestScore) {
                bestScore = score;
                best = tool;
            }
        }
        return best != null ? TrainingFocus.of(best) : TrainingFocus.OVERALL;
    }

    public TrainingProjection projectTraining(Player player, DistrictBonuses bonuses, FacilityLevel facility) {
        double perGame = expectedXp(player, bonuses, facility, 1);
        int gamesToLevel = perGame > 0
                ? (int) Math.ceil((XP_PER_LEVEL - player.getCurrentXp()) / perGame)
                : NO_LEVEL_UP_ESTIMATE;
        return new TrainingProjection(player.getId(), Math.round(perGame * 100.0) / 100.0, gamesToLevel,
                player.getProgressionRate(), recommendTrainingFocus(player));
    }
}
