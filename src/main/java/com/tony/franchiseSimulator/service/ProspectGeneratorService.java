package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Génération des classes de draft : notes, outils, traits cachés, classement médiatique et archétype.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProspectGeneratorService {

    private static final Map<Position, Double> POSITION_WEIGHTS = new LinkedHashMap<>();
    private static final Map<Integer, Double> AGE_WEIGHTS = new LinkedHashMap<>();
    private static final Map<WorkEthic, Double> WORK_ETHIC_WEIGHTS = new LinkedHashMap<>();
    private static final Map<Personality, Double> PERSONALITY_WEIGHTS = new LinkedHashMap<>();

    // Au-delà, le classement médiatique ne porte plus d'incertitude liée à l'âge
    private static final int OLDEST_PROSPECT_AGE = 22;

    static {
        POSITION_WEIGHTS.put(Position.SP, 0.25);
        POSITION_WEIGHTS.put(Position.RP, 0.15);
        POSITION_WEIGHTS.put(Position.C, 0.05);
        POSITION_WEIGHTS.put(Position.FIRST_BASE, 0.07);
        POSITION_WEIGHTS.put(Position.SECOND_BASE, 0.07);
        POSITION_WEIGHTS.put(Position.THIRD_BASE, 0.07);
        POSITION_WEIGHTS.put(Position.SS, 0.07);
        POSITION_WEIGHTS.put(Position.LF, 0.09);
        POSITION_WEIGHTS.put(Position.CF, 0.09);
        POSITION_WEIGHTS.put(Position.RF, 0.09);

        AGE_WEIGHTS.put(18, 0.15);
        AGE_WEIGHTS.put(19, 0.25);
        AGE_WEIGHTS.put(20, 0.30);
        AGE_WEIGHTS.put(21, 0.20);
        AGE_WEIGHTS.put(22, 0.10);

        WORK_ETHIC_WEIGHTS.put(WorkEthic.POOR, 0.20);
        WORK_ETHIC_WEIGHTS.put(WorkEthic.AVERAGE, 0.60);
        WORK_ETHIC_WEIGHTS.put(WorkEthic.EXCELLENT, 0.20);

        PERSONALITY_WEIGHTS.put(Personality.TEAM_PLAYER, 0.70);
        PERSONALITY_WEIGHTS.put(Personality.PRIMA_DONNA, 0.15);
        PERSONALITY_WEIGHTS.put(Personality.LEADER, 0.15);
    }

    private final RatingSampler sampler;
    private final NameGenerator nameGenerator;
    private final SimulationProperties properties;
    private final RandomSource randomSource;

    public List<DraftProspect> generateDraftClass(int totalPlayers, int year) {
        return generateDraftClass(totalPlayers, year, randomSource);
    }

    /**
     * Génère exactement {@code totalPlayers} prospects, classés (rang médiatique dense 1..N)
     * puis mélangés pour l'affichage.
     */
    public List<DraftProspect> generateDraftClass(int totalPlayers, int year, RandomSource random) {
        if (totalPlayers <= 0) {
            log.warn("⚠️ Classe de draft {} demandée avec {} joueurs : liste vide", year, totalPlayers);
            return new ArrayList<>();
        }

        List<DraftProspect> prospects = new ArrayList<>(totalPlayers);
        for (int i = 0; i < totalPlayers; i++) {
            prospects.add(generateProspect(i, year, random));
        }

        assignMediaRanks(prospects, random);

        List<DraftProspect> displayOrder = new ArrayList<>(prospects);
        sampler.shuffle(displayOrder, random);

        log.info("🎲 Classe de draft {} générée : {} prospects", year, displayOrder.size());
        return displayOrder;
    }

    public DraftProspect generateProspect(int index, int year, RandomSource random) {
        SimulationProperties.Draft cfg = properties.getDraft();

        int potential = sampler.sample(cfg.getPotentialMean(), cfg.getPotentialStdDev(), random);
        int gap = sampler.uniformInt(cfg.getMinRatingGap(), cfg.getMaxRatingGap(), random);
        // Toujours <= potential : la marge représente la progression possible
        int currentRating = RatingSampler.clampRating(potential - gap);

        Position position = sampler.weightedChoice(POSITION_WEIGHTS, random);
        PlayerType type = position.getPlayerType();
        Map<Tool, Integer> attributes = generateAttributes(type, currentRating, random);

        HiddenTraits traits = generateHiddenTraits(random);
        int age = sampler.weightedChoice(AGE_WEIGHTS, random);

        DraftProspect prospect = DraftProspect.builder()
                .id("prospect-" + year + "-" + (index + 1))
                .firstName(nameGenerator.firstName(random))
                .lastName(nameGenerator.lastName(random))
                .age(age)
                .position(position)
                .playerType(type)
                .draftYear(year)
                .currentRating(currentRating)
                .potential(potential)
                .attributes(attributes)
                .hiddenTraits(traits)
                .archetype(determineArchetype(type, attributes, currentRating, potential))
                .build();

        log.debug("Prospect {} : {} {} ans, {}/{}", prospect.getId(), position.getCode(), age, currentRating, potential);
        return prospect;
    }

    /**
     * Chaque outil est tiré autour de la note actuelle, indépendamment des autres,
     * pour obtenir des profils variés.
     */
    public Map<Tool, Integer> generateAttributes(PlayerType type, int currentRating, RandomSource random) {
        Map<Tool, Integer> attributes = new EnumMap<>(Tool.class);
        for (Tool tool : type.tools()) {
            attributes.put(tool, sampler.sample(currentRating, properties.getDraft().getToolStdDev(), random));
        }
        return attributes;
    }

    private HiddenTraits generateHiddenTraits(RandomSource random) {
        SimulationProperties.Draft cfg = properties.getDraft();
        WorkEthic workEthic = sampler.weightedChoice(WORK_ETHIC_WEIGHTS, random);
        boolean injuryProne = sampler.chance(cfg.getInjuryProneChance(), random);
        Personality personality = sampler.weightedChoice(PERSONALITY_WEIGHTS, random);
        int coachability = sampler.uniformInt(cfg.getMinHiddenTrait(), cfg.getMaxHiddenTrait(), random);
        int clutch = sampler.uniformInt(cfg.getMinHiddenTrait(), cfg.getMaxHiddenTrait(), random);
        return new HiddenTraits(workEthic, injuryProne, personality, coachability, clutch);
    }

    /**
     * Rang médiatique : score = 0.75·potentiel + 0.25·note + bruit, les plus jeunes étant plus incertains.
     * Tri décroissant stable : à score égal, l'ordre de génération départage.
     */
    public void assignMediaRanks(List<DraftProspect> prospects, RandomSource random) {
        SimulationProperties.Draft cfg = properties.getDraft();
        double[] scores = new double[prospects.size()];

        for (int i = 0; i < prospects.size(); i++) {
            DraftProspect p = prospects.get(i);
            double noise = sampler.uniform(-cfg.getMediaNoise(), cfg.getMediaNoise(), random);
            double ageUncertainty = Math.max(0, OLDEST_PROSPECT_AGE - p.getAge()) * cfg.getMediaAgeNoisePerYear();
            noise += sampler.uniform(-ageUncertainty, ageUncertainty, random);
            scores[i] = cfg.getMediaPotentialWeight() * p.getPotential()
                    + cfg.getMediaCurrentWeight() * p.getCurrentRating()
                    + noise;
        }

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < prospects.size(); i++) order.add(i);
        order.sort((a, b) -> Double.compare(scores[b], scores[a]));

        for (int rank = 0; rank < order.size(); rank++) {
            prospects.get(order.get(rank)).setMediaRank(rank + 1);
        }
    }

    public Archetype determineArchetype(PlayerType type, Map<Tool, Integer> attributes, int currentRating, int potential) {
        SimulationProperties.Draft cfg = properties.getDraft();
        if (potential - currentRating >= cfg.getRawTalentGap()) {
            return Archetype.RAW_TALENT;
        }

        Tool dominant = null;
        int max = Integer.MIN_VALUE;
        int min = Integer.MAX_VALUE;
        for (Tool tool : type.tools()) {
            int value = attributes.getOrDefault(tool, RatingSampler.MIN_RATING);
            if (value > max) {
                max = value;
                dominant = tool;
            }
            min = Math.min(min, value);
        }

        int balancedSpread = type == PlayerType.PITCHER ? cfg.getBalancedPitcherSpread() : cfg.getBalancedHitterSpread();
        if (dominant == null || max - min <= balancedSpread || max < cfg.getStrongToolThreshold()) {
            return Archetype.PLAYMAKER;
        }
        return Archetype.forDominantTool(dominant).orElse(Archetype.PLAYMAKER);
    }
}
