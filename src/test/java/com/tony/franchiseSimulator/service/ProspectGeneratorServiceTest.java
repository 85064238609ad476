package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.model.*;
import org.apache.commons.math3.random.MersenneTwister;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class ProspectGeneratorServiceTest {

    private ProspectGeneratorService generator;

    @BeforeEach
    void setUp() {
        generator = new ProspectGeneratorService(new RatingSampler(), new NameGenerator(), new SimulationProperties(),
                new CommonsMathRandomSource(new MersenneTwister(42)));
    }

    @Test
    @DisplayName("Une classe de 800 joueurs a des rangs médiatiques denses de 1 à 800")
    void draftClassHasDenseMediaRanks() {
        // ACT
        List<DraftProspect> prospects = generator.generateDraftClass(800, 2025);

        // ASSERT
        assertThat(prospects).hasSize(800);
        assertThat(prospects.stream().map(DraftProspect::getMediaRank))
                .containsExactlyInAnyOrderElementsOf(IntStream.rangeClosed(1, 800).boxed().toList());
        assertThat(prospects.stream().map(DraftProspect::getId).distinct()).hasSize(800);
    }

    @Test
    @DisplayName("Toutes les notes et tous les outils restent dans [20, 80], note <= potentiel")
    void ratingsRespectBoundsAndHeadroom() {
        List<DraftProspect> prospects = generator.generateDraftClass(2000, 2025);

        for (DraftProspect p : prospects) {
            assertThat(p.getPotential()).isBetween(20, 80);
            assertThat(p.getCurrentRating()).isBetween(20, 80).isLessThanOrEqualTo(p.getPotential());
            assertThat(p.getAttributes().keySet()).containsExactlyInAnyOrderElementsOf(p.getPlayerType().tools());
            assertThat(p.getAttributes().values()).allSatisfy(v -> assertThat(v).isBetween(20, 80));
        }
    }

    @Test
    @DisplayName("Type, âge et traits cachés sont cohérents")
    void derivedFieldsAreConsistent() {
        List<DraftProspect> prospects = generator.generateDraftClass(500, 2025);

        for (DraftProspect p : prospects) {
            assertThat(p.getPosition()).isNotEqualTo(Position.DH);
            assertThat(p.getPlayerType()).isEqualTo(p.getPosition().getPlayerType());
            assertThat(p.getAge()).isBetween(18, 22);
            assertThat(p.getHiddenTraits().coachability()).isBetween(30, 70);
            assertThat(p.getHiddenTraits().clutch()).isBetween(30, 70);
            assertThat(p.getArchetype()).isNotNull();
            assertThat(p.getScoutedRating()).isNull();
            assertThat(p.isDrafted()).isFalse();
        }
        // Environ 40% de lanceurs (SP + RP)
        long pitchers = prospects.stream().filter(p -> p.getPlayerType() == PlayerType.PITCHER).count();
        assertThat(pitchers).isBetween(150L, 250L);
    }

    @Test
    @DisplayName("L'ordre d'affichage est mélangé, indépendamment du rang")
    void displayOrderIsShuffled() {
        List<DraftProspect> prospects = generator.generateDraftClass(200, 2025);

        List<Integer> ranks = prospects.stream().map(DraftProspect::getMediaRank).toList();
        assertThat(ranks).isNotEqualTo(ranks.stream().sorted().toList());
    }

    @Test
    @DisplayName("Même graine, même classe de draft")
    void sameSeedSameDraftClass() {
        List<DraftProspect> first = generator.generateDraftClass(50, 2025, new CommonsMathRandomSource(new MersenneTwister(99)));
        List<DraftProspect> second = generator.generateDraftClass(50, 2025, new CommonsMathRandomSource(new MersenneTwister(99)));

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Une taille nulle ou négative donne une liste vide")
    void emptyClassForNonPositiveSize() {
        assertThat(generator.generateDraftClass(0, 2025)).isEmpty();
        assertThat(generator.generateDraftClass(-5, 2025)).isEmpty();
    }

    @Test
    @DisplayName("Archétypes : gros écart -> Raw Talent, profil plat -> Playmaker, outil dominant -> étiquette")
    void archetypeRules() {
        Map<Tool, Integer> flat = hitter(50, 50, 50, 50, 50);
        Map<Tool, Integer> powerful = hitter(45, 70, 45, 48, 46);
        Map<Tool, Integer> weakSpike = hitter(30, 50, 30, 30, 30);

        assertThat(generator.determineArchetype(PlayerType.HITTER, powerful, 50, 66)).isEqualTo(Archetype.RAW_TALENT);
        assertThat(generator.determineArchetype(PlayerType.HITTER, flat, 50, 60)).isEqualTo(Archetype.PLAYMAKER);
        assertThat(generator.determineArchetype(PlayerType.HITTER, powerful, 50, 60)).isEqualTo(Archetype.SLUGGER);
        // Outil dominant sous le seuil de 55
        assertThat(generator.determineArchetype(PlayerType.HITTER, weakSpike, 35, 45)).isEqualTo(Archetype.PLAYMAKER);

        Map<Tool, Integer> pitcher = new EnumMap<>(Tool.class);
        pitcher.put(Tool.STUFF, 50);
        pitcher.put(Tool.CONTROL, 62);
        pitcher.put(Tool.MOVEMENT, 50);
        assertThat(generator.determineArchetype(PlayerType.PITCHER, pitcher, 52, 60)).isEqualTo(Archetype.COMMAND_ACE);
    }

    @Test
    @DisplayName("Le rang médiatique suit potentiel et note quand le bruit est neutre")
    void mediaRankFollowsScoreWithNeutralNoise() {
        DraftProspect star = DraftProspect.builder().age(22).potential(75).currentRating(60).build();
        DraftProspect average = DraftProspect.builder().age(22).potential(50).currentRating(40).build();
        DraftProspect twin = DraftProspect.builder().age(22).potential(50).currentRating(40).build();
        List<DraftProspect> prospects = List.of(average, star, twin);

        // 0.5 -> bruit nul
        generator.assignMediaRanks(prospects, () -> 0.5);

        assertThat(star.getMediaRank()).isEqualTo(1);
        // À score égal, l'ordre de génération départage
        assertThat(average.getMediaRank()).isEqualTo(2);
        assertThat(twin.getMediaRank()).isEqualTo(3);
    }

    private Map<Tool, Integer> hitter(int hit, int power, int speed, int arm, int field) {
        Map<Tool, Integer> attributes = new EnumMap<>(Tool.class);
        attributes.put(Tool.HIT, hit);
        attributes.put(Tool.POWER, power);
        attributes.put(Tool.SPEED, speed);
        attributes.put(Tool.ARM, arm);
        attributes.put(Tool.FIELD, field);
        return attributes;
    }
}
