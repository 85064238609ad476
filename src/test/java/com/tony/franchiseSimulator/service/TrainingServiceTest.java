package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.model.*;
import com.tony.franchiseSimulator.model.result.BatchTrainingResult;
import com.tony.franchiseSimulator.model.result.TrainingProjection;
import com.tony.franchiseSimulator.model.result.TrainingResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TrainingServiceTest {

    private TrainingService trainingService;

    @BeforeEach
    void setUp() {
        // 0.5 -> variation finale nulle
        trainingService = new TrainingService(new RatingSampler(), new SimulationProperties(), () -> 0.5);
    }

    @Test
    @DisplayName("XP attendue : 2 XP/match x âge x moral x éthique x installations x statut")
    void expectedXpCombinesMultipliers() {
        Player player = hitter(20, 0).rosterStatus(RosterStatus.ACTIVE).build();

        assertThat(trainingService.expectedXp(player, DistrictBonuses.neutral(), FacilityLevel.BASIC, 10))
                .isCloseTo(30.0, within(1e-9));
        assertThat(trainingService.expectedXp(player.toBuilder().injured(true).build(), null, null, 10))
                .isCloseTo(7.5, within(1e-9));
        assertThat(trainingService.expectedXp(player.toBuilder().rosterStatus(RosterStatus.RESERVE).build(), null, null, 10))
                .isCloseTo(21.0, within(1e-9));
        assertThat(trainingService.expectedXp(player, new DistrictBonuses(1.0, 1.0, 1.03), FacilityLevel.ELITE, 10))
                .isCloseTo(30.0 * 1.30 * 1.03, within(1e-9));
    }

    @Test
    @DisplayName("95 XP + gain >= 5 : progression, reliquat < 100, un seul outil +1")
    void levelUpImprovesExactlyOneTool() {
        // ARRANGE
        Player player = hitter(20, 95).rosterStatus(RosterStatus.ACTIVE).build();

        // ACT
        TrainingResult result = trainingService.processPlayerTraining(player, DistrictBonuses.neutral(), FacilityLevel.BASIC, 10);
        Player trained = trainingService.applyTraining(player, result);

        // ASSERT
        assertThat(result.getXpGained()).isEqualTo(30);
        assertThat(result.isLeveledUp()).isTrue();
        assertThat(result.getNewXp()).isEqualTo(25).isBetween(0, 99);
        // POWER a la plus grande marge sous le potentiel
        assertThat(result.getAttributeImproved()).isEqualTo(Tool.POWER);
        assertThat(trained.getAttribute(Tool.POWER)).isEqualTo(41);
        long changed = player.getPlayerType().tools().stream()
                .filter(t -> trained.getAttribute(t) != player.getAttribute(t))
                .count();
        assertThat(changed).isEqualTo(1);
        assertThat(trained.getCurrentXp()).isEqualTo(25);
        assertThat(player.getCurrentXp()).isEqualTo(95);
    }

    @Test
    @DisplayName("Sous le seuil : l'XP s'accumule sans progression")
    void noLevelUpBelowThreshold() {
        Player player = hitter(20, 10).rosterStatus(RosterStatus.ACTIVE).build();

        TrainingResult result = trainingService.processPlayerTraining(player, null, FacilityLevel.BASIC, 10);

        assertThat(result.isLeveledUp()).isFalse();
        assertThat(result.getNewXp()).isEqualTo(40);
        assertThat(result.getAttributeImproved()).isNull();
    }

    @Test
    @DisplayName("Entraînement global : à marge égale, la défense passe avant le bras")
    void overallTieFavoursFieldOverArm() {
        Player player = hitter(20, 0).build();
        player.getAttributes().put(Tool.POWER, 55);
        player.getAttributes().put(Tool.ARM, 42);
        player.getAttributes().put(Tool.FIELD, 42);

        assertThat(trainingService.selectToolToImprove(player)).isEqualTo(Tool.FIELD);
    }

    @Test
    @DisplayName("Gain énorme : une seule progression, reliquat plafonné à 99")
    void remainderIsCappedAt99() {
        Player player = hitter(20, 99).rosterStatus(RosterStatus.ACTIVE).build();

        TrainingResult result = trainingService.processPlayerTraining(player, null, FacilityLevel.BASIC, 200);

        assertThat(result.isLeveledUp()).isTrue();
        assertThat(result.getNewXp()).isEqualTo(99);
    }

    @Test
    @DisplayName("Un outil déjà à 80 reste à 80")
    void focusedToolIsClampedAt80() {
        Player player = hitter(20, 95).rosterStatus(RosterStatus.ACTIVE).trainingFocus(TrainingFocus.HIT).build();
        player.getAttributes().put(Tool.HIT, 80);

        TrainingResult result = trainingService.processPlayerTraining(player, null, FacilityLevel.BASIC, 10);

        assertThat(result.getAttributeImproved()).isEqualTo(Tool.HIT);
        assertThat(result.getPreviousValue()).isEqualTo(80);
        assertThat(result.getNewValue()).isEqualTo(80);
    }

    @Test
    @DisplayName("Axe de frappeur sur un lanceur : retour à la règle OVERALL")
    void mismatchedFocusFallsBackToOverall() {
        Map<Tool, Integer> attributes = new EnumMap<>(Tool.class);
        attributes.put(Tool.STUFF, 60);
        attributes.put(Tool.CONTROL, 45);
        attributes.put(Tool.MOVEMENT, 55);
        Player pitcher = Player.builder().id("sp").playerType(PlayerType.PITCHER).position(Position.SP)
                .potential(70).currentRating(55).attributes(attributes).trainingFocus(TrainingFocus.POWER).build();

        assertThat(trainingService.selectToolToImprove(pitcher)).isEqualTo(Tool.CONTROL);
    }

    @Test
    @DisplayName("La variation finale reste dans +/-20%")
    void jitterStaysWithinTwentyPercent() {
        Player player = hitter(20, 0).rosterStatus(RosterStatus.ACTIVE).build();

        TrainingResult low = trainingService.processPlayerTraining(player, null, FacilityLevel.BASIC, 10, () -> 0.0);
        TrainingResult high = trainingService.processPlayerTraining(player, null, FacilityLevel.BASIC, 10, () -> 0.9999);

        assertThat(low.getXpGained()).isEqualTo(24);
        assertThat(high.getXpGained()).isEqualTo(36);
    }

    @Test
    @DisplayName("Nombre de matchs négatif : exception")
    void negativeGamesAreRejected() {
        Player player = hitter(20, 0).build();

        assertThatThrownBy(() -> trainingService.processPlayerTraining(player, null, FacilityLevel.BASIC, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Taux de progression borné à [0.5, 2.0]")
    void progressionRateIsClamped() {
        assertThat(trainingService.calculateProgressionRate(19, 75, 55)).isEqualTo(2.0);
        assertThat(trainingService.calculateProgressionRate(30, 45, 44)).isEqualTo(0.5);
        assertThat(trainingService.calculateProgressionRate(24, 62, 50)).isEqualTo(1.32);
    }

    @Test
    @DisplayName("Entraînement groupé : seuls les joueurs sous contrat progressent")
    void batchSkipsPlayersOffRoster() {
        Player active = hitter(20, 0).id("active").rosterStatus(RosterStatus.ACTIVE).build();
        Player released = hitter(20, 0).id("released").onRoster(false).build();

        BatchTrainingResult batch = trainingService.processBatchTraining(List.of(active, released), null, FacilityLevel.BASIC, 10);

        assertThat(batch.trainedPlayers()).hasSize(1);
        assertThat(batch.updatedPlayers()).hasSize(2);
        assertThat(batch.totalXpGained()).isEqualTo(30);
        assertThat(batch.playersLeveledUp()).isZero();
        assertThat(batch.updatedPlayers().get(1)).isSameAs(released);
    }

    @Test
    @DisplayName("Recommandation : outil à plus forte marge pondérée, sinon OVERALL")
    void recommendsToolWithMostRoom() {
        Player player = hitter(20, 0).potential(60).build();
        player.getAttributes().putAll(Map.of(Tool.HIT, 58, Tool.POWER, 40, Tool.SPEED, 45, Tool.ARM, 59, Tool.FIELD, 57));
        Player capped = hitter(20, 0).potential(45).build();

        assertThat(trainingService.recommendTrainingFocus(player)).isEqualTo(TrainingFocus.POWER);
        assertThat(trainingService.recommendTrainingFocus(capped)).isEqualTo(TrainingFocus.OVERALL);
    }

    @Test
    @DisplayName("Projection : matchs restants avant la prochaine progression")
    void projectionEstimatesGamesToLevelUp() {
        Player player = hitter(20, 40).rosterStatus(RosterStatus.ACTIVE).build();

        TrainingProjection projection = trainingService.projectTraining(player, null, FacilityLevel.BASIC);

        assertThat(projection.estimatedXpPerGame()).isEqualTo(3.0);
        assertThat(projection.estimatedGamesToLevelUp()).isEqualTo(20);
    }

    private Player.PlayerBuilder hitter(int age, int xp) {
        Map<Tool, Integer> attributes = new EnumMap<>(Tool.class);
        attributes.put(Tool.HIT, 50);
        attributes.put(Tool.POWER, 40);
        attributes.put(Tool.SPEED, 55);
        attributes.put(Tool.ARM, 60);
        attributes.put(Tool.FIELD, 45);
        return Player.builder()
                .id("player-1")
                .age(age)
                .position(Position.CF)
                .playerType(PlayerType.HITTER)
                .currentRating(50)
                .potential(65)
                .attributes(attributes)
                .hiddenTraits(new HiddenTraits(WorkEthic.AVERAGE, false, Personality.TEAM_PLAYER, 50, 50))
                .currentXp(xp);
    }
}
