package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.model.*;
import com.tony.franchiseSimulator.model.result.ScoutingOutcome;
import com.tony.franchiseSimulator.model.result.ScoutingReport;
import org.apache.commons.math3.random.MersenneTwister;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScoutingServiceTest {

    private ScoutingService scoutingService;
    private DraftProspect prospect;

    @BeforeEach
    void setUp() {
        scoutingService = new ScoutingService(new RatingSampler(), new SimulationProperties(),
                new CommonsMathRandomSource(new MersenneTwister(11)));
        prospect = DraftProspect.builder()
                .id("prospect-2025-1")
                .position(Position.SS)
                .playerType(PlayerType.HITTER)
                .currentRating(50)
                .potential(65)
                .hiddenTraits(new HiddenTraits(WorkEthic.EXCELLENT, true, Personality.LEADER, 62, 41))
                .build();
    }

    @Test
    @DisplayName("Scouting HIGH : erreur toujours <= 3, LOW : erreur toujours <= 15")
    void errorStaysWithinAccuracyBound() {
        for (int i = 0; i < 1000; i++) {
            ScoutingReport high = scoutingService.scoutProspect(prospect, ScoutingAccuracy.HIGH);
            ScoutingReport low = scoutingService.scoutProspect(prospect, ScoutingAccuracy.LOW);

            assertThat(Math.abs(high.scoutedRating() - 50)).isLessThanOrEqualTo(3);
            assertThat(Math.abs(high.scoutedPotential() - 65)).isLessThanOrEqualTo(3);
            assertThat(Math.abs(low.scoutedRating() - 50)).isLessThanOrEqualTo(15);
            assertThat(low.scoutedPotential()).isBetween(50, 80);
        }
    }

    @Test
    @DisplayName("Les estimations restent bornées pour un prospect aux extrêmes")
    void estimatesAreClamped() {
        DraftProspect floor = prospect.toBuilder().currentRating(20).potential(80).build();

        // 0.0 -> erreur -15 sur la note, 0.999 -> +15 sur le potentiel
        ScoutingReport report = scoutingService.scoutProspect(floor, ScoutingAccuracy.LOW,
                new SequenceRandomSource(0.0, 0.999, 0.99));

        assertThat(report.scoutedRating()).isEqualTo(20);
        assertThat(report.scoutedPotential()).isEqualTo(80);
    }

    @Test
    @DisplayName("Même graine, même rapport")
    void sameSeedSameReport() {
        ScoutingReport first = scoutingService.scoutProspect(prospect, ScoutingAccuracy.MEDIUM,
                new CommonsMathRandomSource(new MersenneTwister(5)));
        ScoutingReport second = scoutingService.scoutProspect(prospect, ScoutingAccuracy.MEDIUM,
                new CommonsMathRandomSource(new MersenneTwister(5)));

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Révélation : éthique et personnalité toujours, le reste selon les tirages")
    void revealsTraitsPartially() {
        // ARRANGE : bruit note, bruit potentiel, révélation OK, blessure OK, coachabilité KO, clutch OK
        SequenceRandomSource random = new SequenceRandomSource(0.5, 0.5, 0.0, 0.0, 0.99, 0.0);

        // ACT
        ScoutingReport report = scoutingService.scoutProspect(prospect, ScoutingAccuracy.HIGH, random);

        // ASSERT
        assertThat(report.traitsRevealed()).isTrue();
        assertThat(report.revealedTraits().workEthic()).isEqualTo(WorkEthic.EXCELLENT);
        assertThat(report.revealedTraits().personality()).isEqualTo(Personality.LEADER);
        assertThat(report.revealedTraits().injuryProne()).isTrue();
        assertThat(report.revealedTraits().coachability()).isNull();
        assertThat(report.revealedTraits().clutch()).isEqualTo(41);
        assertThat(report.cost()).isEqualTo(8000);
    }

    @Test
    @DisplayName("Tirage de révélation raté : aucun trait")
    void failedRevealRollGivesNoTraits() {
        ScoutingReport report = scoutingService.scoutProspect(prospect, ScoutingAccuracy.LOW,
                new SequenceRandomSource(0.5, 0.5, 0.95));

        assertThat(report.traitsRevealed()).isFalse();
        assertThat(report.revealedTraits().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Fonds insuffisants : échec avec raison, aucun rapport")
    void insufficientFundsIsRejected() {
        ScoutingOutcome outcome = scoutingService.requestScouting(prospect, "high", 5000);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.reason()).contains("Fonds insuffisants");
        assertThat(outcome.report()).isNull();
    }

    @Test
    @DisplayName("Niveau inconnu ou prospect déjà drafté : échec")
    void invalidRequestsAreRejected() {
        assertThat(scoutingService.requestScouting(prospect, "ultra", 100_000).success()).isFalse();
        assertThat(scoutingService.requestScouting(null, "low", 100_000).success()).isFalse();

        DraftProspect drafted = prospect.toBuilder().drafted(true).build();
        assertThat(scoutingService.requestScouting(drafted, "low", 100_000).reason()).contains("drafté");
    }

    @Test
    @DisplayName("Demande valide : rapport au coût du niveau")
    void validRequestSucceeds() {
        ScoutingOutcome outcome = scoutingService.requestScouting(prospect, "medium", 4000);

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.report().accuracy()).isEqualTo(ScoutingAccuracy.MEDIUM);
        assertThat(outcome.report().cost()).isEqualTo(4000);
    }

    @Test
    @DisplayName("Fusion du rapport : copie enrichie, traits déjà connus conservés")
    void applyReportMergesIntoCopy() {
        DraftProspect known = prospect.toBuilder()
                .revealedTraits(new RevealedTraits(null, null, null, 62, null))
                .build();
        ScoutingReport report = new ScoutingReport("prospect-2025-1", ScoutingAccuracy.LOW, 48, 70,
                new RevealedTraits(WorkEthic.EXCELLENT, Personality.LEADER, null, null, null), true, 2000, 2, 5);

        DraftProspect scouted = scoutingService.applyReport(known, report);

        assertThat(scouted.getScoutedRating()).isEqualTo(48);
        assertThat(scouted.getScoutedPotential()).isEqualTo(70);
        assertThat(scouted.getScoutingAccuracy()).isEqualTo(ScoutingAccuracy.LOW);
        assertThat(scouted.getRevealedTraits().coachability()).isEqualTo(62);
        assertThat(scouted.getRevealedTraits().workEthic()).isEqualTo(WorkEthic.EXCELLENT);
        assertThat(known.getScoutedRating()).isNull();
    }
}
