package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.config.TierCatalog;
import com.tony.franchiseSimulator.model.GameStatus;
import com.tony.franchiseSimulator.model.Tier;
import com.tony.franchiseSimulator.model.result.DebtWarning;
import com.tony.franchiseSimulator.model.result.GameStatusCheck;
import com.tony.franchiseSimulator.model.result.PromotionBonuses;
import com.tony.franchiseSimulator.model.result.PromotionEligibility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressionServiceTest {

    private ProgressionService progressionService;

    @BeforeEach
    void setUp() {
        progressionService = new ProgressionService(TierCatalog.defaults(), new SimulationProperties());
    }

    @Test
    @DisplayName("Dette de 250 000 pour un budget de 100 000 : fin de partie")
    void debtBeyondTwiceBudgetEndsTheGame() {
        GameStatusCheck check = progressionService.checkGameStatus(-250_000, 100_000, Tier.LOW_A);

        assertThat(check.status()).isEqualTo(GameStatus.GAME_OVER);
        assertThat(check.bankrupt()).isTrue();
        assertThat(check.totalDebt()).isEqualTo(250_000);
        assertThat(check.debtThreshold()).isEqualTo(200_000);
    }

    @Test
    @DisplayName("Dette de 150 000 ou exactement au seuil : la partie continue")
    void debtUnderOrAtThresholdKeepsPlaying() {
        GameStatusCheck under = progressionService.checkGameStatus(-150_000, 100_000, Tier.LOW_A);
        GameStatusCheck atLine = progressionService.checkGameStatus(-200_000, 100_000, Tier.LOW_A);
        GameStatusCheck solvent = progressionService.checkGameStatus(50_000, 100_000, Tier.LOW_A);

        assertThat(under.status()).isEqualTo(GameStatus.ACTIVE);
        assertThat(under.inDebt()).isTrue();
        assertThat(atLine.status()).isEqualTo(GameStatus.ACTIVE);
        assertThat(solvent.inDebt()).isFalse();
    }

    @Test
    @DisplayName("Low-A : tous les critères remplis, promotion vers High-A")
    void lowAPromotion() {
        PromotionEligibility eligibility = progressionService.checkPromotionEligibility(
                Tier.LOW_A, 0.60, 60_000, 55, 2, false, false);

        assertThat(eligibility.eligible()).isTrue();
        assertThat(eligibility.nextTier()).isEqualTo(Tier.HIGH_A);
        assertThat(eligibility.missingCriteria()).isEmpty();
        assertThat(eligibility.progressPercent()).isEqualTo(100);
    }

    @Test
    @DisplayName("Un seul critère manquant suffit à bloquer la promotion")
    void oneMissingCriterionBlocksPromotion() {
        PromotionEligibility eligibility = progressionService.checkPromotionEligibility(
                Tier.LOW_A, 0.60, 60_000, 49, 2, false, false);

        assertThat(eligibility.eligible()).isFalse();
        assertThat(eligibility.missingCriteria()).containsExactly("Fierté des supporters");
        assertThat(eligibility.progressPercent()).isEqualTo(75);
    }

    @Test
    @DisplayName("High-A exige un titre de division")
    void highARequiresDivisionTitle() {
        PromotionEligibility withoutTitle = progressionService.checkPromotionEligibility(
                Tier.HIGH_A, 0.65, 300_000, 70, 3, false, false);
        PromotionEligibility withTitle = progressionService.checkPromotionEligibility(
                Tier.HIGH_A, 0.65, 300_000, 70, 3, true, false);

        assertThat(withoutTitle.eligible()).isFalse();
        assertThat(withoutTitle.missingCriteria()).containsExactly("Titre de division");
        assertThat(withTitle.eligible()).isTrue();
        assertThat(withTitle.nextTier()).isEqualTo(Tier.DOUBLE_A);
    }

    @Test
    @DisplayName("La MLB n'est jamais éligible à une promotion")
    void mlbIsNeverEligible() {
        PromotionEligibility eligibility = progressionService.checkPromotionEligibility(
                Tier.MLB, 0.80, 100_000_000, 100, 10, true, true);

        assertThat(eligibility.eligible()).isFalse();
        assertThat(eligibility.nextTier()).isNull();
    }

    @Test
    @DisplayName("Bonus de promotion : écart de budget et de capacité, +15 de fierté")
    void promotionBonuses() {
        PromotionBonuses bonuses = progressionService.calculatePromotionBonuses(Tier.LOW_A, Tier.HIGH_A);

        assertThat(bonuses.budgetIncrease()).isEqualTo(1_500_000);
        assertThat(bonuses.stadiumCapacityIncrease()).isEqualTo(2_500);
        assertThat(bonuses.prideBoost()).isEqualTo(15);
    }

    @Test
    @DisplayName("Alerte de dette graduée selon le seuil de faillite")
    void debtWarningLevels() {
        assertThat(progressionService.debtWarning(10_000, 100_000).level()).isEqualTo(DebtWarning.Level.NONE);
        assertThat(progressionService.debtWarning(-60_000, 100_000).level()).isEqualTo(DebtWarning.Level.LOW);
        assertThat(progressionService.debtWarning(-110_000, 100_000).level()).isEqualTo(DebtWarning.Level.MEDIUM);
        assertThat(progressionService.debtWarning(-160_000, 100_000).level()).isEqualTo(DebtWarning.Level.HIGH);
        assertThat(progressionService.debtWarning(-200_000, 100_000).level()).isEqualTo(DebtWarning.Level.CRITICAL);
        assertThat(progressionService.debtWarning(-160_000, 100_000).debtPercent()).isEqualTo(160.0);
    }
}
