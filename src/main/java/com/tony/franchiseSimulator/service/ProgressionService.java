package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.config.TierCatalog;
import com.tony.franchiseSimulator.model.GameStatus;
import com.tony.franchiseSimulator.model.PromotionRequirements;
import com.tony.franchiseSimulator.model.Tier;
import com.tony.franchiseSimulator.model.TierConfig;
import com.tony.franchiseSimulator.model.result.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Machine d'états de la franchise : promotion vers le niveau supérieur et fin de partie par faillite.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressionService {

    private final TierCatalog tierCatalog;
    private final SimulationProperties properties;

    /**
     * Éligible si et seulement si tous les critères du niveau actuel sont remplis en même temps.
     * La MLB n'a pas de niveau supérieur : jamais éligible.
     */
    public PromotionEligibility checkPromotionEligibility(Tier tier, double winPct, long reserves, int teamPride,
                                                          int consecutiveWinningSeasons, boolean wonDivision,
                                                          boolean wonChampionship) {
        Optional<Tier> next = tier.next();
        Optional<PromotionRequirements> requirements = tierCatalog.get(tier).promotionRequirements();
        if (next.isEmpty() || requirements.isEmpty()) {
            return new PromotionEligibility(false, tier, null, List.of(), List.of("Déjà au plus haut niveau"), List.of());
        }

        PromotionRequirements req = requirements.get();
        List<RequirementCheck> checks = new ArrayList<>();
        checks.add(new RequirementCheck("Pourcentage de victoires", req.minWinPct(), winPct, winPct >= req.minWinPct()));
        checks.add(new RequirementCheck("Saisons gagnantes consécutives", req.consecutiveWinningSeasons(),
                consecutiveWinningSeasons, consecutiveWinningSeasons >= req.consecutiveWinningSeasons()));
        checks.add(new RequirementCheck("Réserves", req.minReserves(), reserves, reserves >= req.minReserves()));
        checks.add(new RequirementCheck("Fierté des supporters", req.minTeamPride(), teamPride, teamPride >= req.minTeamPride()));
        if (req.requiresDivisionTitle()) {
            checks.add(new RequirementCheck("Titre de division", 1, wonDivision ? 1 : 0, wonDivision));
        }
        if (req.requiresLeagueChampionship()) {
            checks.add(new RequirementCheck("Titre de champion", 1, wonChampionship ? 1 : 0, wonChampionship));
        }

        List<String> met = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (RequirementCheck check : checks) {
            (check.met() ? met : missing).add(check.criterion());
        }

        boolean eligible = missing.isEmpty();
        if (eligible) {
            log.info("🏆 Promotion possible : {} -> {}", tier, next.get());
        }
        return new PromotionEligibility(eligible, tier, next.get(), met, missing, checks);
    }

    /**
     * Fin de partie si et seulement si la dette dépasse strictement 2 × le budget annuel.
     */
    public GameStatusCheck checkGameStatus(long reserves, long annualBudget, Tier tier) {
        long debt = reserves < 0 ? Math.abs(reserves) : 0;
        long threshold = Math.round(annualBudget * properties.getFinance().getBankruptcyDebtRatio());
        boolean bankrupt = debt > threshold;

        if (bankrupt) {
            log.warn("💀 Faillite en {} : dette {} $ > seuil {} $", tier, debt, threshold);
            return new GameStatusCheck(GameStatus.GAME_OVER,
                    "Faillite : la dette (" + debt + " $) dépasse le double du budget annuel (" + threshold + " $)",
                    debt, threshold, debt > 0, true);
        }
        return new GameStatusCheck(GameStatus.ACTIVE, "La franchise est en activité", debt, threshold, debt > 0, false);
    }

    /** Écart de configuration entre deux niveaux, plus le gain fixe de fierté. */
    public PromotionBonuses calculatePromotionBonuses(Tier fromTier, Tier toTier) {
        TierConfig from = tierCatalog.get(fromTier);
        TierConfig to = tierCatalog.get(toTier);
        return new PromotionBonuses(fromTier, toTier,
                to.budget() - from.budget(),
                to.stadiumCapacity() - from.stadiumCapacity(),
                properties.getProgression().getPromotionPrideBoost());
    }

    /**
     * Alerte graduée à 25/50/75/100% du seuil de faillite.
     */
    public DebtWarning debtWarning(long reserves, long annualBudget) {
        if (reserves >= 0) {
            return new DebtWarning(DebtWarning.Level.NONE, null, 0.0);
        }
        long debt = Math.abs(reserves);
        double debtPercent = annualBudget > 0 ? Math.round(debt * 10000.0 / annualBudget) / 100.0 : 100.0;
        double threshold = annualBudget * properties.getFinance().getBankruptcyDebtRatio();

        if (debt >= threshold) {
            return new DebtWarning(DebtWarning.Level.CRITICAL, "Faillite imminente : la dette atteint le seuil maximal.", debtPercent);
        }
        if (debt >= threshold * 0.75) {
            return new DebtWarning(DebtWarning.Level.HIGH, "Crise de la dette : réduire les coûts immédiatement.", debtPercent);
        }
        if (debt >= threshold * 0.5) {
            return new DebtWarning(DebtWarning.Level.MEDIUM, "Dette importante : restructuration recommandée.", debtPercent);
        }
        if (debt >= threshold * 0.25) {
            return new DebtWarning(DebtWarning.Level.LOW, "Dette modérée : surveiller les dépenses.", debtPercent);
        }
        return new DebtWarning(DebtWarning.Level.LOW, "Réserves négatives : revenir dans le vert.", debtPercent);
    }
}
