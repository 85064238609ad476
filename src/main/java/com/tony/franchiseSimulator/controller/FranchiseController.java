package com.tony.franchiseSimulator.controller;

import com.tony.franchiseSimulator.config.AiTeamCatalog;
import com.tony.franchiseSimulator.config.TierCatalog;
import com.tony.franchiseSimulator.model.CityState;
import com.tony.franchiseSimulator.model.DistrictBonuses;
import com.tony.franchiseSimulator.model.PlayerSeasonRecord;
import com.tony.franchiseSimulator.model.Tier;
import com.tony.franchiseSimulator.model.TierConfig;
import com.tony.franchiseSimulator.model.dto.CityGrowthRequest;
import com.tony.franchiseSimulator.model.dto.ContractRenewalRequest;
import com.tony.franchiseSimulator.model.dto.FinanceRequest;
import com.tony.franchiseSimulator.model.dto.GameStatusRequest;
import com.tony.franchiseSimulator.model.dto.OffseasonRequest;
import com.tony.franchiseSimulator.model.dto.PayrollRequest;
import com.tony.franchiseSimulator.model.dto.PromotionCheckRequest;
import com.tony.franchiseSimulator.model.dto.SeasonRequest;
import com.tony.franchiseSimulator.model.dto.TrainingRequest;
import com.tony.franchiseSimulator.model.result.*;
import com.tony.franchiseSimulator.service.CityService;
import com.tony.franchiseSimulator.service.ContractService;
import com.tony.franchiseSimulator.service.FinancialService;
import com.tony.franchiseSimulator.service.OffseasonService;
import com.tony.franchiseSimulator.service.ProgressionService;
import com.tony.franchiseSimulator.service.SeasonService;
import com.tony.franchiseSimulator.service.TrainingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/franchise")
@RequiredArgsConstructor
public class FranchiseController {
    private final TrainingService trainingService;
    private final CityService cityService;
    private final FinancialService financialService;
    private final ProgressionService progressionService;
    private final OffseasonService offseasonService;
    private final SeasonService seasonService;
    private final ContractService contractService;
    private final TierCatalog tierCatalog;
    private final AiTeamCatalog aiTeamCatalog;

    @GetMapping("/tiers")
    public ResponseEntity<Map<Tier, TierConfig>> getTiers() {
        return ResponseEntity.ok(tierCatalog.asMap());
    }

    @GetMapping("/city")
    public ResponseEntity<CityState> generateCity(@RequestParam(name = "tier", defaultValue = "LOW_A") Tier tier) {
        return ResponseEntity.ok(cityService.generateInitialCity(tier));
    }

    @PostMapping("/city/growth")
    public ResponseEntity<CityGrowthResult> growCity(@Valid @RequestBody CityGrowthRequest request) {
        return ResponseEntity.ok(cityService.simulateCityGrowth(request));
    }

    // Bilan statistique de la saison contre les 19 équipes IA
    @PostMapping("/season")
    public ResponseEntity<SeasonSimulationResult> simulateSeason(@Valid @RequestBody SeasonRequest request) {
        return ResponseEntity.ok(seasonService.simulateSeason(request, aiTeamCatalog.getTeams()));
    }

    @PostMapping("/payroll")
    public ResponseEntity<PayrollSummary> payroll(@Valid @RequestBody PayrollRequest request) {
        return ResponseEntity.ok(contractService.calculatePayroll(request.getPlayers(), request.getTier()));
    }

    @PostMapping("/contracts/renewals")
    public ResponseEntity<List<FreeAgentResult>> renewContracts(@Valid @RequestBody ContractRenewalRequest request) {
        return ResponseEntity.ok(contractService.processContractExpirations(
                request.getPlayers(), request.getTeamWinPct(), request.getReleasedPlayerIds()));
    }

    @PostMapping("/training")
    public ResponseEntity<TrainingResult> trainPlayer(@Valid @RequestBody TrainingRequest request) {
        DistrictBonuses bonuses = cityService.calculateBonuses(request.getBuildings());
        return ResponseEntity.ok(trainingService.processPlayerTraining(
                request.getPlayers().get(0), bonuses, request.getFacilityLevel(), request.getGamesSimulated()));
    }

    @PostMapping("/training/batch")
    public ResponseEntity<BatchTrainingResult> trainRoster(@Valid @RequestBody TrainingRequest request) {
        DistrictBonuses bonuses = cityService.calculateBonuses(request.getBuildings());
        return ResponseEntity.ok(trainingService.processBatchTraining(
                request.getPlayers(), bonuses, request.getFacilityLevel(), request.getGamesSimulated()));
    }

    @PostMapping("/training/projection")
    public ResponseEntity<List<TrainingProjection>> projectTraining(@Valid @RequestBody TrainingRequest request) {
        DistrictBonuses bonuses = cityService.calculateBonuses(request.getBuildings());
        return ResponseEntity.ok(request.getPlayers().stream()
                .map(p -> trainingService.projectTraining(p, bonuses, request.getFacilityLevel()))
                .toList());
    }

    @PostMapping("/finances")
    public ResponseEntity<FinancialSimulationResult> simulateFinances(@Valid @RequestBody FinanceRequest request) {
        return ResponseEntity.ok(financialService.simulateFinances(request.getPlayers(), request.getFranchise(),
                request.getCityState(), request.getAttendance(), request.isWonChampionship(), request.getMarketingSpend()));
    }

    @PostMapping("/budget-recommendations")
    public ResponseEntity<List<BudgetRecommendation>> budgetRecommendations(@Valid @RequestBody FinanceRequest request) {
        return ResponseEntity.ok(financialService.generateBudgetRecommendations(
                request.getFranchise(), request.getPlayers(), request.getCityState()));
    }

    // Diagnostic complet : palier de risque, alerte graduée et état de la partie
    @PostMapping("/solvency")
    public ResponseEntity<SolvencyReport> checkSolvency(@Valid @RequestBody GameStatusRequest request) {
        return ResponseEntity.ok(new SolvencyReport(
                financialService.checkBankruptcyStatus(request.getReserves(), request.getAnnualBudget()),
                progressionService.debtWarning(request.getReserves(), request.getAnnualBudget()),
                progressionService.checkGameStatus(request.getReserves(), request.getAnnualBudget(), request.getTier())));
    }

    @PostMapping("/promotion-eligibility")
    public ResponseEntity<PromotionEligibility> checkPromotion(@Valid @RequestBody PromotionCheckRequest request) {
        return ResponseEntity.ok(progressionService.checkPromotionEligibility(request.getTier(), request.getWinPct(),
                request.getReserves(), request.getTeamPride(), request.getConsecutiveWinningSeasons(),
                request.isWonDivision(), request.isWonChampionship()));
    }

    @GetMapping("/promotion-bonuses")
    public ResponseEntity<PromotionBonuses> promotionBonuses(@RequestParam("from") Tier from, @RequestParam("to") Tier to) {
        return ResponseEntity.ok(progressionService.calculatePromotionBonuses(from, to));
    }

    @PostMapping("/offseason")
    public ResponseEntity<OffseasonSummary> runOffseason(@Valid @RequestBody OffseasonRequest request) {
        PlayerSeasonRecord record = new PlayerSeasonRecord(request.getTeamName(), request.getWins(), request.getLosses());
        return ResponseEntity.ok(offseasonService.rolloverRoster(
                request.getPlayers(), record, aiTeamCatalog.getTeams(), request.getCompletedSeason()));
    }

    @PostMapping("/game-status")
    public ResponseEntity<GameStatusCheck> checkGameStatus(@Valid @RequestBody GameStatusRequest request) {
        return ResponseEntity.ok(progressionService.checkGameStatus(
                request.getReserves(), request.getAnnualBudget(), request.getTier()));
    }
}
