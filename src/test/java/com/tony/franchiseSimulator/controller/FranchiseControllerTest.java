package com.tony.franchiseSimulator.controller;

import com.tony.franchiseSimulator.config.AiTeamCatalog;
import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.config.TierCatalog;
import com.tony.franchiseSimulator.service.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Routes franchise branchées sur les vrais moteurs, avec un aléa neutre.
 */
class FranchiseControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        RandomSource neutral = () -> 0.5;
        RatingSampler sampler = new RatingSampler();
        SimulationProperties properties = new SimulationProperties();
        TierCatalog tierCatalog = TierCatalog.defaults();
        AiTeamCatalog aiTeamCatalog = AiTeamCatalog.defaults();
        TrainingService trainingService = new TrainingService(sampler, properties, neutral);
        CityService cityService = new CityService(tierCatalog, sampler, neutral);

        FranchiseController controller = new FranchiseController(
                trainingService,
                cityService,
                new FinancialService(properties, tierCatalog),
                new ProgressionService(tierCatalog, properties),
                new OffseasonService(sampler, trainingService, tierCatalog, neutral),
                new SeasonService(sampler, properties, tierCatalog, cityService, neutral),
                new ContractService(tierCatalog, sampler, properties, aiTeamCatalog, neutral),
                tierCatalog,
                aiTeamCatalog);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    @DisplayName("POST /game-status : dette au-delà de 2x le budget -> GAME_OVER")
    void gameOverWhenDebtExceedsTwiceBudget() throws Exception {
        mockMvc.perform(post("/api/v1/franchise/game-status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reserves\": -250000, \"annualBudget\": 100000, \"tier\": \"LOW_A\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("GAME_OVER"))
                .andExpect(jsonPath("$.bankrupt").value(true));
    }

    @Test
    @DisplayName("POST /solvency : diagnostic complet")
    void solvencyReport() throws Exception {
        mockMvc.perform(post("/api/v1/franchise/solvency")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reserves\": -150000, \"annualBudget\": 100000, \"tier\": \"LOW_A\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bankruptcyStatus.riskLevel").value("IMMINENT"))
                .andExpect(jsonPath("$.debtWarning.level").value("HIGH"))
                .andExpect(jsonPath("$.gameStatus.status").value("ACTIVE"));
    }

    @Test
    @DisplayName("POST /promotion-eligibility : Low-A vers High-A")
    void promotionEligibility() throws Exception {
        mockMvc.perform(post("/api/v1/franchise/promotion-eligibility")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tier": "LOW_A", "winPct": 0.6, "reserves": 60000, "teamPride": 55,
                                 "consecutiveWinningSeasons": 2}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.eligible").value(true))
                .andExpect(jsonPath("$.nextTier").value("HIGH_A"));
    }

    @Test
    @DisplayName("GET /promotion-bonuses : écart de budget entre deux niveaux")
    void promotionBonuses() throws Exception {
        mockMvc.perform(get("/api/v1/franchise/promotion-bonuses").param("from", "LOW_A").param("to", "HIGH_A"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.budgetIncrease").value(1500000))
                .andExpect(jsonPath("$.prideBoost").value(15));
    }

    @Test
    @DisplayName("POST /training : progression d'un joueur à 95 XP")
    void trainSinglePlayer() throws Exception {
        mockMvc.perform(post("/api/v1/franchise/training")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"players": [{"id": "p1", "age": 20, "position": "CF", "playerType": "HITTER",
                                  "currentRating": 50, "potential": 65, "rosterStatus": "ACTIVE", "currentXp": 95,
                                  "morale": 50, "progressionRate": 1.0,
                                  "attributes": {"HIT": 50, "POWER": 40, "SPEED": 55, "ARM": 60, "FIELD": 45}}],
                                 "gamesSimulated": 10}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.leveledUp").value(true))
                .andExpect(jsonPath("$.newXp").value(25))
                .andExpect(jsonPath("$.attributeImproved").value("POWER"));
    }

    @Test
    @DisplayName("POST /training sans joueur : 400")
    void trainingRequiresPlayers() throws Exception {
        mockMvc.perform(post("/api/v1/franchise/training")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"players\": [], \"gamesSimulated\": 10}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /tiers : les cinq niveaux")
    void listsTiers() throws Exception {
        mockMvc.perform(get("/api/v1/franchise/tiers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.LOW_A.budget").value(500000))
                .andExpect(jsonPath("$.MLB.seasonLength").value(162));
    }

    @Test
    @DisplayName("POST /finances : franchise sans niveau -> 400")
    void financesRequireFranchiseTier() throws Exception {
        mockMvc.perform(post("/api/v1/franchise/finances")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"franchise": {"name": "Hammers", "budget": 500000, "reserves": 0},
                                 "cityState": {"population": 15000}, "attendance": 100000}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /season : bilan complet contre les 19 équipes IA")
    void simulatesSeason() throws Exception {
        mockMvc.perform(post("/api/v1/franchise/season")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tier\": \"LOW_A\", \"players\": [], \"cityPride\": 40}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.teamStrength").value(40.0))
                .andExpect(jsonPath("$.injuries.length()").value(0));
    }

    @Test
    @DisplayName("POST /season sans niveau : 400")
    void seasonRequiresTier() throws Exception {
        mockMvc.perform(post("/api/v1/franchise/season")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"players\": []}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /payroll : masse salariale sous le plafond Low-A")
    void payrollAgainstCap() throws Exception {
        mockMvc.perform(post("/api/v1/franchise/payroll")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tier": "LOW_A", "players": [
                                  {"id": "a1", "firstName": "Sam", "lastName": "Reed", "salary": 40000, "rosterStatus": "ACTIVE"},
                                  {"id": "r1", "firstName": "Ty", "lastName": "Cobb", "salary": 30000, "rosterStatus": "RESERVE"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalPayroll").value(40000))
                .andExpect(jsonPath("$.salaryCap").value(350000))
                .andExpect(jsonPath("$.playerSalaries.length()").value(1));
    }

    @Test
    @DisplayName("POST /city/growth : saison perdante, aucune construction et fierté en baisse")
    void losingSeasonDoesNotGrowCity() throws Exception {
        mockMvc.perform(post("/api/v1/franchise/city/growth")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tier": "LOW_A", "year": 2026, "winPct": 0.3, "attendanceRate": 0.2,
                                 "cityState": {"population": 15000, "medianIncome": 32000, "unemploymentRate": 18.0,
                                               "teamPride": 30, "nationalRecognition": 5, "buildings": []}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.buildingsUpgraded").value(0))
                .andExpect(jsonPath("$.city.teamPride").value(27));
    }
}
