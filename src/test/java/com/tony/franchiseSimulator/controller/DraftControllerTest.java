package com.tony.franchiseSimulator.controller;

import com.tony.franchiseSimulator.config.AiTeamCatalog;
import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.model.result.ScoutingOutcome;
import com.tony.franchiseSimulator.service.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DraftControllerTest {

    private static final String PROSPECT_JSON = """
            {"id": "prospect-2025-1", "position": "SS", "playerType": "HITTER", "currentRating": 50, "potential": 62,
             "hiddenTraits": {"workEthic": "AVERAGE", "injuryProne": false, "personality": "TEAM_PLAYER",
                              "coachability": 50, "clutch": 50}}
            """;

    private static final String PROSPECT_WITHOUT_TRAITS_JSON = """
            {"id": "prospect-2025-2", "position": "SS", "playerType": "HITTER", "currentRating": 50, "potential": 62}
            """;

    @Mock
    private ProspectGeneratorService prospectGenerator;
    @Mock
    private ScoutingService scoutingService;
    @Mock
    private DraftAiService draftAiService;
    @Mock
    private DraftService draftService;
    @Mock
    private OffseasonService offseasonService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        DraftController controller = new DraftController(prospectGenerator, scoutingService, draftAiService,
                draftService, offseasonService, AiTeamCatalog.defaults(), new SimulationProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    @DisplayName("GET /teams : les 19 franchises IA")
    void listsAiTeams() throws Exception {
        mockMvc.perform(get("/api/v1/draft/teams"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(19))
                .andExpect(jsonPath("$[0].id").value("steel-city-hammers"));
    }

    @Test
    @DisplayName("POST /class : taille par défaut de 800 si absente")
    void draftClassUsesConfiguredSize() throws Exception {
        when(prospectGenerator.generateDraftClass(800, 2025)).thenReturn(List.of());

        mockMvc.perform(post("/api/v1/draft/class")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"year\": 2025}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        verify(prospectGenerator).generateDraftClass(800, 2025);
    }

    @Test
    @DisplayName("POST /class sans année : 400")
    void draftClassRequiresYear() throws Exception {
        mockMvc.perform(post("/api/v1/draft/class")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"totalPlayers\": 10}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(prospectGenerator);
    }

    @Test
    @DisplayName("POST /scouting : un refus reste un 200 avec son motif")
    void scoutingRefusalIsReturnedAsData() throws Exception {
        when(scoutingService.requestScouting(any(), eq("ultra"), eq(1000L)))
                .thenReturn(ScoutingOutcome.failure("Niveau de scouting inconnu : ultra"));

        mockMvc.perform(post("/api/v1/draft/scouting")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prospect\": " + PROSPECT_JSON + ", \"accuracy\": \"ultra\", \"availableFunds\": 1000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.reason").value("Niveau de scouting inconnu : ultra"));
    }

    @Test
    @DisplayName("POST /scouting : prospect sans traits cachés -> 400")
    void scoutingRequiresHiddenTraits() throws Exception {
        mockMvc.perform(post("/api/v1/draft/scouting")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prospect\": " + PROSPECT_WITHOUT_TRAITS_JSON + ", \"accuracy\": \"low\", \"availableFunds\": 1000}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(scoutingService);
    }

    @Test
    @DisplayName("POST /ai-pick : équipe absente -> 400, équipe inconnue -> 404")
    void aiPickValidatesTeam() throws Exception {
        mockMvc.perform(post("/api/v1/draft/ai-pick")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prospects\": [" + PROSPECT_JSON + "]}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/draft/ai-pick")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"teamId\": \"nowhere\", \"prospects\": [" + PROSPECT_JSON + "]}"))
                .andExpect(status().isNotFound());

        verifyNoInteractions(draftAiService);
    }

    @Test
    @DisplayName("POST /ai-picks : créneau du joueur hors ligue -> 400")
    void aiPicksRejectsInvalidSlot() throws Exception {
        mockMvc.perform(post("/api/v1/draft/ai-picks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prospects\": [], \"playerDraftPosition\": 25}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(draftAiService);
    }
}
