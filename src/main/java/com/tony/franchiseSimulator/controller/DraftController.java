package com.tony.franchiseSimulator.controller;

import com.tony.franchiseSimulator.config.AiTeamCatalog;
import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.model.AiTeam;
import com.tony.franchiseSimulator.model.DraftProspect;
import com.tony.franchiseSimulator.model.PlayerSeasonRecord;
import com.tony.franchiseSimulator.model.dto.AiDraftRequest;
import com.tony.franchiseSimulator.model.dto.DraftClassRequest;
import com.tony.franchiseSimulator.model.dto.DraftOrderRequest;
import com.tony.franchiseSimulator.model.dto.DraftSelectionRequest;
import com.tony.franchiseSimulator.model.dto.ScoutingRequest;
import com.tony.franchiseSimulator.model.result.AiDraftRound;
import com.tony.franchiseSimulator.model.result.DraftOrderEntry;
import com.tony.franchiseSimulator.model.result.DraftPickDecision;
import com.tony.franchiseSimulator.model.result.DraftSelection;
import com.tony.franchiseSimulator.model.result.ScoutingOutcome;
import com.tony.franchiseSimulator.service.DraftAiService;
import com.tony.franchiseSimulator.service.DraftService;
import com.tony.franchiseSimulator.service.OffseasonService;
import com.tony.franchiseSimulator.service.ProspectGeneratorService;
import com.tony.franchiseSimulator.service.ScoutingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/draft")
@RequiredArgsConstructor
public class DraftController {
    private final ProspectGeneratorService prospectGenerator;
    private final ScoutingService scoutingService;
    private final DraftAiService draftAiService;
    private final DraftService draftService;
    private final OffseasonService offseasonService;
    private final AiTeamCatalog aiTeamCatalog;
    private final SimulationProperties properties;

    @GetMapping("/teams")
    public ResponseEntity<List<AiTeam>> getAiTeams() {
        return ResponseEntity.ok(aiTeamCatalog.getTeams());
    }

    @PostMapping("/class")
    public ResponseEntity<List<DraftProspect>> generateDraftClass(@Valid @RequestBody DraftClassRequest request) {
        int total = request.getTotalPlayers() != null ? request.getTotalPlayers() : properties.getDraft().getTotalPlayers();
        return ResponseEntity.ok(prospectGenerator.generateDraftClass(total, request.getYear()));
    }

    // Un refus (fonds, niveau inconnu) reste un 200 : le motif est dans le corps
    @PostMapping("/scouting")
    public ResponseEntity<ScoutingOutcome> scoutProspect(@Valid @RequestBody ScoutingRequest request) {
        return ResponseEntity.ok(scoutingService.requestScouting(
                request.getProspect(), request.getAccuracy(), request.getAvailableFunds()));
    }

    @PostMapping("/ai-pick")
    public ResponseEntity<DraftPickDecision> aiDraftPick(@Valid @RequestBody AiDraftRequest request) {
        if (request.getTeamId() == null) {
            return ResponseEntity.badRequest().build();
        }
        return aiTeamCatalog.findById(request.getTeamId())
                .map(team -> draftAiService.aiDraftPick(team, request.getProspects(), request.getRound()))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/ai-picks")
    public ResponseEntity<AiDraftRound> simulateAiPicks(@Valid @RequestBody AiDraftRequest request) {
        List<AiTeam> teams = aiTeamCatalog.getTeams();
        if (request.getPlayerDraftPosition() > teams.size() + 1) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(draftAiService.simulateAIDraftPicks(teams, request.getProspects(),
                request.getCurrentPick(), request.getPlayerDraftPosition(), request.getRound(), request.isSnakeDraft()));
    }

    @PostMapping("/select")
    public ResponseEntity<DraftSelection> selectProspect(@Valid @RequestBody DraftSelectionRequest request) {
        return ResponseEntity.ok(draftService.draftProspect(request.getProspect(), request.getTier(),
                request.getYear(), request.getRound(), request.getPickNumber()));
    }

    @PostMapping("/order")
    public ResponseEntity<List<DraftOrderEntry>> generateDraftOrder(@Valid @RequestBody DraftOrderRequest request) {
        PlayerSeasonRecord record = new PlayerSeasonRecord(request.getTeamName(), request.getWins(), request.getLosses());
        return ResponseEntity.ok(offseasonService.generateDraftOrder(record, aiTeamCatalog.getTeams(), request.getYear()));
    }
}
