package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.model.AiTeam;
import com.tony.franchiseSimulator.model.DraftProspect;
import com.tony.franchiseSimulator.model.PositionNeed;
import com.tony.franchiseSimulator.model.result.AiDraftPick;
import com.tony.franchiseSimulator.model.result.AiDraftRound;
import com.tony.franchiseSimulator.model.result.DraftPickDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Décisions de draft des équipes IA.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DraftAiService {

    private static final double SCORE_NOISE = 5.0;
    private static final int LATE_ROUND_SHORTLIST = 3;
    private static final int SAFE_FLOOR_RISK_PIVOT = 50;

    private final RatingSampler sampler;
    private final RandomSource randomSource;

    public DraftPickDecision aiDraftPick(AiTeam team, List<DraftProspect> remaining, int round) {
        return aiDraftPick(team, remaining, round, randomSource);
    }

    /**
     * Note chaque prospect disponible selon la philosophie de l'équipe, avec un bruit de connaissance
     * imparfaite. Au 1er round on prend le meilleur score ; ensuite un tirage parmi les 3 premiers.
     */
    public DraftPickDecision aiDraftPick(AiTeam team, List<DraftProspect> remaining, int round, RandomSource random) {
        List<ScoredProspect> scored = new ArrayList<>();
        for (int i = 0; i < remaining.size(); i++) {
            DraftProspect prospect = remaining.get(i);
            if (prospect == null || prospect.isDrafted()) continue;
            scored.add(scoreProspect(team, prospect, i, random));
        }

        if (scored.isEmpty()) {
            log.warn("⚠️ {} : aucun prospect disponible au round {}", team.name(), round);
            return DraftPickDecision.noSelection("Aucun prospect disponible");
        }

        // Tri stable : à score égal, l'ordre de la liste départage
        scored.sort(Comparator.comparingDouble(ScoredProspect::score).reversed());

        int choice = 0;
        if (round > 1) {
            int shortlist = Math.min(LATE_ROUND_SHORTLIST, scored.size());
            choice = sampler.uniformInt(0, shortlist - 1, random);
        }

        ScoredProspect pick = scored.get(choice);
        DraftProspect selected = remaining.get(pick.index());
        log.debug("{} sélectionne {} ({}) : {}", team.name(), selected.getId(), round(pick.score()), pick.reason());
        return new DraftPickDecision(pick.index(), selected.getId(), round(pick.score()), pick.reason());
    }

    private ScoredProspect scoreProspect(AiTeam team, DraftProspect prospect, int index, RandomSource random) {
        double score = prospect.getCurrentRating() + sampler.uniform(-SCORE_NOISE, SCORE_NOISE, random);
        int upside = prospect.getPotential() - prospect.getCurrentRating();
        String reason;

        switch (team.philosophy()) {
            case NEED_BASED -> {
                Optional<PositionNeed> need = team.needFor(prospect.getPosition());
                if (need.isPresent()) {
                    score += need.get().priority() / 5.0;
                    reason = "Comble un besoin au poste " + prospect.getPosition().getCode();
                } else {
                    reason = "Meilleur joueur disponible";
                }
            }
            case UPSIDE_SWING -> {
                score += upside * 2.0;
                reason = "Prospect à fort plafond";
            }
            case SAFE_FLOOR -> {
                score -= upside;
                if (prospect.getHiddenTraits() != null && prospect.getHiddenTraits().injuryProne()
                        && team.riskTolerance() < SAFE_FLOOR_RISK_PIVOT) {
                    score -= (SAFE_FLOOR_RISK_PIVOT - team.riskTolerance()) / 5.0;
                }
                reason = "Choix sûr, faible risque";
            }
            default -> reason = "Meilleur joueur disponible";
        }

        score += sampler.uniform(-SCORE_NOISE, SCORE_NOISE, random);
        return new ScoredProspect(index, score, reason);
    }

    public AiDraftRound simulateAIDraftPicks(List<AiTeam> aiTeams, List<DraftProspect> prospects, int currentPick,
                                             int playerDraftPosition, int round, boolean snakeDraft) {
        return simulateAIDraftPicks(aiTeams, prospects, currentPick, playerDraftPosition, round, snakeDraft, randomSource);
    }

    /**
     * Enchaîne les choix IA à partir de {@code currentPick} jusqu'au créneau du joueur humain,
     * la fin du round ou l'épuisement du vivier. En mode serpent, l'ordre s'inverse aux rounds pairs.
     *
     * @param playerDraftPosition créneau du joueur (1..nombre d'équipes IA + 1)
     */
    public AiDraftRound simulateAIDraftPicks(List<AiTeam> aiTeams, List<DraftProspect> prospects, int currentPick,
                                             int playerDraftPosition, int round, boolean snakeDraft,
                                             RandomSource random) {
        int teamsPerRound = aiTeams.size() + 1;
        if (playerDraftPosition < 1 || playerDraftPosition > teamsPerRound) {
            throw new IllegalArgumentException("Créneau de draft invalide : " + playerDraftPosition);
        }

        List<DraftProspect> pool = new ArrayList<>();
        for (DraftProspect p : prospects) {
            if (!p.isDrafted()) pool.add(p);
        }

        List<AiDraftPick> picks = new ArrayList<>();
        int pick = currentPick;
        int roundEnd = round * teamsPerRound;
        boolean playerOnTheClock = false;

        while (pick <= roundEnd) {
            int slot = slotForPick(pick, round, teamsPerRound, snakeDraft);
            if (slot == playerDraftPosition) {
                playerOnTheClock = true;
                break;
            }
            if (pool.isEmpty()) break;

            // Les équipes IA occupent tous les créneaux sauf celui du joueur
            AiTeam team = aiTeams.get(slot < playerDraftPosition ? slot - 1 : slot - 2);
            DraftPickDecision decision = aiDraftPick(team, pool, round, random);
            if (!decision.hasSelection()) break;

            DraftProspect drafted = pool.remove(decision.selectedIndex()).toBuilder()
                    .drafted(true)
                    .draftedByTeam(team.id())
                    .build();
            picks.add(new AiDraftPick(team.id(), team.name(), drafted, pick, round, decision.reason()));
            pick++;
        }

        log.info("🤖 Round {} : {} choix IA, prochain choix n°{}", round, picks.size(), pick);
        return new AiDraftRound(picks, pool, pick, playerOnTheClock);
    }

    /** Créneau (1-based) qui choisit au numéro global {@code pick}. */
    public int slotForPick(int pick, int round, int teamsPerRound, boolean snakeDraft) {
        int positionInRound = ((pick - 1) % teamsPerRound) + 1;
        if (snakeDraft && round % 2 == 0) {
            return teamsPerRound + 1 - positionInRound;
        }
        return positionInRound;
    }

    private double round(double val) {
        return Math.round(val * 100.0) / 100.0;
    }

    private record ScoredProspect(int index, double score, String reason) {}
}
