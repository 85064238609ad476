package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.config.TierCatalog;
import com.tony.franchiseSimulator.model.*;
import com.tony.franchiseSimulator.model.result.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Passage d'une saison à la suivante : archives, développement hivernal, vieillissement,
 * contrats et ordre de la prochaine draft.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OffseasonService {

    private static final double MIN_AI_WIN_PCT = 0.25;
    private static final double MAX_AI_WIN_PCT = 0.75;
    private static final int RETIREMENT_AGE = 35;
    private static final int DECLINE_AGE = 32;

    private final RatingSampler sampler;
    private final TrainingService trainingService;
    private final TierCatalog tierCatalog;
    private final RandomSource randomSource;

    // -----------------------------------------------------------
    // STATISTIQUES
    // -----------------------------------------------------------

    public SeasonStatsSummary archiveSeasonStats(SeasonStatLine stats, PlayerType type, int year, Tier tier) {
        SeasonStatLine line = stats != null ? stats : createEmptySeasonStats();
        SeasonStatsSummary.SeasonStatsSummaryBuilder summary = SeasonStatsSummary.builder()
                .year(year)
                .tier(tier)
                .gamesPlayed(line.getGamesPlayed());

        if (type == PlayerType.HITTER) {
            double avg = line.getAtBats() > 0 ? round3((double) line.getHits() / line.getAtBats()) : 0.0;
            return summary.battingAverage(avg)
                    .homeRuns(line.getHomeRuns())
                    .rbi(line.getRbi())
                    .stolenBases(line.getStolenBases())
                    .build();
        }
        return summary.wins(line.getWins())
                .losses(line.getLosses())
                .era(era(line))
                .saves(line.getSaves())
                .strikeouts(line.getPitchingStrikeouts())
                .build();
    }

    public SeasonStatLine createEmptySeasonStats() {
        return new SeasonStatLine();
    }

    private Double era(SeasonStatLine line) {
        if (line.getInningsPitched() <= 0) return null;
        return Math.round(line.getEarnedRuns() * 9.0 / line.getInningsPitched() * 100.0) / 100.0;
    }

    // -----------------------------------------------------------
    // DÉVELOPPEMENT & VIEILLISSEMENT
    // -----------------------------------------------------------

    public WinterDevelopment calculateWinterDevelopment(int age, int currentRating, int potential, WorkEthic workEthic) {
        return calculateWinterDevelopment(age, currentRating, potential, workEthic, randomSource);
    }

    /**
     * Progression ou déclin hivernal selon la tranche d'âge. La croissance ne dépasse jamais le potentiel.
     */
    public WinterDevelopment calculateWinterDevelopment(int age, int currentRating, int potential, WorkEthic workEthic,
                                                        RandomSource random) {
        double ethic = workEthic == WorkEthic.EXCELLENT ? 1.3 : workEthic == WorkEthic.POOR ? 0.7 : 1.0;
        int room = Math.max(0, potential - currentRating);

        if (age <= 21) {
            int growth = (int) Math.round(sampler.uniformInt(1, 3, random) * ethic);
            return new WinterDevelopment(Math.min(room, growth), "Développement du jeune prospect");
        }
        if (age <= 24) {
            int growth = (int) Math.round(sampler.uniformInt(1, 2, random) * ethic);
            return new WinterDevelopment(Math.min(room, growth), "Développement continu");
        }
        if (age <= 29) {
            if (room > 0 && sampler.chance(0.5, random)) {
                return new WinterDevelopment(Math.min(room, (int) Math.round(ethic)), "Affinage dans la force de l'âge");
            }
            return new WinterDevelopment(0, "Forme maintenue");
        }
        if (age <= 33) {
            if (sampler.chance(0.4, random)) {
                return new WinterDevelopment(-1, "Premiers effets de l'âge");
            }
            return new WinterDevelopment(0, "Forme maintenue");
        }
        if (age <= 36) {
            double declineChance = 0.4 + (age - 34) * 0.1;
            if (sampler.chance(declineChance, random)) {
                return new WinterDevelopment(-sampler.uniformInt(1, 2, random), "Déclin lié à l'âge");
            }
            return new WinterDevelopment(0, "Résiste au temps");
        }
        double declineChance = 0.6 + (age - 37) * 0.1;
        if (sampler.chance(declineChance, random)) {
            return new WinterDevelopment(-sampler.uniformInt(1, 3, random), "Fin de carrière");
        }
        return new WinterDevelopment(-1, "Vieillit en douceur");
    }

    public AgingResult agePlayer(int age) {
        return agePlayer(age, randomSource);
    }

    /**
     * Un an de plus. Retraite possible au-delà de 35 ans ; le modificateur de déclin (-0.5 par année
     * au-delà de 32 ans) est indicatif, le déclin effectif passe par le développement hivernal.
     */
    public AgingResult agePlayer(int age, RandomSource random) {
        int newAge = age + 1;
        boolean retiring = false;
        if (newAge > RETIREMENT_AGE) {
            // +15% de chances par année au-delà de 35 ans
            retiring = sampler.chance((newAge - RETIREMENT_AGE) * 0.15, random);
        }
        double declineModifier = newAge > DECLINE_AGE ? -(newAge - DECLINE_AGE) * 0.5 : 0.0;
        return new AgingResult(newAge, retiring, declineModifier);
    }

    /** Années de contrat restantes après une saison ; 0 = joueur libre. */
    public int processContractYear(int contractYears) {
        return Math.max(0, contractYears - 1);
    }

    // -----------------------------------------------------------
    // DRAFT
    // -----------------------------------------------------------

    public List<DraftOrderEntry> generateDraftOrder(PlayerSeasonRecord playerRecord, List<AiTeam> aiTeams, int year) {
        return generateDraftOrder(playerRecord, aiTeams, year, randomSource);
    }

    /**
     * Ordre inverse du classement : le plus faible pourcentage de victoires choisit en premier.
     * Les bilans IA sont simulés à partir de leur force de base.
     */
    public List<DraftOrderEntry> generateDraftOrder(PlayerSeasonRecord playerRecord, List<AiTeam> aiTeams, int year,
                                                    RandomSource random) {
        int games = playerRecord.gamesPlayed() > 0
                ? playerRecord.gamesPlayed()
                : tierCatalog.get(Tier.LOW_A).seasonLength();

        List<TeamRecord> records = new ArrayList<>();
        records.add(new TeamRecord(DraftService.PLAYER_TEAM_ID, playerRecord.teamName(),
                playerRecord.wins(), playerRecord.losses()));

        for (AiTeam team : aiTeams) {
            double baseWinPct = 0.35 + (team.baseStrength() / 100.0) * 0.35;
            double variance = (random.next() - 0.5) * team.varianceMultiplier() * 0.15;
            double winPct = Math.max(MIN_AI_WIN_PCT, Math.min(MAX_AI_WIN_PCT, baseWinPct + variance));
            int wins = (int) Math.round(winPct * games);
            records.add(new TeamRecord(team.id(), team.city() + " " + team.name(), wins, games - wins));
        }

        // Tri stable : à égalité, la franchise du joueur garde la priorité
        records.sort(Comparator.comparingDouble(TeamRecord::winPct));

        List<DraftOrderEntry> order = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            TeamRecord r = records.get(i);
            order.add(new DraftOrderEntry(i + 1, r.teamId(), r.teamName(), r.wins(), r.losses(),
                    Math.round(r.winPct() * 1000.0) / 1000.0, year));
        }
        return order;
    }

    /** Créneau de draft de la franchise du joueur (1-based), -1 si absente. */
    public int getPlayerDraftPosition(List<DraftOrderEntry> draftOrder) {
        return draftOrder.stream()
                .filter(e -> DraftService.PLAYER_TEAM_ID.equals(e.teamId()))
                .mapToInt(DraftOrderEntry::pickNumber)
                .findFirst()
                .orElse(-1);
    }

    // -----------------------------------------------------------
    // SÉRIES
    // -----------------------------------------------------------

    /**
     * Parcours archivé à partir du tableau des séries : champion, finaliste si un autre a remporté
     * la finale, demi-finaliste sinon.
     */
    public PlayoffResult determinePlayoffResult(boolean madePlayoffs, String championTeamId, String finalsWinnerId,
                                                String playerTeamId) {
        if (!madePlayoffs) return PlayoffResult.MISSED;
        if (playerTeamId.equals(championTeamId)) return PlayoffResult.CHAMPION;
        if (finalsWinnerId != null && !finalsWinnerId.equals(playerTeamId)) return PlayoffResult.FINALS;
        return PlayoffResult.SEMIFINALS;
    }

    /** Même parcours, déduit des séries simulées : perdre le dernier tour joué vaut une finale. */
    public PlayoffResult determinePlayoffResult(boolean madePlayoffs, PlayoffOutcome outcome) {
        if (!madePlayoffs) return PlayoffResult.MISSED;
        if (outcome.wonChampionship() && outcome.eliminatedIn() == null) return PlayoffResult.CHAMPION;
        if (outcome.wonChampionship() || outcome.eliminatedIn() == PlayoffRound.CHAMPIONSHIP) return PlayoffResult.FINALS;
        return PlayoffResult.SEMIFINALS;
    }

    // -----------------------------------------------------------
    // MVP
    // -----------------------------------------------------------

    public double calculateMvpScore(Player player) {
        SeasonStatLine stats = player.getSeasonStats() != null ? player.getSeasonStats() : createEmptySeasonStats();
        double score = player.getCurrentRating();

        if (player.getPlayerType() == PlayerType.HITTER) {
            score += stats.getHomeRuns() * 2.0;
            score += stats.getRbi() * 0.5;
            score += stats.getHits() * 0.3;
            score += stats.getStolenBases() * 0.5;
            double avg = (double) stats.getHits() / Math.max(1, stats.getAtBats());
            if (avg >= 0.300) score += 10;
            if (avg >= 0.350) score += 10;
        } else {
            score += stats.getWins() * 5.0;
            score += stats.getPitchingStrikeouts() * 0.2;
            score += stats.getSaves() * 3.0;
            Double era = era(stats);
            double effectiveEra = era != null ? era : 5.0;
            if (effectiveEra <= 3.00) score += 15;
            if (effectiveEra <= 2.50) score += 10;
        }
        return score;
    }

    /** Meilleur score MVP du roster ; le premier l'emporte en cas d'égalité. Null si roster vide. */
    public SeasonMvp determineSeasonMvp(List<Player> players) {
        Player best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Player player : players) {
            double score = calculateMvpScore(player);
            if (score > bestScore) {
                bestScore = score;
                best = player;
            }
        }
        return best == null ? null : new SeasonMvp(best.getId(), best.getFullName(), Math.round(bestScore * 10.0) / 10.0);
    }

    // -----------------------------------------------------------
    // INTERSAISON COMPLÈTE
    // -----------------------------------------------------------

    public OffseasonSummary rolloverRoster(List<Player> players, PlayerSeasonRecord record, List<AiTeam> aiTeams,
                                           int completedSeason) {
        return rolloverRoster(players, record, aiTeams, completedSeason, randomSource);
    }

    /**
     * Enchaîne toutes les étapes de l'intersaison sur le roster fourni, sans rien modifier en place.
     */
    public OffseasonSummary rolloverRoster(List<Player> players, PlayerSeasonRecord record, List<AiTeam> aiTeams,
                                           int completedSeason, RandomSource random) {
        List<Player> active = players.stream().filter(Player::isOnRoster).toList();
        SeasonMvp mvp = determineSeasonMvp(active);

        List<Player> roster = new ArrayList<>();
        List<Player> retired = new ArrayList<>();
        List<Player> released = new ArrayList<>();

        for (Player player : active) {
            List<SeasonStatsSummary> career = new ArrayList<>(player.getCareerStats());
            career.add(archiveSeasonStats(player.getSeasonStats(), player.getPlayerType(), completedSeason, player.getTier()));

            WorkEthic ethic = player.getHiddenTraits() != null ? player.getHiddenTraits().workEthic() : WorkEthic.AVERAGE;
            WinterDevelopment development = calculateWinterDevelopment(player.getAge(), player.getCurrentRating(),
                    player.getPotential(), ethic, random);
            int newRating = RatingSampler.clampRating(player.getCurrentRating() + development.ratingChange());

            AgingResult aging = agePlayer(player.getAge(), random);
            int contractYears = processContractYear(player.getContractYears());

            Player updated = player.toBuilder()
                    .age(aging.newAge())
                    .currentRating(newRating)
                    .contractYears(contractYears)
                    .yearsInOrg(player.getYearsInOrg() + 1)
                    .injured(false)
                    .injuryWeeks(0)
                    .seasonStats(createEmptySeasonStats())
                    .careerStats(career)
                    .progressionRate(trainingService.calculateProgressionRate(aging.newAge(), player.getPotential(), newRating))
                    .build();

            if (aging.retiring()) {
                updated.setOnRoster(false);
                retired.add(updated);
            } else if (contractYears == 0) {
                updated.setOnRoster(false);
                released.add(updated);
            } else {
                roster.add(updated);
            }
        }

        List<DraftOrderEntry> draftOrder = generateDraftOrder(record, aiTeams, completedSeason + 1, random);
        int draftPosition = getPlayerDraftPosition(draftOrder);

        log.info("📅 Intersaison {} : {} joueurs conservés, {} retraites, {} fins de contrat, choix de draft n°{}",
                completedSeason, roster.size(), retired.size(), released.size(), draftPosition);
        return new OffseasonSummary(completedSeason, roster, retired, released, draftOrder, draftPosition, mvp);
    }

    private double round3(double val) {
        return Math.round(val * 1000.0) / 1000.0;
    }

    private record TeamRecord(String teamId, String teamName, int wins, int losses) {
        double winPct() {
            int games = wins + losses;
            return games > 0 ? (double) wins / games : 0.0;
        }
    }
}
