package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.config.TierCatalog;
import com.tony.franchiseSimulator.model.*;
import com.tony.franchiseSimulator.model.dto.SeasonRequest;
import com.tony.franchiseSimulator.model.result.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Bilan statistique d'une saison, sans simulation match par match : force de l'équipe,
 * espérance pythagoricienne, record avec variance gaussienne, séries, affluence et blessures.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeasonService {

    private static final double DEFAULT_RATING = 40.0;
    private static final double OFFENSE_BIAS_RANGE = 10.0;
    private static final double AI_VARIANCE_BOUND = 8.0;
    private static final double PLAYOFF_LUCK_RANGE = 10.0;

    private final RatingSampler sampler;
    private final SimulationProperties properties;
    private final TierCatalog tierCatalog;
    private final CityService cityService;
    private final RandomSource randomSource;

    // -----------------------------------------------------------
    // FORCE DES ÉQUIPES
    // -----------------------------------------------------------

    /**
     * Attaque = moyenne des frappeurs, défense = moyenne des lanceurs (joueurs valides du roster),
     * corrigées par le staff et le moral. Bornées à [20, 80].
     */
    public TeamStrength calculateTeamStrength(List<Player> players, int hittingCoachSkill, int pitchingCoachSkill) {
        SimulationProperties.Season cfg = properties.getSeason();
        List<Player> available = players.stream()
                .filter(p -> p.isOnRoster() && !p.isInjured())
                .toList();
        if (available.isEmpty()) {
            return TeamStrength.balanced(DEFAULT_RATING);
        }

        double hitters = averageRating(available, PlayerType.HITTER);
        double pitchers = averageRating(available, PlayerType.PITCHER);

        double hittingBonus = ((hittingCoachSkill - 50) / 30.0) * cfg.getCoachingWeight() * 10;
        double pitchingBonus = ((pitchingCoachSkill - 50) / 30.0) * cfg.getCoachingWeight() * 10;
        double averageMorale = available.stream().mapToInt(Player::getMorale).average().orElse(50);
        double moraleBonus = ((averageMorale - 50) / 50.0) * cfg.getMoraleWeight() * 5;

        return new TeamStrength(
                clamp(hitters + hittingBonus + moraleBonus, 20, 80),
                clamp(pitchers + pitchingBonus + moraleBonus, 20, 80));
    }

    private double averageRating(List<Player> players, PlayerType type) {
        return players.stream()
                .filter(p -> p.getPlayerType() == type)
                .mapToInt(Player::getCurrentRating)
                .average()
                .orElse(DEFAULT_RATING);
    }

    public TeamStrength calculateAiTeamStrength(AiTeam team, Tier tier) {
        return calculateAiTeamStrength(team, tier, randomSource);
    }

    /**
     * Force de base de l'équipe IA, +5 par niveau au-dessus du Low-A, avec un biais attaque/défense
     * et une variance propre à l'équipe. Bornée à [25, 75].
     */
    public TeamStrength calculateAiTeamStrength(AiTeam team, Tier tier, RandomSource random) {
        double base = team.baseStrength() + tier.ordinal() * 5;
        double spread = 3 * team.varianceMultiplier();
        double offenseVariance = clamp(sampler.normal(0, spread, random), -AI_VARIANCE_BOUND, AI_VARIANCE_BOUND);
        double defenseVariance = clamp(sampler.normal(0, spread, random), -AI_VARIANCE_BOUND, AI_VARIANCE_BOUND);
        double offenseBias = (random.next() - 0.5) * OFFENSE_BIAS_RANGE;

        return new TeamStrength(
                clamp(base + offenseBias + offenseVariance, 25, 75),
                clamp(base - offenseBias + defenseVariance, 25, 75));
    }

    // -----------------------------------------------------------
    // POURCENTAGE DE VICTOIRES
    // -----------------------------------------------------------

    /** Points attendus : moyenne de la ligue × attaque / √(défense adverse). */
    public double calculateExpectedRuns(double offense, double opposingDefense) {
        double offenseMultiplier = 0.7 + offense / 100.0;
        double defenseMultiplier = 0.7 + opposingDefense / 100.0;
        return properties.getSeason().getRunsPerGame() * offenseMultiplier / Math.sqrt(defenseMultiplier);
    }

    /**
     * Espérance pythagoricienne RS^e / (RS^e + RA^e), bornée à [.250, .750].
     */
    public double calculateExpectedWinPct(TeamStrength team, TeamStrength opponent) {
        SimulationProperties.Season cfg = properties.getSeason();
        double scored = Math.pow(calculateExpectedRuns(team.offense(), opponent.defense()), cfg.getPythagoreanExponent());
        double allowed = Math.pow(calculateExpectedRuns(opponent.offense(), team.defense()), cfg.getPythagoreanExponent());
        return clamp(scored / (scored + allowed), cfg.getMinExpectedWinPct(), cfg.getMaxExpectedWinPct());
    }

    public double calculateExpectedWinPct(double teamStrength, double opponentStrength) {
        return calculateExpectedWinPct(TeamStrength.balanced(teamStrength), TeamStrength.balanced(opponentStrength));
    }

    public SeasonRecord simulateSeasonRecord(double expectedWinPct, int totalGames) {
        return simulateSeasonRecord(expectedWinPct, totalGames, randomSource);
    }

    /**
     * Chaque match : probabilité attendue + bruit gaussien borné, puis un tirage victoire/défaite.
     */
    public SeasonRecord simulateSeasonRecord(double expectedWinPct, int totalGames, RandomSource random) {
        if (totalGames < 0) {
            throw new IllegalArgumentException("Nombre de matchs négatif : " + totalGames);
        }
        SimulationProperties.Season cfg = properties.getSeason();
        int wins = 0;
        for (int game = 0; game < totalGames; game++) {
            double noise = clamp(sampler.normal(0, cfg.getGameVarianceStdDev(), random),
                    -cfg.getGameVarianceBound(), cfg.getGameVarianceBound());
            double probability = clamp(expectedWinPct + noise,
                    cfg.getMinGameWinProbability(), cfg.getMaxGameWinProbability());
            if (sampler.chance(probability, random)) {
                wins++;
            }
        }
        double winPct = totalGames > 0 ? (double) wins / totalGames : 0.0;
        return new SeasonRecord(wins, totalGames - wins, winPct);
    }

    // -----------------------------------------------------------
    // CLASSEMENT & SÉRIES
    // -----------------------------------------------------------

    public LeagueStandings simulateLeagueStandings(double playerStrength, List<AiTeam> aiTeams, Tier tier) {
        return simulateLeagueStandings(playerStrength, aiTeams, tier, randomSource);
    }

    /**
     * Chaque équipe joue contre la force moyenne de la ligue. Tri stable par pourcentage décroissant :
     * à égalité, la franchise du joueur reste devant.
     */
    public LeagueStandings simulateLeagueStandings(double playerStrength, List<AiTeam> aiTeams, Tier tier,
                                                   RandomSource random) {
        int games = tierCatalog.get(tier).seasonLength();

        List<Double> aiStrengths = new ArrayList<>(aiTeams.size());
        for (AiTeam team : aiTeams) {
            aiStrengths.add(calculateAiTeamStrength(team, tier, random).overall());
        }
        double leagueStrength = aiStrengths.stream().mapToDouble(Double::doubleValue).average().orElse(playerStrength);

        List<TeamStanding> standings = new ArrayList<>();
        SeasonRecord own = simulateSeasonRecord(calculateExpectedWinPct(playerStrength, leagueStrength), games, random);
        standings.add(new TeamStanding(DraftService.PLAYER_TEAM_ID, "Votre équipe",
                own.wins(), own.losses(), own.winPct(), playerStrength));

        for (int i = 0; i < aiTeams.size(); i++) {
            AiTeam team = aiTeams.get(i);
            double strength = aiStrengths.get(i);
            SeasonRecord record = simulateSeasonRecord(calculateExpectedWinPct(strength, leagueStrength), games, random);
            standings.add(new TeamStanding(team.id(), team.city() + " " + team.name(),
                    record.wins(), record.losses(), record.winPct(), strength));
        }

        standings.sort(Comparator.comparingDouble(TeamStanding::winPct).reversed());

        int rank = 1;
        for (TeamStanding standing : standings) {
            if (DraftService.PLAYER_TEAM_ID.equals(standing.teamId())) break;
            rank++;
        }
        return new LeagueStandings(standings, rank, rank <= properties.getSeason().getPlayoffTeams(), rank == 1);
    }

    public PlayoffOutcome simulatePlayoffs(double playerStrength, boolean madePlayoffs, int playerRank, Tier tier) {
        return simulatePlayoffs(playerStrength, madePlayoffs, playerRank, tier, randomSource);
    }

    /**
     * Trois tours au plus : divisionnaire, championnat, puis Série mondiale en MLB uniquement.
     * Chaque tour compare les forces, chacune affectée d'une chance dans [-5, 5).
     */
    public PlayoffOutcome simulatePlayoffs(double playerStrength, boolean madePlayoffs, int playerRank, Tier tier,
                                           RandomSource random) {
        if (!madePlayoffs) {
            return PlayoffOutcome.missed();
        }

        // Le premier affronte le 4e, le deuxième le 3e : l'adversaire est plus fort pour les mieux classés
        double divisionalOpponent = 50 + (4 - Math.min(playerRank, 4)) * 3;
        if (!winsRound(playerStrength, divisionalOpponent, random)) {
            return new PlayoffOutcome(false, false, PlayoffRound.DIVISIONAL);
        }

        double championshipOpponent = 55 + luck(random);
        if (!winsRound(playerStrength, championshipOpponent, random)) {
            return new PlayoffOutcome(false, false, PlayoffRound.CHAMPIONSHIP);
        }

        if (tier != Tier.MLB) {
            return new PlayoffOutcome(true, false, null);
        }

        double worldSeriesOpponent = 60 + luck(random);
        if (!winsRound(playerStrength, worldSeriesOpponent, random)) {
            return new PlayoffOutcome(true, false, PlayoffRound.WORLD_SERIES);
        }
        return new PlayoffOutcome(true, true, null);
    }

    private boolean winsRound(double playerStrength, double opponentStrength, RandomSource random) {
        double player = playerStrength + luck(random);
        double opponent = opponentStrength + luck(random);
        return player > opponent;
    }

    private double luck(RandomSource random) {
        return random.next() * PLAYOFF_LUCK_RANGE - PLAYOFF_LUCK_RANGE / 2;
    }

    // -----------------------------------------------------------
    // AFFLUENCE
    // -----------------------------------------------------------

    public AttendanceResult calculateAttendance(int stadiumCapacity, double winPct, int cityPride, double unemploymentRate,
                                                int stadiumQuality, int homeGames, double fanMultiplier) {
        return calculateAttendance(stadiumCapacity, winPct, cityPride, unemploymentRate, stadiumQuality, homeGames,
                fanMultiplier, randomSource);
    }

    /**
     * 40% de la capacité, modulés par les victoires (exposant 1.5), la fierté, le chômage, la qualité
     * du stade et le quartier divertissement, puis ±10% de variance. Jamais au-delà de la capacité.
     */
    public AttendanceResult calculateAttendance(int stadiumCapacity, double winPct, int cityPride, double unemploymentRate,
                                                int stadiumQuality, int homeGames, double fanMultiplier,
                                                RandomSource random) {
        double attendance = stadiumCapacity * 0.4;
        attendance *= Math.pow(winPct / 0.5, 1.5);
        attendance *= 0.7 + (cityPride / 100.0) * 0.8;
        attendance *= 1 - (unemploymentRate / 100.0) * 0.5;
        attendance *= 0.8 + (stadiumQuality / 100.0) * 0.4;
        attendance *= fanMultiplier;
        attendance *= 0.9 + random.next() * 0.2;

        int average = (int) Math.min(Math.round(attendance), stadiumCapacity);
        return new AttendanceResult(average, (long) average * homeGames);
    }

    // -----------------------------------------------------------
    // BLESSURES
    // -----------------------------------------------------------

    public InjuryResult simulateInjury(Player player) {
        return simulateInjury(player, randomSource);
    }

    /**
     * Seuls les joueurs fragiles peuvent se blesser : 20% de risque, 30 à 60 matchs d'absence.
     * Aucun tirage n'est consommé pour les autres.
     */
    public InjuryResult simulateInjury(Player player, RandomSource random) {
        HiddenTraits traits = player.getHiddenTraits();
        if (traits == null || !traits.injuryProne()) {
            return InjuryResult.healthy();
        }
        SimulationProperties.Season cfg = properties.getSeason();
        if (!sampler.chance(cfg.getInjuryChance(), random)) {
            return InjuryResult.healthy();
        }
        return new InjuryResult(true, sampler.uniformInt(cfg.getMinGamesLost(), cfg.getMaxGamesLost(), random));
    }

    /** Copie du joueur mise à l'infirmerie : c'est ce statut qui réduit son gain d'XP à l'entraînement. */
    public Player applyInjury(Player player, InjuryResult injury) {
        if (!injury.injured()) return player;
        int weeks = (int) Math.ceil(injury.gamesLost() / (double) properties.getSeason().getGamesPerWeek());
        return player.toBuilder()
                .injured(true)
                .injuryWeeks(weeks)
                .build();
    }

    // -----------------------------------------------------------
    // SAISON COMPLÈTE
    // -----------------------------------------------------------

    public SeasonSimulationResult simulateSeason(SeasonRequest request, List<AiTeam> aiTeams) {
        return simulateSeason(request, aiTeams, randomSource);
    }

    /**
     * Enchaîne blessures, force, classement, séries et affluence. Les joueurs blessés pendant la saison
     * ne comptent plus dans la force de l'équipe.
     */
    public SeasonSimulationResult simulateSeason(SeasonRequest request, List<AiTeam> aiTeams, RandomSource random) {
        TierConfig tierConfig = tierCatalog.get(request.getTier());

        List<Player> roster = new ArrayList<>();
        List<PlayerInjury> injuries = new ArrayList<>();
        for (Player player : request.getPlayers()) {
            if (!player.isOnRoster()) {
                roster.add(player);
                continue;
            }
            InjuryResult injury = simulateInjury(player, random);
            if (injury.injured()) {
                injuries.add(new PlayerInjury(player.getId(), player.getFullName(), injury.gamesLost()));
            }
            roster.add(applyInjury(player, injury));
        }

        TeamStrength strength = calculateTeamStrength(roster, request.getHittingCoachSkill(), request.getPitchingCoachSkill());
        LeagueStandings standings = simulateLeagueStandings(strength.overall(), aiTeams, request.getTier(), random);
        TeamStanding own = standings.standings().get(standings.playerRank() - 1);
        PlayoffOutcome playoffs = simulatePlayoffs(strength.overall(), standings.madePlayoffs(),
                standings.playerRank(), request.getTier(), random);

        int capacity = request.getStadiumCapacity() > 0 ? request.getStadiumCapacity() : tierConfig.stadiumCapacity();
        DistrictBonuses bonuses = cityService.calculateBonuses(request.getBuildings());
        AttendanceResult attendance = calculateAttendance(capacity, own.winPct(), request.getCityPride(),
                request.getUnemploymentRate(), request.getStadiumQuality(), tierConfig.seasonLength() / 2,
                bonuses.fanMultiplier(), random);
        double attendanceRate = Math.round((double) attendance.averageAttendance() / capacity * 1000.0) / 1000.0;

        log.info("⚾ Saison {} : {}-{} (rang {}), séries {}, affluence moyenne {}, {} blessé(s)",
                request.getTier(), own.wins(), own.losses(), standings.playerRank(),
                standings.madePlayoffs() ? "oui" : "non", attendance.averageAttendance(), injuries.size());

        return new SeasonSimulationResult(
                own.wins(),
                own.losses(),
                Math.round(own.winPct() * 1000.0) / 1000.0,
                standings.playerRank(),
                standings.madePlayoffs(),
                standings.wonDivision(),
                playoffs.wonChampionship(),
                playoffs.wonWorldSeries(),
                Math.round(strength.overall() * 10.0) / 10.0,
                attendance.averageAttendance(),
                attendance.totalAttendance(),
                attendanceRate,
                injuries);
    }

    private double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
