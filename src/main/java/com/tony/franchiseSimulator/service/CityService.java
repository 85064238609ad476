package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.config.TierCatalog;
import com.tony.franchiseSimulator.model.*;
import com.tony.franchiseSimulator.model.dto.CityGrowthRequest;
import com.tony.franchiseSimulator.model.result.BuildingUpgrade;
import com.tony.franchiseSimulator.model.result.CityEvent;
import com.tony.franchiseSimulator.model.result.CityGrowthResult;
import com.tony.franchiseSimulator.model.result.CityMetricsUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ville hôte : état initial, bonus de quartier dérivés des bâtiments ouverts et croissance
 * annuelle portée par les résultats de l'équipe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CityService {

    private static final Map<Integer, Double> INITIAL_STATE_WEIGHTS = new LinkedHashMap<>();
    private static final Map<BuildingType, Double> BUILDING_TYPE_WEIGHTS = new LinkedHashMap<>();

    static {
        INITIAL_STATE_WEIGHTS.put(0, 0.60);
        INITIAL_STATE_WEIGHTS.put(1, 0.25);
        INITIAL_STATE_WEIGHTS.put(2, 0.10);
        INITIAL_STATE_WEIGHTS.put(3, 0.05);

        BUILDING_TYPE_WEIGHTS.put(BuildingType.RESTAURANT, 0.30);
        BUILDING_TYPE_WEIGHTS.put(BuildingType.BAR, 0.20);
        BUILDING_TYPE_WEIGHTS.put(BuildingType.RETAIL, 0.25);
        BUILDING_TYPE_WEIGHTS.put(BuildingType.HOTEL, 0.15);
        BUILDING_TYPE_WEIGHTS.put(BuildingType.CORPORATE, 0.10);
    }

    private static final Map<BuildingType, List<String>> BUILDING_NAMES = new EnumMap<>(BuildingType.class);
    private static final Map<Tier, TierGrowth> GROWTH_BY_TIER = new EnumMap<>(Tier.class);

    static {
        BUILDING_NAMES.put(BuildingType.RESTAURANT, List.of(
                "The Dugout Grill", "Home Plate Diner", "Seventh Inning Stretch Cafe", "The Grand Slam",
                "Bullpen BBQ", "The Batting Cage Bistro", "Curveball Kitchen", "The Fastball Grill",
                "Diamond Diner", "The Rookie's Table", "Bases Loaded Burgers", "Extra Innings Eatery"));
        BUILDING_NAMES.put(BuildingType.BAR, List.of(
                "The Closer's Pub", "Rally Cap Tavern", "The Press Box Bar", "Bleacher Bums",
                "The Ninth Inning", "Southpaw Saloon", "The Bullpen", "Slider's Sports Bar",
                "The Pinch Hit", "Changeup Brewing Co.", "The Double Play", "Foul Line Taphouse"));
        BUILDING_NAMES.put(BuildingType.RETAIL, List.of(
                "Team Spirit Shop", "Champions Corner", "The Ballpark Store", "Hat Trick Sports",
                "Jersey Junction", "The Fan Zone", "Pennant Plaza", "Trophy Case Collectibles",
                "Diamond District", "Clubhouse Gear", "MVP Memorabilia", "Batting Practice Pro Shop"));
        BUILDING_NAMES.put(BuildingType.HOTEL, List.of(
                "The Grand Slam Inn", "Championship Suites", "Ballpark Plaza Hotel", "The Diamond Hotel",
                "Stadium View Inn", "The Pennant Hotel", "Victory Suites", "The Champions Lodge", "Clubhouse Hotel"));
        BUILDING_NAMES.put(BuildingType.CORPORATE, List.of(
                "Stadium Square Offices", "Diamond Business Center", "Championship Tower",
                "Victory Corporate Park", "Pennant Plaza Offices", "The Press Box Building",
                "Grand Slam Business Center", "Ballpark Professional Center"));

        GROWTH_BY_TIER.put(Tier.LOW_A, new TierGrowth(500, 200, 100, 500, 20));
        GROWTH_BY_TIER.put(Tier.HIGH_A, new TierGrowth(1_000, 400, 200, 800, 30));
        GROWTH_BY_TIER.put(Tier.DOUBLE_A, new TierGrowth(2_000, 800, 400, 1_200, 50));
        GROWTH_BY_TIER.put(Tier.TRIPLE_A, new TierGrowth(4_000, 1_500, 750, 2_000, 80));
        GROWTH_BY_TIER.put(Tier.MLB, new TierGrowth(8_000, 3_000, 1_500, 3_000, 120));
    }

    private static final int STARTING_PRIDE = 30;
    private static final int STARTING_RECOGNITION = 5;

    // Un bâtiment amélioré tous les 20 points de score de réussite
    private static final double SUCCESS_SCORE_PER_UPGRADE = 20.0;
    private static final double MIN_UNEMPLOYMENT = 3.0;
    private static final int MAX_OPENING_EVENTS = 2;

    private final TierCatalog tierCatalog;
    private final RatingSampler sampler;
    private final RandomSource randomSource;

    /**
     * Chaque bâtiment ouvert (état >= 2) ajoute son bonus au multiplicateur de son quartier.
     */
    public DistrictBonuses calculateBonuses(List<Building> buildings) {
        if (buildings == null) return DistrictBonuses.neutral();
        double income = 0.0;
        double fan = 0.0;
        double training = 0.0;

        for (Building building : buildings) {
            if (!building.isOpen()) continue;
            BuildingType type = building.getType();
            switch (type.getDistrict()) {
                case COMMERCIAL -> income += type.getBonus();
                case ENTERTAINMENT -> fan += type.getBonus();
                case PERFORMANCE -> training += type.getBonus();
            }
        }
        return new DistrictBonuses(round(1.0 + income), round(1.0 + fan), round(1.0 + training));
    }

    public int countOpenBuildings(List<Building> buildings) {
        return (int) buildings.stream().filter(Building::isOpen).count();
    }

    public CityState generateInitialCity(Tier tier) {
        return generateInitialCity(tier, randomSource);
    }

    /**
     * Ville de départ : démographie du niveau et 50 parcelles, majoritairement vides.
     */
    public CityState generateInitialCity(Tier tier, RandomSource random) {
        TierConfig config = tierCatalog.get(tier);
        List<Building> buildings = new ArrayList<>(CityState.BUILDING_COUNT);

        for (int id = 0; id < CityState.BUILDING_COUNT; id++) {
            int state = sampler.weightedChoice(INITIAL_STATE_WEIGHTS, random);
            BuildingType type = state > 0 ? pickBuildingType(tier, random) : null;
            buildings.add(Building.builder()
                    .id(id)
                    .state(state)
                    .type(type)
                    .build());
        }

        CityState city = CityState.builder()
                .population(config.population())
                .medianIncome(config.medianIncome())
                .unemploymentRate(config.unemploymentRate())
                .teamPride(STARTING_PRIDE)
                .nationalRecognition(STARTING_RECOGNITION)
                .buildings(buildings)
                .build();

        log.info("🏙️ Ville initiale ({}) : {} bâtiments ouverts", tier, countOpenBuildings(buildings));
        return city;
    }

    // -----------------------------------------------------------
    // CROISSANCE ANNUELLE
    // -----------------------------------------------------------

    /**
     * (winPct - 0.5) × 100 + taux de remplissage × 30 + 20 en cas de qualification pour les séries.
     */
    public double calculateSuccessScore(double winPct, double attendanceRate, boolean madePlayoffs) {
        return (winPct - 0.5) * 100 + attendanceRate * 30 + (madePlayoffs ? 20 : 0);
    }

    public List<BuildingUpgrade> determineBuildingUpgrades(List<Building> buildings, int upgradeCount, Tier tier) {
        return determineBuildingUpgrades(buildings, upgradeCount, tier, randomSource);
    }

    /**
     * Améliorations par priorité : terrains vagues mis en travaux, puis ouvertures, extensions
     * et enfin statut emblématique. Un bâtiment avance d'un seul état par saison.
     */
    public List<BuildingUpgrade> determineBuildingUpgrades(List<Building> buildings, int upgradeCount, Tier tier,
                                                           RandomSource random) {
        List<BuildingUpgrade> upgrades = new ArrayList<>();
        if (upgradeCount <= 0) return upgrades;

        List<String> existingNames = new ArrayList<>();
        for (Building building : buildings) {
            if (building.getName() != null) existingNames.add(building.getName());
        }

        int remaining = upgradeCount;
        for (int state = 0; state < Building.MAX_STATE && remaining > 0; state++) {
            for (Building building : buildings) {
                if (remaining == 0) break;
                if (building.getState() != state) continue;

                if (state == 0) {
                    upgrades.add(new BuildingUpgrade(building.getId(), 0, 1, null, pickBuildingType(tier, random)));
                } else if (state == 1) {
                    BuildingType type = building.getType();
                    BuildingType newType = null;
                    if (type == null) {
                        type = pickBuildingType(tier, random);
                        newType = type;
                    }
                    String name = generateBuildingName(type, existingNames, random);
                    existingNames.add(name);
                    upgrades.add(new BuildingUpgrade(building.getId(), 1, 2, name, newType));
                } else {
                    upgrades.add(new BuildingUpgrade(building.getId(), state, state + 1, null, null));
                }
                remaining--;
            }
        }
        return upgrades;
    }

    /** Nom libre de la liste du type ; une fois la liste épuisée, nom numéroté. */
    private String generateBuildingName(BuildingType type, List<String> existingNames, RandomSource random) {
        List<String> available = BUILDING_NAMES.get(type).stream()
                .filter(name -> !existingNames.contains(name))
                .toList();
        if (available.isEmpty()) {
            String prefix = fallbackLabel(type) + " #";
            long count = existingNames.stream().filter(n -> n.startsWith(prefix)).count();
            return prefix + (count + 1);
        }
        return available.get(sampler.uniformInt(0, available.size() - 1, random));
    }

    private String fallbackLabel(BuildingType type) {
        return switch (type) {
            case RESTAURANT -> "Restaurant";
            case BAR -> "Bar";
            case RETAIL -> "Boutique";
            case HOTEL -> "Hôtel";
            case CORPORATE -> "Bureaux";
        };
    }

    /**
     * Démographie, revenu, chômage, fierté et notoriété après la saison.
     */
    public CityMetricsUpdate calculateCityMetrics(CityState city, double successScore, int buildingsUpgraded, Tier tier,
                                                  boolean madePlayoffs, boolean wonChampionship, boolean wonWorldSeries,
                                                  double winPct) {
        TierGrowth growth = GROWTH_BY_TIER.get(tier);

        double populationGrowth = growth.populationBase()
                + (winPct - 0.5) * growth.populationPerWinPct() * 2
                + (city.getTeamPride() / 100.0) * growth.populationPerPride();
        int population = (int) Math.round(city.getPopulation() + populationGrowth);

        double occupancy = (double) (countOpenBuildings(city.getBuildings()) + buildingsUpgraded) / CityState.BUILDING_COUNT;
        int medianIncome = (int) Math.round(city.getMedianIncome() + growth.incomeBase() + occupancy * growth.incomePerOccupancy());

        double unemploymentDrop = buildingsUpgraded * 0.3 + Math.max(0, successScore) * 0.01;
        double unemployment = Math.max(MIN_UNEMPLOYMENT, city.getUnemploymentRate() - unemploymentDrop);

        int prideChange = winPct >= 0.5 ? 5 : -3;
        if (madePlayoffs) prideChange += 8;
        if (wonChampionship) prideChange += 15;
        if (wonWorldSeries) prideChange += 25;
        prideChange += buildingsUpgraded;
        int pride = clampPercent(city.getTeamPride() + prideChange);

        int recognitionChange = 0;
        if (madePlayoffs) recognitionChange += 3;
        if (wonChampionship) recognitionChange += 8;
        if (wonWorldSeries) recognitionChange += 20;
        int recognition = clampPercent(city.getNationalRecognition() + recognitionChange);

        return new CityMetricsUpdate(population, medianIncome, unemployment, pride, recognition, occupancy);
    }

    /**
     * Événements narratifs : ouvertures (deux au plus), monuments, paliers de remplissage
     * et de population, titres.
     */
    public List<CityEvent> generateCityEvents(List<BuildingUpgrade> changes, CityMetricsUpdate metrics, CityState previous,
                                              int year, boolean wonChampionship, boolean wonWorldSeries) {
        List<CityEvent> events = new ArrayList<>();

        changes.stream()
                .filter(c -> c.previousState() == 1 && c.newState() == 2)
                .limit(MAX_OPENING_EVENTS)
                .forEach(c -> events.add(new CityEvent(year, CityEventType.CITY_GROWTH,
                        c.newName() + " ouvre ses portes !",
                        "Un nouveau commerce s'installe près du stade, attiré par l'affluence des soirs de match.",
                        1, 0, c.buildingId())));

        changes.stream()
                .filter(c -> c.previousState() == 3 && c.newState() == 4)
                .forEach(c -> events.add(new CityEvent(year, CityEventType.CITY_GROWTH,
                        "Classé monument historique",
                        "Un commerce du quartier devient un lieu emblématique de la ville.",
                        3, 2, c.buildingId())));

        double previousOccupancy = (double) countOpenBuildings(previous.getBuildings()) / CityState.BUILDING_COUNT;
        if (crossed(previousOccupancy, metrics.occupancyRate(), 0.50)) {
            events.add(milestone(year, "Renouveau du centre-ville",
                    "La moitié des bâtiments du centre sont occupés : la ville se relève.", 5, 0));
        }
        if (crossed(previousOccupancy, metrics.occupancyRate(), 0.75)) {
            events.add(milestone(year, "Boom économique",
                    "Le quartier du stade prospère et attire de nouvelles enseignes.", 8, 5));
        }
        if (crossed(previousOccupancy, metrics.occupancyRate(), 0.90)) {
            events.add(milestone(year, "Une ville transformée",
                    "La ville en difficulté est devenue une communauté vivante grâce à son équipe.", 15, 10));
        }
        if (crossed(previous.getPopulation(), metrics.population(), 50_000)) {
            events.add(milestone(year, "Cap des 50 000 habitants",
                    "Les entreprises de la région commencent à s'intéresser à la ville.", 0, 0));
        }
        if (crossed(previous.getPopulation(), metrics.population(), 100_000)) {
            events.add(milestone(year, "Métropole régionale",
                    "Avec 100 000 habitants, la ville devient un pôle régional.", 0, 10));
        }

        if (wonWorldSeries) {
            events.add(new CityEvent(year, CityEventType.STADIUM_MOMENT, "Champions du monde !",
                    "La ville entière célèbre le titre lors d'une parade géante.", 25, 20, null));
        } else if (wonChampionship) {
            events.add(new CityEvent(year, CityEventType.STADIUM_MOMENT, "Champions de la ligue !",
                    "Le titre enflamme la ville et lance la dynamique vers le niveau supérieur.", 15, 8, null));
        }
        return events;
    }

    private CityEvent milestone(int year, String title, String description, int pride, int recognition) {
        return new CityEvent(year, CityEventType.ECONOMIC_MILESTONE, title, description, pride, recognition, null);
    }

    private boolean crossed(double before, double after, double threshold) {
        return before < threshold && after >= threshold;
    }

    public CityGrowthResult simulateCityGrowth(CityGrowthRequest request) {
        return simulateCityGrowth(request, randomSource);
    }

    /**
     * Une saison de croissance : score de réussite, améliorations de bâtiments, nouvelles métriques
     * et événements. Renvoie une nouvelle ville, l'état fourni n'est pas modifié.
     */
    public CityGrowthResult simulateCityGrowth(CityGrowthRequest request, RandomSource random) {
        CityState current = request.getCityState();
        double successScore = calculateSuccessScore(request.getWinPct(), request.getAttendanceRate(), request.isMadePlayoffs());
        int upgradeCount = Math.max(0, (int) Math.floor(successScore / SUCCESS_SCORE_PER_UPGRADE));

        List<BuildingUpgrade> upgrades = determineBuildingUpgrades(current.getBuildings(), upgradeCount,
                request.getTier(), random);
        CityMetricsUpdate metrics = calculateCityMetrics(current, successScore, upgrades.size(), request.getTier(),
                request.isMadePlayoffs(), request.isWonChampionship(), request.isWonWorldSeries(), request.getWinPct());
        List<CityEvent> events = generateCityEvents(upgrades, metrics, current, request.getYear(),
                request.isWonChampionship(), request.isWonWorldSeries());

        CityState next = CityState.builder()
                .population(metrics.population())
                .medianIncome(metrics.medianIncome())
                .unemploymentRate(metrics.unemploymentRate())
                .teamPride(metrics.teamPride())
                .nationalRecognition(metrics.nationalRecognition())
                .buildings(applyUpgrades(current.getBuildings(), upgrades, request.getYear()))
                .build();

        log.info("🏗️ Croissance {} : score {}, {} bâtiment(s) amélioré(s), fierté {} -> {}",
                request.getYear(), Math.round(successScore), upgrades.size(), current.getTeamPride(), next.getTeamPride());
        return new CityGrowthResult(successScore, upgrades.size(), next, upgrades, events);
    }

    private List<Building> applyUpgrades(List<Building> buildings, List<BuildingUpgrade> upgrades, int year) {
        Map<Integer, BuildingUpgrade> byId = new HashMap<>();
        upgrades.forEach(u -> byId.put(u.buildingId(), u));

        List<Building> result = new ArrayList<>(buildings.size());
        for (Building building : buildings) {
            BuildingUpgrade upgrade = byId.get(building.getId());
            Building copy = Building.builder()
                    .id(building.getId())
                    .type(building.getType())
                    .state(building.getState())
                    .name(building.getName())
                    .yearOpened(building.getYearOpened())
                    .build();
            if (upgrade != null) {
                copy.setState(upgrade.newState());
                if (upgrade.newType() != null) copy.setType(upgrade.newType());
                if (upgrade.newName() != null) copy.setName(upgrade.newName());
                if (upgrade.newState() == Building.OPEN_STATE) copy.setYearOpened(year);
            }
            result.add(copy);
        }
        return result;
    }

    private int clampPercent(int value) {
        return Math.max(0, Math.min(100, value));
    }

    private BuildingType pickBuildingType(Tier tier, RandomSource random) {
        Map<BuildingType, Double> allowed = new LinkedHashMap<>();
        BUILDING_TYPE_WEIGHTS.forEach((type, weight) -> {
            if (tier.isAtLeast(type.getMinimumTier())) allowed.put(type, weight);
        });
        return sampler.weightedChoice(allowed, random);
    }

    private double round(double val) {
        return Math.round(val * 1000.0) / 1000.0;
    }

    private record TierGrowth(int populationBase, int populationPerWinPct, int populationPerPride,
                              int incomeBase, int incomePerOccupancy) {}
}
