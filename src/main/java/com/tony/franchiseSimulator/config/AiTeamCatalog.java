package com.tony.franchiseSimulator.config;

import com.tony.franchiseSimulator.model.AiTeam;
import com.tony.franchiseSimulator.model.DraftStrategy;
import com.tony.franchiseSimulator.model.Position;
import com.tony.franchiseSimulator.model.PositionNeed;

import java.util.List;
import java.util.Optional;

/**
 * Les franchises IA de la ligue. Liste immuable, l'ordre sert d'ordre de draft de base.
 */
public class AiTeamCatalog {

    private final List<AiTeam> teams;

    public AiTeamCatalog(List<AiTeam> teams) {
        this.teams = List.copyOf(teams);
    }

    public List<AiTeam> getTeams() {
        return teams;
    }

    public Optional<AiTeam> findById(String id) {
        return teams.stream().filter(t -> t.id().equals(id)).findFirst();
    }

    public static AiTeamCatalog defaults() {
        return new AiTeamCatalog(List.of(
                team("steel-city-hammers", "Hammers", "Steel City", DraftStrategy.BEST_AVAILABLE, 70, List.of(), 52, 1.0),
                team("river-city-rapids", "Rapids", "River City", DraftStrategy.UPSIDE_SWING, 80, List.of(), 48, 1.3),
                team("canyon-town-coyotes", "Coyotes", "Canyon Town", DraftStrategy.UPSIDE_SWING, 85, List.of(), 45, 1.4),
                team("port-city-sailors", "Sailors", "Port City", DraftStrategy.SAFE_FLOOR, 30, List.of(), 50, 0.8),
                team("forest-city-foresters", "Foresters", "Forest City", DraftStrategy.SAFE_FLOOR, 25, List.of(), 51, 0.7),
                team("valley-town-vultures", "Vultures", "Valley Town", DraftStrategy.SAFE_FLOOR, 20, List.of(), 49, 0.75),
                team("coaltown-miners", "Miners", "Coaltown", DraftStrategy.NEED_BASED, 50,
                        List.of(need(Position.SP, 90), need(Position.RP, 70)), 47, 1.0),
                team("mountain-town-mountaineers", "Mountaineers", "Mountain Town", DraftStrategy.NEED_BASED, 50,
                        List.of(need(Position.C, 85), need(Position.FIRST_BASE, 60)), 48, 1.0),
                team("desert-springs-scorpions", "Scorpions", "Desert Springs", DraftStrategy.NEED_BASED, 55,
                        List.of(need(Position.CF, 80), need(Position.LF, 65), need(Position.RF, 65)), 46, 1.0),
                team("lakeside-lakers", "Lakers", "Lakeside", DraftStrategy.UPSIDE_SWING, 60, List.of(), 50, 1.2),
                team("bay-city-buccaneers", "Buccaneers", "Bay City", DraftStrategy.BEST_AVAILABLE, 45, List.of(), 53, 0.9),
                team("prairie-plains-pioneers", "Pioneers", "Prairie Plains", DraftStrategy.BEST_AVAILABLE, 55, List.of(), 49, 1.0),
                team("summit-heights-hawks", "Hawks", "Summit Heights", DraftStrategy.UPSIDE_SWING, 65, List.of(), 47, 1.1),
                team("riverside-royals", "Royals", "Riverside", DraftStrategy.SAFE_FLOOR, 35, List.of(), 52, 0.85),
                team("crossroads-cardinals", "Cardinals", "Crossroads", DraftStrategy.NEED_BASED, 50,
                        List.of(need(Position.SS, 75), need(Position.SECOND_BASE, 70)), 50, 1.0),
                team("ironworks-ironmen", "Ironmen", "Ironworks", DraftStrategy.BEST_AVAILABLE, 60, List.of(), 51, 1.0),
                team("harbor-town-hurricanes", "Hurricanes", "Harbor Town", DraftStrategy.UPSIDE_SWING, 75, List.of(), 46, 1.25),
                team("metro-city-meteors", "Meteors", "Metro City", DraftStrategy.SAFE_FLOOR, 40, List.of(), 54, 0.8),
                team("central-valley-condors", "Condors", "Central Valley", DraftStrategy.NEED_BASED, 45,
                        List.of(need(Position.THIRD_BASE, 80), need(Position.DH, 50)), 48, 1.0)
        ));
    }

    private static AiTeam team(String id, String name, String city, DraftStrategy philosophy, int risk,
                               List<PositionNeed> needs, int baseStrength, double variance) {
        return new AiTeam(id, name, city, philosophy, risk, needs, baseStrength, variance);
    }

    private static PositionNeed need(Position position, int priority) {
        return new PositionNeed(position, priority);
    }
}
