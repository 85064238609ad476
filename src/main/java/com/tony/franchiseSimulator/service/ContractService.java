package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.config.AiTeamCatalog;
import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.config.TierCatalog;
import com.tony.franchiseSimulator.model.*;
import com.tony.franchiseSimulator.model.result.ContractOffer;
import com.tony.franchiseSimulator.model.result.FreeAgentResult;
import com.tony.franchiseSimulator.model.result.PayrollSummary;
import com.tony.franchiseSimulator.model.result.PlayerSalary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Salaires et durées de contrat, bornés par les limites salariales du niveau, puis cycle de vie
 * des contrats : renouvellements, départs en agence libre et masse salariale.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractService {

    // Paliers de durée selon la note actuelle
    private static final int ELITE_RATING = 70;
    private static final int GOOD_RATING = 55;
    private static final int AVERAGE_RATING = 40;

    // Âge de référence pour estimer la valeur de marché d'un joueur
    private static final int MARKET_REFERENCE_AGE = 25;

    private final TierCatalog tierCatalog;
    private final RatingSampler sampler;
    private final SimulationProperties properties;
    private final AiTeamCatalog aiTeamCatalog;
    private final RandomSource randomSource;

    /**
     * Salaire de marché : note effective (70% actuelle, 30% potentiel) ramenée sur [0,1],
     * puis courbe en puissance 1.8 pour que les stars coûtent nettement plus cher.
     */
    public long calculateSalary(int currentRating, int potential, Tier tier, int age) {
        TierConfig config = tierCatalog.get(tier);
        double effectiveRating = currentRating * 0.7 + potential * 0.3;
        double normalized = Math.max(0.0, Math.min(1.0, (effectiveRating - 20.0) / 60.0));
        double multiplier = Math.pow(normalized, 1.8);

        double salary = config.minSalary() + (config.maxSalary() - config.minSalary()) * multiplier * ageModifier(age);
        salary = Math.max(config.minSalary(), Math.min(config.maxSalary(), salary));
        return roundToThousand(salary);
    }

    private double ageModifier(int age) {
        if (age >= 26 && age <= 30) return 1.15;
        if (age > 32) return Math.max(0.6, 0.85 - (age - 32) * 0.05);
        if (age < 23) return 0.9;
        return 1.0;
    }

    public int calculateContractYears(int currentRating, int age) {
        return calculateContractYears(currentRating, age, randomSource);
    }

    public int calculateContractYears(int currentRating, int age, RandomSource random) {
        int years;
        if (currentRating >= ELITE_RATING) {
            years = sampler.uniformInt(4, 6, random);
        } else if (currentRating >= GOOD_RATING) {
            years = sampler.uniformInt(2, 4, random);
        } else if (currentRating >= AVERAGE_RATING) {
            years = sampler.uniformInt(1, 2, random);
        } else {
            years = 1;
        }

        if (age > 35) return 1;
        if (age > 32) years = Math.max(1, years - 1);
        return years;
    }

    public ContractOffer generateContractOffer(Player player, Tier tier) {
        return generateContractOffer(player, tier, randomSource);
    }

    public ContractOffer generateContractOffer(Player player, Tier tier, RandomSource random) {
        return generateContractOffer(player, tier, false, random);
    }

    /**
     * Offre au prix du marché. Un renouvellement de plus de 2 ans est ramené à 2 ans une fois sur deux.
     */
    public ContractOffer generateContractOffer(Player player, Tier tier, boolean renewal, RandomSource random) {
        long salary = calculateSalary(player.getCurrentRating(), player.getPotential(), tier, player.getAge());
        int years = calculateContractYears(player.getCurrentRating(), player.getAge(), random);
        if (renewal && years > 2 && random.next() > 0.5) {
            years = 2;
        }
        return new ContractOffer(salary, years, salary * years, false, renewal);
    }

    /**
     * Contrat recrue : 10 à 40% de la fourchette salariale selon le potentiel, 2 à 4 ans.
     */
    public ContractOffer generateRookieContract(int potential, Tier tier) {
        TierConfig config = tierCatalog.get(tier);
        double share = 0.1 + (potential / 80.0) * 0.3;
        long salary = Math.max(config.minSalary(),
                roundToThousand(config.minSalary() + (config.maxSalary() - config.minSalary()) * share));

        int years;
        if (potential >= 70) {
            years = 4;
        } else if (potential >= 55) {
            years = 3;
        } else {
            years = 2;
        }
        return new ContractOffer(salary, years, salary * years, true, false);
    }

    // -----------------------------------------------------------
    // AGENCE LIBRE
    // -----------------------------------------------------------

    /**
     * Probabilité de re-signer : base selon le moral, bonus de victoire (+15% au plus),
     * ±30% selon l'offre rapportée au marché. Bornée à [5%, 95%].
     */
    public double calculateResignProbability(int morale, double teamWinPct, double offerVsMarket) {
        double base;
        if (morale >= 80) {
            base = 0.9;
        } else if (morale >= 60) {
            base = 0.7;
        } else if (morale >= 40) {
            base = 0.5;
        } else if (morale >= 20) {
            base = 0.3;
        } else {
            base = 0.1;
        }
        double winBonus = Math.min(0.15, (teamWinPct - 0.5) * 0.5);
        double salaryAdjustment = (offerVsMarket - 1.0) * 0.3;
        return Math.max(0.05, Math.min(0.95, base + winBonus + salaryAdjustment));
    }

    public boolean playerAcceptsOffer(Player player, ContractOffer offer, double teamWinPct) {
        return playerAcceptsOffer(player, offer, teamWinPct, randomSource);
    }

    /**
     * La valeur de marché est celle d'un joueur de 25 ans dont le potentiel égale la note actuelle,
     * au niveau du joueur.
     */
    public boolean playerAcceptsOffer(Player player, ContractOffer offer, double teamWinPct, RandomSource random) {
        Tier tier = player.getTier() != null ? player.getTier() : Tier.LOW_A;
        long marketRate = calculateSalary(player.getCurrentRating(), player.getCurrentRating(), tier, MARKET_REFERENCE_AGE);
        double offerRatio = (double) offer.salary() / Math.max(1, marketRate);
        return sampler.chance(calculateResignProbability(player.getMorale(), teamWinPct, offerRatio), random);
    }

    /** Joueurs dont le contrat s'achève à la fin de cette saison (1 an restant ou moins). */
    public List<Player> findExpiringContracts(List<Player> players) {
        return players.stream()
                .filter(Player::isOnRoster)
                .filter(p -> p.getContractYears() <= 1)
                .toList();
    }

    public FreeAgentResult processContractExpiration(Player player, double teamWinPct, boolean offerContract) {
        return processContractExpiration(player, teamWinPct, offerContract, randomSource);
    }

    /**
     * Sans offre, le joueur part. Sinon il reçoit une offre de renouvellement qu'il accepte ou refuse ;
     * en cas de départ, il rejoint une équipe IA tirée au hasard.
     */
    public FreeAgentResult processContractExpiration(Player player, double teamWinPct, boolean offerContract,
                                                     RandomSource random) {
        if (offerContract) {
            Tier tier = player.getTier() != null ? player.getTier() : Tier.LOW_A;
            ContractOffer offer = generateContractOffer(player, tier, true, random);
            if (playerAcceptsOffer(player, offer, teamWinPct, random)) {
                log.info("✍️ {} re-signe : {} $ sur {} an(s)", player.getFullName(), offer.salary(), offer.years());
                return new FreeAgentResult(player.getId(), player.getFullName(), FreeAgentOutcome.RESIGNED, offer, null);
            }
        }
        String destination = randomDestination(random);
        log.info("👋 {} quitte la franchise pour {}", player.getFullName(), destination);
        return new FreeAgentResult(player.getId(), player.getFullName(), FreeAgentOutcome.DEPARTED, null, destination);
    }

    public List<FreeAgentResult> processContractExpirations(List<Player> players, double teamWinPct,
                                                            Set<String> releasedPlayerIds) {
        return processContractExpirations(players, teamWinPct, releasedPlayerIds, randomSource);
    }

    public List<FreeAgentResult> processContractExpirations(List<Player> players, double teamWinPct,
                                                            Set<String> releasedPlayerIds, RandomSource random) {
        List<FreeAgentResult> results = new ArrayList<>();
        for (Player player : findExpiringContracts(players)) {
            boolean offer = releasedPlayerIds == null || !releasedPlayerIds.contains(player.getId());
            results.add(processContractExpiration(player, teamWinPct, offer, random));
        }
        return results;
    }

    private String randomDestination(RandomSource random) {
        List<AiTeam> teams = aiTeamCatalog.getTeams();
        AiTeam team = teams.get(sampler.uniformInt(0, teams.size() - 1, random));
        return team.city() + " " + team.name();
    }

    // -----------------------------------------------------------
    // MASSE SALARIALE
    // -----------------------------------------------------------

    /** Plafond salarial du niveau : une part de son budget annuel. */
    public long salaryCap(Tier tier) {
        return Math.round(tierCatalog.get(tier).budget() * properties.getContracts().getSalaryCapShare());
    }

    /**
     * Seul le roster actif compte pour le plafond. La taxe de luxe commence 20% au-dessus.
     */
    public PayrollSummary calculatePayroll(List<Player> players, Tier tier) {
        long cap = salaryCap(tier);
        long luxuryThreshold = Math.round(cap * properties.getContracts().getLuxuryTaxFactor());

        List<PlayerSalary> salaries = new ArrayList<>(players.stream()
                .filter(p -> p.isOnRoster() && p.getRosterStatus() == RosterStatus.ACTIVE)
                .map(p -> new PlayerSalary(p.getId(), p.getFullName(), p.getSalary()))
                .toList());
        salaries.sort(Comparator.comparingLong(PlayerSalary::salary).reversed());

        long total = salaries.stream().mapToLong(PlayerSalary::salary).sum();
        return new PayrollSummary(total, cap, cap - total, total > cap, luxuryThreshold, total > luxuryThreshold, salaries);
    }

    /** Le salaire tient-il sous le plafond ? Avec {@code allowOverCap}, jusqu'au seuil de la taxe de luxe. */
    public boolean canAffordSalary(long currentPayroll, long newSalary, long salaryCap, boolean allowOverCap) {
        double limit = allowOverCap ? salaryCap * properties.getContracts().getLuxuryTaxFactor() : salaryCap;
        return currentPayroll + newSalary <= limit;
    }

    private long roundToThousand(double amount) {
        return Math.round(amount / 1000.0) * 1000L;
    }
}
