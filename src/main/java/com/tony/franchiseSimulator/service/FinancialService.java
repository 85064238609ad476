package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.config.TierCatalog;
import com.tony.franchiseSimulator.model.*;
import com.tony.franchiseSimulator.model.result.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Moteur financier d'une saison : recettes, dépenses, trésorerie et risque de faillite.
 * Chaque poste est arrondi à l'entier une seule fois ; les totaux sont des sommes exactes de ces postes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FinancialService {

    private final SimulationProperties properties;
    private final TierCatalog tierCatalog;

    public FinancialSimulationResult simulateFinances(List<Player> players, Franchise franchise, CityState cityState,
                                                      long attendance, boolean wonChampionship, long marketingSpend) {
        SimulationProperties.Finance cfg = properties.getFinance();
        TierConfig tierConfig = tierCatalog.get(franchise.getTier());

        // 1. RECETTES
        long tickets = Math.round(attendance * franchise.getTicketPrice());
        long concessions = Math.round(attendance * cfg.getConcessionPerFan() * (1 + franchise.getStadiumQuality() / 200.0));
        long parking = Math.round((long) Math.floor(attendance * cfg.getParkingShare()) * cfg.getParkingPrice());
        long merchandise = Math.round(attendance * cfg.getMerchandisePerFan() * (cityState.getTeamPride() / 100.0));
        long sponsorships = calculateSponsorshipRevenue(franchise.getTier(), cityState.getTeamPride(),
                cityState.getNationalRecognition(), wonChampionship);
        long totalRevenue = tickets + concessions + parking + merchandise + sponsorships;

        // 2. DÉPENSES
        long playerSalaries = calculatePlayerSalaries(players);
        long coaching = franchise.getCoachingSalaries();
        long maintenance = Math.round(tierConfig.stadiumValue() * cfg.getMaintenanceRate());
        long travel = tierConfig.travelCost();
        long debtService = calculateDebtService(franchise.getReserves());
        long totalExpenses = playerSalaries + coaching + maintenance + travel + marketingSpend + debtService;

        // 3. BILAN
        long netIncome = totalRevenue - totalExpenses;
        long newReserves = franchise.getReserves() + netIncome;
        long debtLevel = newReserves < 0 ? Math.abs(newReserves) : 0;
        BankruptcyRisk risk = assessRisk(debtRatio(debtLevel, franchise.getBudget()));

        log.info("💰 Saison {} : recettes {} $, dépenses {} $, net {} $, réserves {} $ (risque {})",
                franchise.getTier(), totalRevenue, totalExpenses, netIncome, newReserves, risk);
        if (risk != BankruptcyRisk.NONE) {
            log.warn("⚠️ Dette de {} $ pour un budget de {} $", debtLevel, franchise.getBudget());
        }

        return new FinancialSimulationResult(
                new RevenueBreakdown(tickets, concessions, parking, merchandise, sponsorships, totalRevenue),
                new ExpenseBreakdown(playerSalaries, coaching, maintenance, travel, marketingSpend, debtService, totalExpenses),
                netIncome,
                newReserves,
                debtLevel,
                risk);
    }

    /**
     * Trois paliers cumulables : local toujours, régional dès High-A, national dès Triple-A.
     */
    public long calculateSponsorshipRevenue(Tier tier, int teamPride, int nationalRecognition, boolean wonChampionship) {
        SimulationProperties.Finance cfg = properties.getFinance();
        double pride = teamPride / 100.0;
        double recognition = nationalRecognition / 100.0;

        double total = sponsorship(cfg.getLocalSponsorMin(), cfg.getLocalSponsorMax(), 0.3 + pride * 0.7);
        if (tier.isAtLeast(Tier.HIGH_A)) {
            total += sponsorship(cfg.getRegionalSponsorMin(), cfg.getRegionalSponsorMax(),
                    0.2 + pride * 0.4 + recognition * 0.4);
        }
        if (tier.isAtLeast(Tier.TRIPLE_A)) {
            total += sponsorship(cfg.getNationalSponsorMin(), cfg.getNationalSponsorMax(),
                    0.1 + recognition * 0.6 + (wonChampionship ? 0.3 : 0.0));
        }
        return Math.round(total);
    }

    private double sponsorship(long min, long max, double multiplier) {
        return min + (max - min) * multiplier;
    }

    /** Masse salariale des joueurs sous contrat (roster actif et réserve). */
    public long calculatePlayerSalaries(List<Player> players) {
        return players.stream()
                .filter(Player::isOnRoster)
                .mapToLong(Player::getSalary)
                .sum();
    }

    /** Intérêts sur la dette, uniquement si les réserves sont négatives. */
    public long calculateDebtService(long reserves) {
        if (reserves >= 0) return 0;
        return Math.round(Math.abs(reserves) * properties.getFinance().getDebtInterestRate());
    }

    /**
     * Ratio dette / budget annuel. C'est le même dénominateur que pour la fin de partie.
     */
    public double debtRatio(long debt, long annualBudget) {
        if (debt <= 0) return 0.0;
        if (annualBudget <= 0) return Double.POSITIVE_INFINITY;
        return (double) debt / annualBudget;
    }

    public BankruptcyRisk assessRisk(double debtRatio) {
        SimulationProperties.Finance cfg = properties.getFinance();
        if (debtRatio >= cfg.getImminentDebtRatio()) return BankruptcyRisk.IMMINENT;
        if (debtRatio >= cfg.getCriticalDebtRatio()) return BankruptcyRisk.CRITICAL;
        if (debtRatio >= cfg.getWarningDebtRatio()) return BankruptcyRisk.WARNING;
        return BankruptcyRisk.NONE;
    }

    /**
     * Diagnostic lisible de la situation financière, avec pistes de redressement.
     */
    public BankruptcyStatus checkBankruptcyStatus(long reserves, long annualBudget) {
        long debt = reserves < 0 ? Math.abs(reserves) : 0;
        double ratio = debtRatio(debt, annualBudget);

        // Ligne stricte, identique à la fin de partie
        if (ratio > properties.getFinance().getBankruptcyDebtRatio()) {
            return new BankruptcyStatus(true, ratio, BankruptcyRisk.BANKRUPT,
                    "FAILLITE : la franchise est saisie par ses créanciers.", List.of());
        }

        return switch (assessRisk(ratio)) {
            case IMMINENT, BANKRUPT -> new BankruptcyStatus(false, ratio, BankruptcyRisk.IMMINENT,
                    "CRITIQUE : la ville menace de saisir l'équipe. Une saison déficitaire de plus et c'est la faillite.",
                    List.of("Céder des vétérans contre de l'argent",
                            "Baisser le prix des billets pour relancer l'affluence",
                            "Réduire le staff au minimum"));
            case CRITICAL -> new BankruptcyStatus(false, ratio, BankruptcyRisk.CRITICAL,
                    "La banque exige un plan de remboursement.",
                    List.of("Échanger des joueurs cotés contre de l'argent",
                            "Réduire toutes les dépenses",
                            "Miser sur de jeunes joueurs peu coûteux"));
            case WARNING -> new BankruptcyStatus(false, ratio, BankruptcyRisk.WARNING,
                    "Le conseil municipal s'inquiète des finances de l'équipe.",
                    List.of("Revoir la répartition des dépenses",
                            "Envisager un staff moins coûteux"));
            case NONE -> new BankruptcyStatus(false, ratio, BankruptcyRisk.NONE, "Finances saines.", List.of());
        };
    }

    public List<BudgetRecommendation> generateBudgetRecommendations(Franchise franchise, List<Player> players,
                                                                    CityState cityState) {
        List<BudgetRecommendation> recommendations = new ArrayList<>();
        TierConfig tierConfig = tierCatalog.get(franchise.getTier());
        double budget = franchise.getBudget();
        if (budget <= 0) return recommendations;

        // Staff technique : entre 3% et 10% du budget
        long coaching = franchise.getCoachingSalaries();
        double coachingShare = coaching / budget;
        if (coachingShare < 0.03) {
            recommendations.add(new BudgetRecommendation("Staff technique", coaching, Math.round(budget * 0.05),
                    "Budget staff trop faible : de meilleurs entraîneurs accélèrent le développement."));
        } else if (coachingShare > 0.10) {
            recommendations.add(new BudgetRecommendation("Staff technique", coaching, Math.round(budget * 0.07),
                    "Budget staff élevé : envisager de le réallouer aux salaires des joueurs."));
        }

        // Billetterie
        double midPrice = (tierConfig.ticketPriceMin() + tierConfig.ticketPriceMax()) / 2.0;
        if (franchise.getTicketPrice() < tierConfig.ticketPriceMin()) {
            recommendations.add(new BudgetRecommendation("Billetterie", franchise.getTicketPrice(), midPrice,
                    "Prix des billets sous le marché : envisager une hausse."));
        } else if (cityState.getUnemploymentRate() > 10 && franchise.getTicketPrice() > midPrice) {
            recommendations.add(new BudgetRecommendation("Billetterie", franchise.getTicketPrice(),
                    tierConfig.ticketPriceMin() + (midPrice - tierConfig.ticketPriceMin()) * 0.5,
                    "Chômage élevé : l'affluence risque de baisser, envisager des prix plus bas."));
        }

        // Masse salariale
        long salaries = calculatePlayerSalaries(players);
        if (salaries / budget > 0.7) {
            recommendations.add(new BudgetRecommendation("Salaires joueurs", salaries, Math.round(budget * 0.6),
                    "La masse salariale absorbe trop de budget : envisager d'échanger des vétérans coûteux."));
        }

        return recommendations;
    }
}
