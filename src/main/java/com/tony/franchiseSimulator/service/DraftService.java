package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.model.*;
import com.tony.franchiseSimulator.model.result.ContractOffer;
import com.tony.franchiseSimulator.model.result.DraftSelection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;

/**
 * Transforme un prospect choisi en joueur de l'organisation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DraftService {

    public static final String PLAYER_TEAM_ID = "player";

    private final ContractService contractService;
    private final TrainingService trainingService;

    public DraftSelection draftProspect(DraftProspect prospect, Tier tier, int year, int round, int pickNumber) {
        if (prospect == null) {
            return DraftSelection.failure("Prospect introuvable");
        }
        if (prospect.isDrafted()) {
            return DraftSelection.failure("Ce prospect a déjà été drafté");
        }

        DraftProspect drafted = prospect.toBuilder()
                .drafted(true)
                .draftedByTeam(PLAYER_TEAM_ID)
                .build();

        ContractOffer contract = contractService.generateRookieContract(prospect.getPotential(), tier);
        EnumMap<Tool, Integer> attributes = new EnumMap<>(Tool.class);
        attributes.putAll(prospect.getAttributes());

        Player player = Player.builder()
                .id(prospect.getId())
                .firstName(prospect.getFirstName())
                .lastName(prospect.getLastName())
                .age(prospect.getAge())
                .position(prospect.getPosition())
                .playerType(prospect.getPlayerType())
                .tier(tier)
                .currentRating(prospect.getCurrentRating())
                .potential(prospect.getPotential())
                .attributes(attributes)
                .hiddenTraits(prospect.getHiddenTraits())
                .rosterStatus(RosterStatus.RESERVE)
                .salary(contract.salary())
                .contractYears(contract.years())
                .draftYear(year)
                .draftRound(round)
                .draftPick(pickNumber)
                .progressionRate(trainingService.calculateProgressionRate(
                        prospect.getAge(), prospect.getPotential(), prospect.getCurrentRating()))
                .build();
        player.setTrainingFocus(trainingService.recommendTrainingFocus(player));

        log.info("✍️ {} drafté au choix n°{} (round {}) : {} $ sur {} ans",
                player.getFullName(), pickNumber, round, contract.salary(), contract.years());
        return new DraftSelection(true, null, drafted, player, contract);
    }
}
