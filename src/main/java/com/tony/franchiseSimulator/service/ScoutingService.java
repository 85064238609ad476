package com.tony.franchiseSimulator.service;

import com.tony.franchiseSimulator.config.SimulationProperties;
import com.tony.franchiseSimulator.model.DraftProspect;
import com.tony.franchiseSimulator.model.HiddenTraits;
import com.tony.franchiseSimulator.model.RevealedTraits;
import com.tony.franchiseSimulator.model.ScoutingAccuracy;
import com.tony.franchiseSimulator.model.result.ScoutingOutcome;
import com.tony.franchiseSimulator.model.result.ScoutingReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class ScoutingService {

    private final RatingSampler sampler;
    private final SimulationProperties properties;
    private final RandomSource randomSource;

    public long scoutingCost(ScoutingAccuracy accuracy) {
        return properties.getScouting().forAccuracy(accuracy).getCost();
    }

    public ScoutingReport scoutProspect(DraftProspect prospect, ScoutingAccuracy accuracy) {
        return scoutProspect(prospect, accuracy, randomSource);
    }

    /**
     * Observation d'un prospect : note et potentiel estimés à ±marge du niveau choisi,
     * et éventuellement une partie des traits cachés.
     */
    public ScoutingReport scoutProspect(DraftProspect prospect, ScoutingAccuracy accuracy, RandomSource random) {
        SimulationProperties.ScoutingTier tier = properties.getScouting().forAccuracy(accuracy);
        int error = tier.getErrorBound();

        int scoutedRating = RatingSampler.clampRating(
                prospect.getCurrentRating() + sampler.uniformInt(-error, error, random));
        int scoutedPotential = RatingSampler.clampRating(
                prospect.getPotential() + sampler.uniformInt(-error, error, random));

        boolean traitsRevealed = sampler.chance(tier.getTraitRevealChance(), random);
        RevealedTraits revealed = traitsRevealed
                ? revealTraits(prospect.getHiddenTraits(), random)
                : RevealedTraits.none();

        return new ScoutingReport(
                prospect.getId(),
                accuracy,
                scoutedRating,
                scoutedPotential,
                revealed,
                traitsRevealed,
                tier.getCost(),
                Math.abs(scoutedRating - prospect.getCurrentRating()),
                Math.abs(scoutedPotential - prospect.getPotential()));
    }

    // Éthique de travail et personnalité toujours révélées, le reste au cas par cas
    private RevealedTraits revealTraits(HiddenTraits traits, RandomSource random) {
        SimulationProperties.Scouting cfg = properties.getScouting();
        Boolean injuryProne = sampler.chance(cfg.getInjuryRevealChance(), random) ? traits.injuryProne() : null;
        Integer coachability = sampler.chance(cfg.getCoachabilityRevealChance(), random) ? traits.coachability() : null;
        Integer clutch = sampler.chance(cfg.getClutchRevealChance(), random) ? traits.clutch() : null;
        return new RevealedTraits(traits.workEthic(), traits.personality(), injuryProne, coachability, clutch);
    }

    public ScoutingOutcome requestScouting(DraftProspect prospect, String accuracyCode, long availableFunds) {
        return requestScouting(prospect, accuracyCode, availableFunds, randomSource);
    }

    /**
     * Valide la demande (niveau connu, fonds suffisants, prospect encore disponible) avant d'observer.
     * Les refus sont renvoyés comme résultats, jamais levés.
     */
    public ScoutingOutcome requestScouting(DraftProspect prospect, String accuracyCode, long availableFunds,
                                           RandomSource random) {
        if (prospect == null) {
            return ScoutingOutcome.failure("Prospect introuvable");
        }
        Optional<ScoutingAccuracy> accuracy = ScoutingAccuracy.fromCode(accuracyCode);
        if (accuracy.isEmpty()) {
            log.warn("⚠️ Niveau de scouting inconnu : {}", accuracyCode);
            return ScoutingOutcome.failure("Niveau de scouting inconnu : " + accuracyCode);
        }
        if (prospect.isDrafted()) {
            return ScoutingOutcome.failure("Ce prospect a déjà été drafté");
        }
        long cost = scoutingCost(accuracy.get());
        if (cost > availableFunds) {
            log.warn("⚠️ Fonds insuffisants pour le scouting {} : {} requis, {} disponibles",
                    accuracy.get(), cost, availableFunds);
            return ScoutingOutcome.failure("Fonds insuffisants : " + cost + " $ requis, " + availableFunds + " $ disponibles");
        }

        ScoutingReport report = scoutProspect(prospect, accuracy.get(), random);
        log.info("🔍 Scouting {} de {} : {}/{}", accuracy.get(), prospect.getId(),
                report.scoutedRating(), report.scoutedPotential());
        return ScoutingOutcome.success(report);
    }

    /**
     * Copie du prospect enrichie du rapport. Les traits déjà connus restent acquis.
     */
    public DraftProspect applyReport(DraftProspect prospect, ScoutingReport report) {
        RevealedTraits known = prospect.getRevealedTraits() != null ? prospect.getRevealedTraits() : RevealedTraits.none();
        RevealedTraits fresh = report.revealedTraits();
        RevealedTraits merged = new RevealedTraits(
                fresh.workEthic() != null ? fresh.workEthic() : known.workEthic(),
                fresh.personality() != null ? fresh.personality() : known.personality(),
                fresh.injuryProne() != null ? fresh.injuryProne() : known.injuryProne(),
                fresh.coachability() != null ? fresh.coachability() : known.coachability(),
                fresh.clutch() != null ? fresh.clutch() : known.clutch());

        return prospect.toBuilder()
                .scoutedRating(report.scoutedRating())
                .scoutedPotential(report.scoutedPotential())
                .scoutingAccuracy(report.accuracy())
                .revealedTraits(merged)
                .build();
    }
}
