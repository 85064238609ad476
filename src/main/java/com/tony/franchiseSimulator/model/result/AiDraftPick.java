package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.DraftProspect;

/** Sélection effectuée par une équipe IA, prospect déjà marqué comme drafté. */
public record AiDraftPick(String teamId, String teamName, DraftProspect prospect, int pickNumber, int round, String reason) {}
