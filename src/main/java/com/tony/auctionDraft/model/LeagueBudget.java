package com.tony.auctionDraft.model;

import com.tony.auctionDraft.config.LeagueSettings;

/**
 * Budget de ligue découpé en sous-budget frappeurs / lanceurs.
 */
public record LeagueBudget(double hitterBudget, double pitcherBudget) {

    public static LeagueBudget of(LeagueSettings settings) {
        double total = settings.totalLeagueBudget();
        return new LeagueBudget(
                total * settings.getHitterBudgetFraction(),
                total * settings.getPitcherBudgetFraction());
    }

    public double forType(PlayerType type) {
        return type == PlayerType.HITTER ? hitterBudget : pitcherBudget;
    }

    /** Budget restant une fois les montants déjà dépensés retirés (jamais négatif). */
    public LeagueBudget minusSpent(double hitterSpent, double pitcherSpent) {
        return new LeagueBudget(
                Math.max(0.0, hitterBudget - hitterSpent),
                Math.max(0.0, pitcherBudget - pitcherSpent));
    }
}
