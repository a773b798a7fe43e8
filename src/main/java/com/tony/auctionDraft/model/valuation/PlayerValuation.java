package com.tony.auctionDraft.model.valuation;

import java.util.Map;

/**
 * Résultat de valorisation d'un joueur pour une époque donnée.
 */
public record PlayerValuation(Long playerId,
                              double sgp,
                              Map<String, Double> breakdown,
                              double dollarValue,
                              String valuedPosition) {

    public PlayerValuation {
        breakdown = Map.copyOf(breakdown);
    }
}
