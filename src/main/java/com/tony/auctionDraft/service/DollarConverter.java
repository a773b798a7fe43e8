package com.tony.auctionDraft.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversion SGP -> dollars d'un sous-pool (frappeurs OU lanceurs) contre son sous-budget.
 * Ne modifie jamais le SGP.
 */
@Service
@Slf4j
public class DollarConverter {

    /**
     * @param scored playerId -> SGP total
     * @return playerId -> valeur en $, jamais sous l'enchère minimum
     */
    public Map<Long, Double> toDollars(Map<Long, Double> scored, double subBudget, double minBid) {
        double totalPositiveSgp = scored.values().stream()
                .mapToDouble(sgp -> Math.max(0.0, sgp))
                .sum();

        Map<Long, Double> dollars = new LinkedHashMap<>();

        // Pool dégénéré : personne au-dessus du remplacement -> tout le monde à l'enchère minimum
        if (totalPositiveSgp <= 0) {
            if (!scored.isEmpty()) {
                log.warn("⚠️ Aucun SGP positif sur {} joueurs : tous valorisés à ${}", scored.size(), minBid);
            }
            scored.keySet().forEach(id -> dollars.put(id, minBid));
            return dollars;
        }

        double dollarsPerSgp = subBudget / totalPositiveSgp;

        // SGP négatif = plancher à l'enchère minimum (le joueur reste draftable)
        scored.forEach((id, sgp) -> dollars.put(id, Math.max(minBid, sgp * dollarsPerSgp)));
        return dollars;
    }
}
