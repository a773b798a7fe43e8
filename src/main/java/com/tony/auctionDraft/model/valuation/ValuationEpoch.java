package com.tony.auctionDraft.model.valuation;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * Instantané complet et cohérent produit par une passe de recalcul.
 * Écrit en base en un seul lot : un lecteur ne voit jamais un pool à moitié mis à jour.
 */
@Getter
@Builder
public class ValuationEpoch {
    private final long epoch;
    private final LocalDateTime computedAt;
    @Singular
    private final Map<Long, PlayerValuation> valuations;
    private final ReplacementBaselines baselines;

    public Optional<PlayerValuation> valuationOf(Long playerId) {
        return Optional.ofNullable(valuations.get(playerId));
    }

    public int size() {
        return valuations.size();
    }
}
