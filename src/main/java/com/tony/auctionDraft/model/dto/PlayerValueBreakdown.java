package com.tony.auctionDraft.model.dto;

import com.tony.auctionDraft.model.PlayerType;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Détail de la valeur d'un joueur : SGP total, $ et contribution par catégorie.
 */
@Data
@Builder
public class PlayerValueBreakdown {
    private Long playerId;
    private String name;
    private PlayerType type;
    private String positions;
    private Double totalSgp;
    private Double dollarValue;
    private String valuedPosition;
    private Long valuationEpoch;
    private boolean drafted;
    private Map<String, Double> categorySgp;   // "hr" -> 2.1
    private Map<String, Double> projectedStats; // "hr" -> 32.0
}
