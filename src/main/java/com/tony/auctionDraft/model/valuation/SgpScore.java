package com.tony.auctionDraft.model.valuation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Total SGP et détail par catégorie (conservé pour l'analyse de surplus en aval).
 */
public record SgpScore(double total, Map<String, Double> breakdown) {

    public SgpScore {
        breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }
}
