package com.tony.auctionDraft.model.valuation;

import java.util.Map;

/**
 * Écart-type de chaque catégorie sur le pool de valorisation.
 * Une dispersion nulle (pool dégénéré) annule la contribution de la catégorie.
 */
public record CategoryDispersion(Map<String, Double> values) {

    public CategoryDispersion {
        values = Map.copyOf(values);
    }

    public double get(String category) {
        return values.getOrDefault(category, 0.0);
    }

    public boolean isDegenerate(String category) {
        double d = get(category);
        return !(d > 0.0) || Double.isNaN(d);
    }
}
