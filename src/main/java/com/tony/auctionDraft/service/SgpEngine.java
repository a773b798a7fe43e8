package com.tony.auctionDraft.service;

import com.tony.auctionDraft.config.CategoryDefinition;
import com.tony.auctionDraft.model.StatLine;
import com.tony.auctionDraft.model.valuation.CategoryDispersion;
import com.tony.auctionDraft.model.valuation.SgpScore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Standings Gain Points : écart à la ligne de remplacement, normalisé par la dispersion de chaque catégorie.
 */
@Service
@Slf4j
public class SgpEngine {

    /**
     * Écart-type (échantillon) de chaque catégorie sur le pool.
     * Les joueurs sans temps de jeu (0 AB / 0 IP) ne participent pas.
     * Moins de 2 valeurs ou écart-type nul => dispersion 0 (catégorie neutralisée au scoring).
     */
    public CategoryDispersion dispersion(Collection<StatLine> pool, List<CategoryDefinition> categories) {
        Map<String, Double> result = new HashMap<>();

        for (CategoryDefinition category : categories) {
            double[] values = pool.stream()
                    .filter(line -> line.playingTime() > 0)
                    .filter(line -> contributes(line, category))
                    .mapToDouble(line -> dispersedValue(line, category))
                    .toArray();

            double sd = values.length >= 2 ? new StandardDeviation().evaluate(values) : 0.0;
            if (!(sd > 0.0)) {
                log.warn("⚠️ Dispersion nulle pour {} ({} valeurs) : catégorie neutralisée", key(category), values.length);
                sd = 0.0;
            }
            result.put(key(category), sd);
        }
        return new CategoryDispersion(result);
    }

    /**
     * SGP d'une ligne par rapport à une ligne de remplacement.
     * - Comptage : (joueur - remplacement) / d
     * - Taux (AVG) : (hits - AVG_remplacement x AB_joueur) / d, donc un bon taux sur peu de volume pèse moins
     * - Ratio (ERA, WHIP) : signe inversé, (attendu - réel) / d avec attendu = ratio_remplacement x IP_joueur
     */
    public SgpScore score(StatLine player, StatLine baseline, CategoryDispersion dispersion, List<CategoryDefinition> categories) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        double total = 0.0;

        for (CategoryDefinition category : categories) {
            String key = key(category);
            double sgp = dispersion.isDegenerate(key)
                    ? 0.0
                    : rawGain(player, baseline, category) / dispersion.get(key);

            breakdown.put(key, sgp);
            total += sgp;
        }
        return new SgpScore(total, breakdown);
    }

    private double rawGain(StatLine player, StatLine baseline, CategoryDefinition category) {
        return switch (category.getKind()) {
            case COUNTING -> player.get(category.getKey()) - baseline.get(category.getKey());
            case RATE -> {
                double denominator = player.denominator(category);
                if (denominator <= 0) yield 0.0;
                double expected = baseline.rate(category) * denominator;
                yield player.rateNumerator(category) - expected;
            }
            case RATIO -> {
                double denominator = player.denominator(category);
                double ratio = player.get(category.getKey());
                if (denominator <= 0 || ratio <= 0) yield 0.0; // ratio absent de la projection
                double expectedNegative = baseline.get(category.getKey()) * denominator;
                yield expectedNegative - player.weightedRatio(category);
            }
        };
    }

    // Valeur dont on mesure la dispersion : même unité que le numérateur du SGP
    private double dispersedValue(StatLine line, CategoryDefinition category) {
        return switch (category.getKind()) {
            case COUNTING -> line.get(category.getKey());
            case RATE -> line.rateNumerator(category);
            case RATIO -> line.weightedRatio(category);
        };
    }

    private boolean contributes(StatLine line, CategoryDefinition category) {
        return switch (category.getKind()) {
            case COUNTING -> true;
            case RATE -> line.denominator(category) > 0;
            case RATIO -> line.denominator(category) > 0 && line.get(category.getKey()) > 0;
        };
    }

    static String key(CategoryDefinition category) {
        return category.getKey().trim().toLowerCase(Locale.ROOT);
    }
}
