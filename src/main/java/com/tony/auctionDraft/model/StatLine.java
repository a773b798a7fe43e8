package com.tony.auctionDraft.model;

import com.tony.auctionDraft.config.CategoryDefinition;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Ligne statistique projetée d'un joueur (immuable).
 * Les clés sont normalisées en minuscules : "hr", "avg", "ip"...
 */
@EqualsAndHashCode
@ToString
public final class StatLine {

    private final Map<String, Double> stats;
    private final String playingTimeKey;

    public StatLine(Map<String, Double> stats, PlayerType type) {
        this(stats, type.getPlayingTimeKey());
    }

    public StatLine(Map<String, Double> stats, String playingTimeKey) {
        Map<String, Double> copy = new HashMap<>();
        if (stats != null) {
            stats.forEach((k, v) -> {
                if (k != null && v != null) copy.put(normalize(k), v);
            });
        }
        this.stats = Collections.unmodifiableMap(copy);
        this.playingTimeKey = normalize(playingTimeKey);
    }

    public double get(String key) {
        return stats.getOrDefault(normalize(key), 0.0);
    }

    public boolean has(String key) {
        return stats.containsKey(normalize(key));
    }

    /** AB pour un frappeur, IP pour un lanceur. */
    public double playingTime() {
        return get(playingTimeKey);
    }

    public double denominator(CategoryDefinition category) {
        return get(category.getDenominator());
    }

    /**
     * Numérateur d'une catégorie RATE (ex: les hits pour AVG).
     * Si la projection ne fournit pas le numérateur, on le reconstruit : taux x dénominateur.
     */
    public double rateNumerator(CategoryDefinition category) {
        if (has(category.getNumerator())) {
            return get(category.getNumerator());
        }
        return get(category.getKey()) * denominator(category);
    }

    /**
     * Taux d'une catégorie RATE (ex: AVG). Sans taux projeté, on le reconstruit : numérateur / dénominateur.
     */
    public double rate(CategoryDefinition category) {
        if (has(category.getKey())) {
            return get(category.getKey());
        }
        double denominator = denominator(category);
        return denominator > 0 ? get(category.getNumerator()) / denominator : 0.0;
    }

    /** Résultats "négatifs" d'une catégorie RATIO (ex: ERA x IP). */
    public double weightedRatio(CategoryDefinition category) {
        return get(category.getKey()) * denominator(category);
    }

    private static String normalize(String key) {
        return key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    }
}
