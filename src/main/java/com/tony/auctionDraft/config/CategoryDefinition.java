package com.tony.auctionDraft.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Une catégorie de scoring rotisserie et sa classification.
 * Pour RATE : numerator (ex: "h") / denominator (ex: "ab").
 * Pour RATIO : seul le denominator (ex: "ip") est requis.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CategoryDefinition {
    private String key;
    private CategoryKind kind = CategoryKind.COUNTING;
    private String numerator;
    private String denominator;

    public static CategoryDefinition counting(String key) {
        return new CategoryDefinition(key, CategoryKind.COUNTING, null, null);
    }

    public static CategoryDefinition rate(String key, String numerator, String denominator) {
        return new CategoryDefinition(key, CategoryKind.RATE, numerator, denominator);
    }

    public static CategoryDefinition ratio(String key, String denominator) {
        return new CategoryDefinition(key, CategoryKind.RATIO, null, denominator);
    }
}
