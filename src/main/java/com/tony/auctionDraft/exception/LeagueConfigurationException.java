package com.tony.auctionDraft.exception;

/**
 * Paramètres de ligue invalides (fractions de budget, roster, catégories).
 * Levée avant toute valorisation, le message est remonté tel quel à l'utilisateur.
 */
public class LeagueConfigurationException extends RuntimeException {
    public LeagueConfigurationException(String message) {
        super(message);
    }
}
