package com.tony.auctionDraft.model;

public enum PlayerType {
    HITTER("ab"),
    PITCHER("ip");

    // Clé du dénominateur de temps de jeu (AB pour les frappeurs, IP pour les lanceurs)
    private final String playingTimeKey;

    PlayerType(String playingTimeKey) {
        this.playingTimeKey = playingTimeKey;
    }

    public String getPlayingTimeKey() {
        return playingTimeKey;
    }
}
