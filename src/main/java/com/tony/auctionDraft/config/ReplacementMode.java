package com.tony.auctionDraft.config;

public enum ReplacementMode {
    GLOBAL,     // Une ligne de remplacement par type (frappeur / lanceur)
    POSITIONAL  // Une ligne par position (méthode FanGraphs), par défaut
}
