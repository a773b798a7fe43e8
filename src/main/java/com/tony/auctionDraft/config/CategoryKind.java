package com.tony.auctionDraft.config;

public enum CategoryKind {
    COUNTING, // R, HR, RBI, SB, W, SV, K : plus c'est haut, mieux c'est
    RATE,     // AVG : ratio pondéré par le temps de jeu, plus haut = mieux
    RATIO     // ERA, WHIP : ratio pondéré par les manches, plus bas = mieux
}
