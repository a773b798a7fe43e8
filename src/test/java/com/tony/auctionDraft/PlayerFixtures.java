package com.tony.auctionDraft;

import com.tony.auctionDraft.model.Player;
import com.tony.auctionDraft.model.PlayerType;

import java.util.HashMap;
import java.util.Map;

/**
 * Joueurs de test. Tout varie avec les HR : le classement d'un pool ne dépend que d'eux.
 */
public final class PlayerFixtures {

    private PlayerFixtures() {
    }

    public static Player hitter(long id, String name, String positions, double hr) {
        Map<String, Double> stats = new HashMap<>();
        stats.put("ab", 500.0);
        stats.put("h", 135.0);
        stats.put("avg", 0.270);
        stats.put("r", 60.0 + hr);
        stats.put("hr", hr);
        stats.put("rbi", 60.0 + hr);
        stats.put("sb", 5.0);
        return withId(new Player(name, "NYY", positions, PlayerType.HITTER, stats), id);
    }

    public static Player pitcher(long id, String name, String positions, double k) {
        Map<String, Double> stats = new HashMap<>();
        stats.put("ip", 150.0);
        stats.put("w", 10.0);
        stats.put("sv", 0.0);
        stats.put("k", k);
        stats.put("era", 3.80);
        stats.put("whip", 1.20);
        return withId(new Player(name, "LAD", positions, PlayerType.PITCHER, stats), id);
    }

    public static Player withId(Player player, long id) {
        player.setId(id);
        return player;
    }
}
