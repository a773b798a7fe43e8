package com.tony.auctionDraft.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Affectation des joueurs draftés d'une équipe à ses slots (le surplus va au banc).
 */
public record RosterAssignment(Map<RosterSlot, List<Player>> slots, List<Player> bench) {

    public RosterAssignment {
        slots = Collections.unmodifiableMap(slots.isEmpty() ? new EnumMap<>(RosterSlot.class) : new EnumMap<>(slots));
        bench = List.copyOf(bench);
    }

    public List<Player> playersAt(RosterSlot slot) {
        return slots.getOrDefault(slot, List.of());
    }

    public RosterDemand filled() {
        Map<RosterSlot, Integer> counts = new EnumMap<>(RosterSlot.class);
        slots.forEach((slot, players) -> counts.put(slot, players.size()));
        return new RosterDemand(counts);
    }
}
