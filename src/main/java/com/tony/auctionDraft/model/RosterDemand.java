package com.tony.auctionDraft.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Besoin de roster : slot -> nombre de joueurs requis.
 * Peut représenter une équipe (config) ou toute la ligue (x nombre d'équipes), total ou restant.
 */
@EqualsAndHashCode
@ToString
public final class RosterDemand {

    private final Map<RosterSlot, Integer> counts;

    public RosterDemand(Map<RosterSlot, Integer> counts) {
        Map<RosterSlot, Integer> copy = new EnumMap<>(RosterSlot.class);
        if (counts != null) {
            counts.forEach((slot, count) -> {
                if (slot.isBench() || count == null) return;
                if (count < 0) {
                    throw new IllegalArgumentException("Nombre de slots négatif pour " + slot.getLabel() + " : " + count);
                }
                if (count > 0) copy.put(slot, count);
            });
        }
        this.counts = Collections.unmodifiableMap(copy);
    }

    public static RosterDemand empty() {
        return new RosterDemand(Collections.emptyMap());
    }

    public int count(RosterSlot slot) {
        return counts.getOrDefault(slot, 0);
    }

    public Map<RosterSlot, Integer> asMap() {
        return counts;
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int totalFor(PlayerType type) {
        return counts.entrySet().stream()
                .filter(e -> e.getKey().getPlayerType() == type)
                .mapToInt(Map.Entry::getValue)
                .sum();
    }

    public RosterDemand times(int factor) {
        Map<RosterSlot, Integer> result = new EnumMap<>(RosterSlot.class);
        counts.forEach((slot, count) -> result.put(slot, count * factor));
        return new RosterDemand(result);
    }

    public RosterDemand plus(RosterDemand other) {
        Map<RosterSlot, Integer> result = new EnumMap<>(counts);
        other.counts.forEach((slot, count) -> result.merge(slot, count, Integer::sum));
        return new RosterDemand(result);
    }

    /** Soustraction slot par slot, bornée à 0. */
    public RosterDemand minus(RosterDemand other) {
        Map<RosterSlot, Integer> result = new EnumMap<>(RosterSlot.class);
        counts.forEach((slot, count) -> result.put(slot, Math.max(0, count - other.count(slot))));
        return new RosterDemand(result);
    }

    /**
     * Demande par position de base (C, 1B, ..., SP, RP).
     * Les slots composites sont répartis entre leurs constituants (CI -> 1B/3B, MI -> 2B/SS, P -> SP/RP),
     * moitié chacun, le reste impair va au second. UTIL n'est pas distribué : il ne compte que dans le total frappeurs.
     */
    public Map<RosterSlot, Integer> basePositionDemand() {
        Map<RosterSlot, Integer> demand = new EnumMap<>(RosterSlot.class);
        counts.forEach((slot, count) -> {
            if (slot.isBase()) demand.merge(slot, count, Integer::sum);
        });

        splitBetween(demand, count(RosterSlot.CORNER_INFIELD), RosterSlot.CORNER_INFIELD.constituents());
        splitBetween(demand, count(RosterSlot.MIDDLE_INFIELD), RosterSlot.MIDDLE_INFIELD.constituents());
        splitBetween(demand, count(RosterSlot.PITCHER), List.of(RosterSlot.STARTER, RosterSlot.RELIEVER));

        return demand;
    }

    private static void splitBetween(Map<RosterSlot, Integer> demand, int slots, List<RosterSlot> targets) {
        if (slots <= 0) return;
        int half = slots / 2;
        demand.merge(targets.get(0), half, Integer::sum);
        demand.merge(targets.get(1), slots - half, Integer::sum);
    }
}
