package com.tony.auctionDraft.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Slots de roster d'une équipe.
 * Ordre de déclaration = ordre d'assignation gloutonne (le plus contraint d'abord, UTIL/P en dernier).
 */
public enum RosterSlot {
    C("C", PlayerType.HITTER),
    FIRST_BASE("1B", PlayerType.HITTER),
    SECOND_BASE("2B", PlayerType.HITTER),
    THIRD_BASE("3B", PlayerType.HITTER),
    SHORTSTOP("SS", PlayerType.HITTER),
    OUTFIELD("OF", PlayerType.HITTER),
    CORNER_INFIELD("CI", PlayerType.HITTER),
    MIDDLE_INFIELD("MI", PlayerType.HITTER),
    UTILITY("UTIL", PlayerType.HITTER),
    STARTER("SP", PlayerType.PITCHER),
    RELIEVER("RP", PlayerType.PITCHER),
    PITCHER("P", PlayerType.PITCHER),
    BENCH("BN", null);

    private final String label;
    private final PlayerType playerType; // null = banc (tout le monde)

    RosterSlot(String label, PlayerType playerType) {
        this.label = label;
        this.playerType = playerType;
    }

    public String getLabel() {
        return label;
    }

    public PlayerType getPlayerType() {
        return playerType;
    }

    public boolean isBench() {
        return this == BENCH;
    }

    public boolean isUniversal() {
        return this == UTILITY || this == PITCHER;
    }

    public boolean isComposite() {
        return this == CORNER_INFIELD || this == MIDDLE_INFIELD;
    }

    public boolean isBase() {
        return !isBench() && !isUniversal() && !isComposite();
    }

    /**
     * Positions de base acceptées par un slot composite (CI -> 1B/3B, MI -> 2B/SS).
     * Pour un slot de base, renvoie le slot lui-même. Vide pour UTIL, P et BN.
     */
    public List<RosterSlot> constituents() {
        return switch (this) {
            case CORNER_INFIELD -> List.of(FIRST_BASE, THIRD_BASE);
            case MIDDLE_INFIELD -> List.of(SECOND_BASE, SHORTSTOP);
            case UTILITY, PITCHER, BENCH -> Collections.emptyList();
            default -> List.of(this);
        };
    }

    public static Set<RosterSlot> baseSlots(PlayerType type) {
        Set<RosterSlot> result = EnumSet.noneOf(RosterSlot.class);
        for (RosterSlot slot : values()) {
            if (slot.isBase() && slot.playerType == type) result.add(slot);
        }
        return result;
    }

    public static Optional<RosterSlot> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.label.equals(normalized))
                .findFirst();
    }
}
