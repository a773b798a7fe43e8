package com.tony.auctionDraft.service;

import com.tony.auctionDraft.model.Player;
import com.tony.auctionDraft.model.RosterSlot;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Éligibilité d'un joueur aux slots de roster.
 * On rapporte une CAPACITÉ (non exclusive), jamais une affectation.
 */
@Service
public class PositionEligibility {

    // Tags Yahoo/FanGraphs ramenés à une position de base
    private static final Map<String, RosterSlot> TAG_ALIASES = Map.of(
            "LF", RosterSlot.OUTFIELD,
            "CF", RosterSlot.OUTFIELD,
            "RF", RosterSlot.OUTFIELD
    );

    /**
     * Positions de base couvertes par les tags du joueur.
     * Un tag inconnu (ex: "DH") ne donne rien : le joueur reste éligible aux slots universels via son type.
     */
    public Set<RosterSlot> resolve(Player player) {
        Set<RosterSlot> result = EnumSet.noneOf(RosterSlot.class);
        for (String tag : player.getPositionList()) {
            toBaseSlot(tag)
                    .filter(slot -> slot.getPlayerType() == player.getPlayerType())
                    .ifPresent(result::add);
        }
        return result;
    }

    public boolean fills(Player player, RosterSlot slot) {
        if (slot.isBench()) return true;
        if (slot.getPlayerType() != player.getPlayerType()) return false;
        if (slot.isUniversal()) return true; // UTIL = tout frappeur, P = tout lanceur

        Set<RosterSlot> base = resolve(player);
        return slot.constituents().stream().anyMatch(base::contains);
    }

    /** Tous les slots actifs (hors banc) que le joueur peut occuper. */
    public Set<RosterSlot> eligibleSlots(Player player) {
        Set<RosterSlot> result = EnumSet.noneOf(RosterSlot.class);
        for (RosterSlot slot : RosterSlot.values()) {
            if (!slot.isBench() && fills(player, slot)) result.add(slot);
        }
        return result;
    }

    public boolean fills(Player player, String slotLabel) {
        return RosterSlot.fromLabel(slotLabel)
                .map(slot -> fills(player, slot))
                .orElse(false);
    }

    private Optional<RosterSlot> toBaseSlot(String tag) {
        String normalized = tag.trim().toUpperCase(Locale.ROOT);
        RosterSlot alias = TAG_ALIASES.get(normalized);
        if (alias != null) return Optional.of(alias);
        return RosterSlot.fromLabel(normalized).filter(RosterSlot::isBase);
    }
}
