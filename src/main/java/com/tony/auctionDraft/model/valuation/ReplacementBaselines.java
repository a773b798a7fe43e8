package com.tony.auctionDraft.model.valuation;

import com.tony.auctionDraft.model.PlayerType;
import com.tony.auctionDraft.model.RosterSlot;
import com.tony.auctionDraft.model.StatLine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lignes de remplacement d'une époque : une par type (toujours) et une par position de base (mode positionnel).
 */
public final class ReplacementBaselines {

    private final Map<PlayerType, StatLine> global;
    private final Map<RosterSlot, StatLine> positional;

    public ReplacementBaselines(Map<PlayerType, StatLine> global, Map<RosterSlot, StatLine> positional) {
        this.global = Collections.unmodifiableMap(global.isEmpty() ? new EnumMap<>(PlayerType.class) : new EnumMap<>(global));
        this.positional = Collections.unmodifiableMap(positional.isEmpty() ? new EnumMap<>(RosterSlot.class) : new EnumMap<>(positional));
    }

    public Optional<StatLine> global(PlayerType type) {
        return Optional.ofNullable(global.get(type));
    }

    public Optional<StatLine> positional(RosterSlot slot) {
        return Optional.ofNullable(positional.get(slot));
    }

    public Map<RosterSlot, StatLine> getPositional() {
        return positional;
    }
}
