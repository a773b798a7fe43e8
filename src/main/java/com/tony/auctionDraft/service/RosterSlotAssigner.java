package com.tony.auctionDraft.service;

import com.tony.auctionDraft.model.Player;
import com.tony.auctionDraft.model.RosterAssignment;
import com.tony.auctionDraft.model.RosterDemand;
import com.tony.auctionDraft.model.RosterSlot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Affectation gloutonne des joueurs d'une équipe à ses slots.
 * Ordre : slot le plus contraint d'abord (C, 1B, 2B, 3B, SS, OF, puis CI, MI, UTIL ; SP, RP, puis P),
 * pour ne pas gaspiller un joueur polyvalent sur un slot qu'un joueur moins flexible pouvait remplir.
 */
@Service
@RequiredArgsConstructor
public class RosterSlotAssigner {

    private final PositionEligibility eligibility;

    /**
     * @param roster joueurs draftés de l'équipe, dans l'ordre du draft
     * @param perTeamDemand slots requis pour une équipe
     */
    public RosterAssignment assign(List<Player> roster, RosterDemand perTeamDemand) {
        Set<Player> unassigned = new LinkedHashSet<>(roster);
        Map<RosterSlot, List<Player>> slots = new EnumMap<>(RosterSlot.class);

        // L'ordre de déclaration de l'enum EST l'ordre de priorité
        for (RosterSlot slot : RosterSlot.values()) {
            int required = perTeamDemand.count(slot);
            if (slot.isBench() || required == 0) continue;

            List<Player> assigned = new ArrayList<>();
            for (Player player : new ArrayList<>(unassigned)) {
                if (assigned.size() >= required) break;
                if (eligibility.fills(player, slot)) {
                    assigned.add(player);
                    unassigned.remove(player);
                }
            }
            if (!assigned.isEmpty()) slots.put(slot, assigned);
        }

        return new RosterAssignment(slots, new ArrayList<>(unassigned));
    }
}
