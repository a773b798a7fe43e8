package com.tony.auctionDraft.service;

import com.tony.auctionDraft.model.Player;
import com.tony.auctionDraft.model.PlayerType;
import com.tony.auctionDraft.model.RosterSlot;
import com.tony.auctionDraft.model.dto.PlayerValueBreakdown;
import com.tony.auctionDraft.exception.ValuationNotReadyException;
import com.tony.auctionDraft.repository.PlayerRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lecture des valeurs de la dernière époque commitée (affichage, comparaison, analyse de besoins).
 */
@Service
@RequiredArgsConstructor
public class PlayerValueService {

    private final PlayerRepository playerRepository;
    private final PositionEligibility eligibility;

    /**
     * Valeur en $ du joueur. Un joueur jamais valorisé n'a pas de valeur fiable : on refuse de la lire.
     */
    public double value(Long playerId) {
        Player player = findPlayer(playerId);
        if (!player.isValued() || player.getDollarValue() == null) {
            throw new ValuationNotReadyException("Aucune valorisation disponible pour " + player.getName());
        }
        return player.getDollarValue();
    }

    /**
     * Joueurs non draftés, triés par valeur décroissante. Filtres optionnels : type, slot (ex: "CI", "UTIL").
     */
    public List<Player> availablePlayers(PlayerType type, String position) {
        Optional<RosterSlot> slot = Optional.ofNullable(position).flatMap(RosterSlot::fromLabel);
        if (position != null && slot.isEmpty()) {
            return List.of(); // position inconnue
        }

        return playerRepository.findAvailableOrderByValue().stream()
                .filter(p -> type == null || p.getPlayerType() == type)
                .filter(p -> slot.isEmpty() || eligibility.fills(p, slot.get()))
                .toList();
    }

    public PlayerValueBreakdown breakdown(Long playerId) {
        Player player = findPlayer(playerId);

        Map<String, Double> projected = new LinkedHashMap<>();
        player.getSgpBreakdown().keySet().forEach(cat -> projected.put(cat, player.getStatLine().get(cat)));

        return PlayerValueBreakdown.builder()
                .playerId(player.getId())
                .name(player.getName())
                .type(player.getPlayerType())
                .positions(player.getPositions())
                .totalSgp(player.getSgp())
                .dollarValue(player.getDollarValue())
                .valuedPosition(player.getValuedPosition())
                .valuationEpoch(player.getValuationEpoch())
                .drafted(player.isDrafted())
                .categorySgp(new LinkedHashMap<>(player.getSgpBreakdown()))
                .projectedStats(projected)
                .build();
    }

    public Map<String, Double> categorySurplus(Long playerId, int pricePaid) {
        return categorySurplus(findPlayer(playerId), pricePaid);
    }

    /**
     * Surplus par catégorie : (valeur - prix payé) réparti au prorata du SGP de chaque catégorie.
     * SGP total nul : répartition égale.
     */
    public Map<String, Double> categorySurplus(Player player, int pricePaid) {
        Map<String, Double> breakdown = player.getSgpBreakdown();
        if (breakdown == null || breakdown.isEmpty() || player.getSgp() == null) {
            return Map.of();
        }

        double dollarValue = player.getDollarValue() != null ? player.getDollarValue() : 0.0;
        double totalSurplus = dollarValue - pricePaid;
        double totalSgp = player.getSgp();

        Map<String, Double> surplus = new LinkedHashMap<>();
        if (totalSgp == 0.0) {
            breakdown.keySet().forEach(cat -> surplus.put(cat, totalSurplus / breakdown.size()));
            return surplus;
        }
        breakdown.forEach((cat, sgp) -> surplus.put(cat, (sgp / totalSgp) * totalSurplus));
        return surplus;
    }

    /**
     * Note de draft : indépendante des valeurs et du statut drafté, elle ne déclenche aucun recalcul.
     */
    @Transactional
    public Player updateNote(Long playerId, String note) {
        Player player = findPlayer(playerId);
        player.setNote(note);
        return playerRepository.save(player);
    }

    private Player findPlayer(Long playerId) {
        return playerRepository.findById(playerId)
                .orElseThrow(() -> new EntityNotFoundException("Joueur introuvable ID: " + playerId));
    }
}
