package com.tony.auctionDraft.service;

import com.tony.auctionDraft.config.CategoryDefinition;
import com.tony.auctionDraft.config.CategoryKind;
import com.tony.auctionDraft.config.LeagueSettings;
import com.tony.auctionDraft.config.ReplacementMode;
import com.tony.auctionDraft.model.Player;
import com.tony.auctionDraft.model.PlayerType;
import com.tony.auctionDraft.model.RosterDemand;
import com.tony.auctionDraft.model.RosterSlot;
import com.tony.auctionDraft.model.StatLine;
import com.tony.auctionDraft.model.valuation.CategoryDispersion;
import com.tony.auctionDraft.model.valuation.ReplacementBaselines;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lignes de remplacement (le "zéro" de la valeur au-dessus du remplacement).
 *
 * Circularité classement / valeur résolue en deux passes :
 * passe 1 = valorisation grossière contre la ligne moyenne du pool, uniquement pour ORDONNER les joueurs ;
 * passe 2 (SgpEngine) = vrai SGP contre les lignes dérivées de cet ordre.
 * Le résultat de la passe 2 ne revient jamais dans le classement : pas de point fixe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReplacementLevelResolver {

    private final LeagueSettings settings;
    private final SgpEngine sgpEngine;
    private final PositionEligibility eligibility;

    public ReplacementBaselines baseline(List<Player> pool, RosterDemand demand, ReplacementMode mode) {
        Map<PlayerType, CategoryDispersion> dispersions = new EnumMap<>(PlayerType.class);
        for (PlayerType type : PlayerType.values()) {
            dispersions.put(type, sgpEngine.dispersion(linesOf(pool, type), settings.categoriesFor(type)));
        }
        return baseline(pool, demand, mode, dispersions);
    }

    /**
     * Variante utilisée par le coordinateur, qui a déjà calculé la dispersion de l'époque.
     */
    public ReplacementBaselines baseline(List<Player> pool, RosterDemand demand, ReplacementMode mode,
                                         Map<PlayerType, CategoryDispersion> dispersions) {
        Map<PlayerType, StatLine> global = new EnumMap<>(PlayerType.class);
        Map<RosterSlot, StatLine> positional = new EnumMap<>(RosterSlot.class);
        Map<RosterSlot, Integer> baseDemand = demand.basePositionDemand();

        for (PlayerType type : PlayerType.values()) {
            List<Player> players = pool.stream().filter(p -> p.getPlayerType() == type).toList();
            int typeDemand = demand.totalFor(type);

            if (players.isEmpty() || typeDemand <= 0) {
                log.debug("Pas de ligne de remplacement pour {} ({} joueurs, {} slots restants)", type, players.size(), typeDemand);
                continue;
            }

            List<Player> ranked = rankByPreliminaryValue(players, type, dispersions.get(type));

            // Global : le N-ième joueur du type (ou le dernier s'il en manque)
            global.put(type, lineAtRank(ranked, typeDemand));

            if (mode == ReplacementMode.POSITIONAL) {
                for (RosterSlot slot : RosterSlot.baseSlots(type)) {
                    int n = baseDemand.getOrDefault(slot, 0);
                    if (n <= 0) continue;

                    List<Player> eligible = ranked.stream()
                            .filter(p -> eligibility.resolve(p).contains(slot))
                            .toList();
                    if (eligible.isEmpty()) continue;

                    if (eligible.size() < n) {
                        log.debug("Seulement {} joueurs éligibles en {} pour {} slots : on prend le dernier", eligible.size(), slot.getLabel(), n);
                    }
                    positional.put(slot, lineAtRank(eligible, n));
                }
            }
        }

        return new ReplacementBaselines(global, positional);
    }

    /**
     * Lignes candidates pour un joueur : une par position de base éligible ayant une ligne (mode positionnel),
     * sinon la ligne globale de son type. Le coordinateur garde celle qui donne le SGP le plus élevé.
     */
    public Map<String, StatLine> candidateBaselines(Player player, ReplacementBaselines baselines, ReplacementMode mode) {
        Map<String, StatLine> candidates = new LinkedHashMap<>();
        if (mode == ReplacementMode.POSITIONAL) {
            Set<RosterSlot> slots = eligibility.resolve(player);
            for (RosterSlot slot : slots) {
                baselines.positional(slot).ifPresent(line -> candidates.put(slot.getLabel(), line));
            }
        }
        if (candidates.isEmpty()) {
            baselines.global(player.getPlayerType()).ifPresent(line -> candidates.put(player.getPlayerType().name(), line));
        }
        return candidates;
    }

    /**
     * Passe 1 : SGP grossier contre la ligne moyenne du pool, tri décroissant.
     * Égalités départagées par nom puis id pour un ordre déterministe (idempotence du recalcul).
     */
    public List<Player> rankByPreliminaryValue(List<Player> players, PlayerType type, CategoryDispersion dispersion) {
        List<CategoryDefinition> categories = settings.categoriesFor(type);
        StatLine mean = populationMean(linesOf(players, type), categories, type);

        Map<Player, Double> preliminary = new IdentityHashMap<>();
        for (Player p : players) {
            preliminary.put(p, sgpEngine.score(p.getStatLine(), mean, dispersion, categories).total());
        }

        return players.stream()
                .sorted(Comparator.<Player>comparingDouble(preliminary::get).reversed()
                        .thenComparing(Player::getName, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(Player::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Ligne "moyenne" du pool : moyenne simple pour le comptage,
     * somme(numérateur) / somme(dénominateur) pour les taux et ratios.
     */
    StatLine populationMean(List<StatLine> lines, List<CategoryDefinition> categories, PlayerType type) {
        List<StatLine> playing = lines.stream().filter(l -> l.playingTime() > 0).toList();
        Map<String, Double> mean = new HashMap<>();
        if (playing.isEmpty()) {
            return new StatLine(mean, type);
        }

        for (CategoryDefinition category : categories) {
            String key = SgpEngine.key(category);
            if (category.getKind() == CategoryKind.COUNTING) {
                mean.put(key, playing.stream().mapToDouble(l -> l.get(key)).average().orElse(0.0));
                continue;
            }
            double numerator = 0.0;
            double denominator = 0.0;
            for (StatLine line : playing) {
                double den = line.denominator(category);
                if (den <= 0) continue;
                if (category.getKind() == CategoryKind.RATE) {
                    numerator += line.rateNumerator(category);
                } else if (line.get(key) > 0) {
                    numerator += line.weightedRatio(category);
                } else {
                    continue;
                }
                denominator += den;
            }
            mean.put(key, denominator > 0 ? numerator / denominator : 0.0);
        }
        return new StatLine(mean, type);
    }

    private static StatLine lineAtRank(List<Player> ranked, int n) {
        int index = Math.min(n, ranked.size()) - 1;
        return ranked.get(index).getStatLine();
    }

    private static List<StatLine> linesOf(List<Player> pool, PlayerType type) {
        return pool.stream()
                .filter(p -> p.getPlayerType() == type)
                .map(Player::getStatLine)
                .toList();
    }
}
