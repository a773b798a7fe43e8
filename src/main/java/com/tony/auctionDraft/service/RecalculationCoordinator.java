package com.tony.auctionDraft.service;

import com.tony.auctionDraft.config.CategoryDefinition;
import com.tony.auctionDraft.config.LeagueSettings;
import com.tony.auctionDraft.config.ReplacementMode;
import com.tony.auctionDraft.exception.DraftTransactionConflictException;
import com.tony.auctionDraft.model.*;
import com.tony.auctionDraft.model.valuation.*;
import com.tony.auctionDraft.repository.DraftPickRepository;
import com.tony.auctionDraft.repository.DraftStateRepository;
import com.tony.auctionDraft.repository.PlayerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.*;

/**
 * Point d'entrée unique des mutations de valeurs.
 * Toujours une passe COMPLÈTE sur les joueurs non draftés : lignes de remplacement et dispersion
 * sont des statistiques du pool entier, aucune mise à jour incrémentale n'est correcte.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecalculationCoordinator {

    private final LeagueSettings settings;
    private final PlayerRepository playerRepository;
    private final DraftPickRepository draftPickRepository;
    private final DraftStateRepository draftStateRepository;
    private final ReplacementLevelResolver replacementLevelResolver;
    private final SgpEngine sgpEngine;
    private final DollarConverter dollarConverter;
    private final RosterSlotAssigner rosterSlotAssigner;

    /**
     * Recalcule sur l'état courant du draft (chargement initial, démarrage).
     */
    @Transactional
    public ValuationEpoch recalculate() {
        return run(null);
    }

    /**
     * Recalcule en exigeant que l'état lu soit celui de la transaction attendue.
     * Sinon : DraftTransactionConflictException, à l'appelant de réessayer sur un état frais.
     */
    @Transactional
    public ValuationEpoch recalculate(long expectedSeq) {
        return run(expectedSeq);
    }

    private ValuationEpoch run(Long expectedSeq) {
        // Configuration invalide = on s'arrête avant tout calcul
        settings.validate();

        Optional<DraftState> draftState = draftStateRepository.findFirstByOrderByIdAsc();
        long seq = draftState.map(DraftState::getTransactionSeq).orElse(0L);

        if (expectedSeq != null && expectedSeq != seq) {
            throw new DraftTransactionConflictException(expectedSeq, seq);
        }

        List<Player> undrafted = playerRepository.findByDraftedFalse();
        List<DraftPick> picks = draftState.isPresent()
                ? draftPickRepository.findAllByOrderByPickNumberAsc()
                : List.of();

        RosterDemand demand = remainingDemand(picks);
        LeagueBudget budget = remainingBudget(picks);

        ValuationEpoch epoch = compute(undrafted, demand, budget, settings.getReplacementMode(), seq);

        // Écriture en un seul lot. Les joueurs draftés gardent leur dernière valeur (historique).
        for (Player player : undrafted) {
            epoch.valuationOf(player.getId()).ifPresent(v -> player.applyValuation(v, seq));
        }
        playerRepository.saveAll(undrafted);

        draftState.ifPresent(state -> {
            state.setValuationEpoch(seq);
            state.setUpdatedAt(LocalDateTime.now());
            draftStateRepository.save(state);
        });

        log.info("💰 Valorisation #{} ({}) : {} joueurs disponibles, {} slots restants, budget ${} / ${}",
                seq, settings.getReplacementMode(), epoch.size(), demand.total(),
                Math.round(budget.hitterBudget()), Math.round(budget.pitcherBudget()));
        return epoch;
    }

    /**
     * Fonction pure : (pool non drafté, besoin restant, budget restant) -> époque de valorisation.
     */
    public ValuationEpoch compute(List<Player> undrafted, RosterDemand demand, LeagueBudget budget,
                                  ReplacementMode mode, long epochNumber) {
        // 1. Dispersion : une fois par époque et par type, sur tout le pool du type (jamais par position)
        Map<PlayerType, CategoryDispersion> dispersions = new EnumMap<>(PlayerType.class);
        for (PlayerType type : PlayerType.values()) {
            List<StatLine> lines = undrafted.stream()
                    .filter(p -> p.getPlayerType() == type)
                    .map(Player::getStatLine)
                    .toList();
            dispersions.put(type, sgpEngine.dispersion(lines, settings.categoriesFor(type)));
        }

        // 2. Lignes de remplacement
        ReplacementBaselines baselines = replacementLevelResolver.baseline(undrafted, demand, mode, dispersions);

        ValuationEpoch.ValuationEpochBuilder builder = ValuationEpoch.builder()
                .epoch(epochNumber)
                .computedAt(LocalDateTime.now())
                .baselines(baselines);

        for (PlayerType type : PlayerType.values()) {
            List<Player> players = undrafted.stream().filter(p -> p.getPlayerType() == type).toList();
            if (players.isEmpty()) continue;

            List<CategoryDefinition> categories = settings.categoriesFor(type);
            CategoryDispersion dispersion = dispersions.get(type);

            // 3. SGP contre la ligne la plus favorable au joueur
            Map<Long, SgpScore> scores = new LinkedHashMap<>();
            Map<Long, String> valuedPositions = new HashMap<>();
            for (Player player : players) {
                Map<String, StatLine> candidates = replacementLevelResolver.candidateBaselines(player, baselines, mode);

                SgpScore best = null;
                String bestPosition = null;
                for (Map.Entry<String, StatLine> candidate : candidates.entrySet()) {
                    SgpScore score = sgpEngine.score(player.getStatLine(), candidate.getValue(), dispersion, categories);
                    if (best == null || score.total() > best.total()) {
                        best = score;
                        bestPosition = candidate.getKey();
                    }
                }
                // Plus aucun slot de ce type : valeur nulle
                scores.put(player.getId(), best != null ? best : zeroScore(categories));
                valuedPositions.put(player.getId(), bestPosition);
            }

            // 4. Dollars contre le sous-budget restant du type
            Map<Long, Double> sgpById = new LinkedHashMap<>();
            scores.forEach((id, score) -> sgpById.put(id, score.total()));
            Map<Long, Double> dollars = dollarConverter.toDollars(sgpById, budget.forType(type), settings.getMinBid());

            scores.forEach((id, score) -> builder.valuation(id, new PlayerValuation(
                    id, score.total(), score.breakdown(), dollars.get(id), valuedPositions.get(id))));
        }

        return builder.build();
    }

    /**
     * Besoin restant de la ligue : besoin total moins les slots déjà remplis,
     * chaque équipe affectant ses joueurs de façon gloutonne (slot le plus contraint d'abord).
     */
    public RosterDemand remainingDemand(List<DraftPick> picks) {
        RosterDemand perTeam = settings.rosterDemandPerTeam();
        RosterDemand leagueDemand = perTeam.times(settings.getNumTeams());

        Map<Long, List<Player>> rosters = new LinkedHashMap<>();
        picks.stream()
                .sorted(Comparator.comparing(DraftPick::getPickNumber))
                .forEach(pick -> rosters.computeIfAbsent(pick.getTeam().getId(), k -> new ArrayList<>()).add(pick.getPlayer()));

        RosterDemand filled = RosterDemand.empty();
        for (List<Player> roster : rosters.values()) {
            filled = filled.plus(rosterSlotAssigner.assign(roster, perTeam).filled());
        }
        return leagueDemand.minus(filled);
    }

    /**
     * Sous-budgets restants : sous-budget total moins ce qui a déjà été dépensé sur ce type de joueur.
     */
    public LeagueBudget remainingBudget(List<DraftPick> picks) {
        double hitterSpent = 0.0;
        double pitcherSpent = 0.0;
        for (DraftPick pick : picks) {
            int price = pick.getPrice() != null ? pick.getPrice() : 0;
            if (pick.getPlayer().getPlayerType() == PlayerType.HITTER) hitterSpent += price;
            else pitcherSpent += price;
        }
        return LeagueBudget.of(settings).minusSpent(hitterSpent, pitcherSpent);
    }

    private static SgpScore zeroScore(List<CategoryDefinition> categories) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        categories.forEach(c -> breakdown.put(SgpEngine.key(c), 0.0));
        return new SgpScore(0.0, breakdown);
    }
}
