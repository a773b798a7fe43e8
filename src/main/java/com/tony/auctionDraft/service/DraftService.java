package com.tony.auctionDraft.service;

import com.tony.auctionDraft.config.LeagueSettings;
import com.tony.auctionDraft.exception.DraftRuleViolationException;
import com.tony.auctionDraft.model.DraftPick;
import com.tony.auctionDraft.model.DraftState;
import com.tony.auctionDraft.model.FantasyTeam;
import com.tony.auctionDraft.model.Player;
import com.tony.auctionDraft.model.dto.DraftHistoryEntry;
import com.tony.auctionDraft.repository.DraftPickRepository;
import com.tony.auctionDraft.repository.DraftStateRepository;
import com.tony.auctionDraft.repository.FantasyTeamRepository;
import com.tony.auctionDraft.repository.PlayerRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cycle de vie du draft aux enchères.
 * Chaque pick / undo et le recalcul qui suit forment UNE seule transaction :
 * aucun lecteur ne voit un pick commité avec des valeurs périmées.
 * Les transactions concurrentes sont sérialisées par le verrou optimiste de DraftState (@Version).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DraftService {

    private final LeagueSettings settings;
    private final PlayerRepository playerRepository;
    private final FantasyTeamRepository teamRepository;
    private final DraftPickRepository draftPickRepository;
    private final DraftStateRepository draftStateRepository;
    private final RecalculationCoordinator recalculationCoordinator;

    public Optional<DraftState> getDraftState() {
        return draftStateRepository.findFirstByOrderByIdAsc();
    }

    /**
     * Nouveau draft : on efface tout, on crée les équipes de la ligue (la première est celle de l'utilisateur)
     * puis on fait la valorisation initiale.
     */
    @Transactional
    public DraftState initializeDraft(String userTeamName) {
        settings.validate();
        resetDraft();

        List<FantasyTeam> teams = new ArrayList<>();
        for (int i = 0; i < settings.getNumTeams(); i++) {
            boolean isUser = (i == 0);
            String name = isUser ? userTeamName : "Team " + (i + 1);
            teams.add(new FantasyTeam(name, settings.getBudgetPerTeam(), isUser));
        }
        teamRepository.saveAll(teams);

        DraftState state = draftStateRepository.save(
                new DraftState(settings.getName(), settings.getNumTeams(), settings.getBudgetPerTeam()));

        log.info("🌱 Draft initialisé : {} équipes, ${} chacune", settings.getNumTeams(), settings.getBudgetPerTeam());
        recalculationCoordinator.recalculate(state.getTransactionSeq());
        return state;
    }

    @Transactional
    public void resetDraft() {
        playerRepository.resetDraftedFlags();
        draftPickRepository.deleteAllInBatch();
        teamRepository.deleteAllInBatch();
        draftStateRepository.deleteAllInBatch();
    }

    @Transactional
    public DraftPick draftPlayer(Long playerId, Long teamId, int price) {
        Player player = playerRepository.findById(playerId)
                .orElseThrow(() -> new EntityNotFoundException("Joueur introuvable ID: " + playerId));
        FantasyTeam team = teamRepository.findById(teamId)
                .orElseThrow(() -> new EntityNotFoundException("Équipe introuvable ID: " + teamId));
        DraftState state = draftStateRepository.findFirstByOrderByIdAsc()
                .filter(DraftState::isActive)
                .orElseThrow(() -> new DraftRuleViolationException("Aucun draft actif"));

        // Règles du draft
        if (player.isDrafted()) {
            throw new DraftRuleViolationException(player.getName() + " a déjà été drafté");
        }
        if (price < settings.getMinBid()) {
            throw new DraftRuleViolationException("Le prix doit être d'au moins $" + settings.getMinBid());
        }
        int maxBid = calculateMaxBid(team);
        if (price > maxBid) {
            throw new DraftRuleViolationException(String.format(
                    "%s ne peut pas dépasser $%d (reste $%d, tentative à $%d)",
                    team.getName(), maxBid, remainingBudget(team), price));
        }

        state.setCurrentPick(state.getCurrentPick() + 1);
        DraftPick pick = draftPickRepository.save(new DraftPick(team, player, price, state.getCurrentPick()));

        player.setDrafted(true);
        playerRepository.save(player);

        long seq = state.nextTransaction();
        draftStateRepository.save(state);

        log.info("🔨 Pick #{} : {} -> {} pour ${}", pick.getPickNumber(), player.getName(), team.getName(), price);

        // Même transaction : le pick n'est visible qu'avec les valeurs recalculées
        recalculationCoordinator.recalculate(seq);
        return pick;
    }

    @Transactional
    public Optional<Player> undoLastPick() {
        return draftPickRepository.findFirstByOrderByPickNumberDesc()
                .flatMap(pick -> undoPick(pick.getId()));
    }

    @Transactional
    public Optional<Player> undoPick(Long pickId) {
        Optional<DraftPick> found = draftPickRepository.findById(pickId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        DraftPick pick = found.get();
        Player player = pick.getPlayer();

        player.setDrafted(false);
        playerRepository.save(player);
        draftPickRepository.delete(pick);

        DraftState state = draftStateRepository.findFirstByOrderByIdAsc()
                .orElseThrow(() -> new DraftRuleViolationException("Aucun draft en cours"));
        long seq = state.nextTransaction();
        draftStateRepository.save(state);

        log.info("↩️ Annulation du pick #{} : {} retourne dans le pool", pick.getPickNumber(), player.getName());

        recalculationCoordinator.recalculate(seq);
        return Optional.of(player);
    }

    /**
     * Historique du draft, du plus récent au plus ancien.
     */
    public List<DraftHistoryEntry> getDraftHistory(Integer limit) {
        List<DraftPick> picks = (limit != null && limit > 0)
                ? draftPickRepository.findAllByOrderByPickNumberDesc(PageRequest.of(0, limit))
                : draftPickRepository.findAllByOrderByPickNumberDesc();

        return picks.stream().map(DraftHistoryEntry::from).toList();
    }

    public int remainingBudget(FantasyTeam team) {
        return team.getBudget() - draftPickRepository.sumPriceByTeam(team.getId());
    }

    /**
     * Enchère max : il faut garder l'enchère minimum pour chaque slot encore vide (hors celui-ci).
     */
    public int calculateMaxBid(FantasyTeam team) {
        int rosterSize = settings.activeRosterSpots();
        int drafted = draftPickRepository.findByTeamIdOrderByPickNumberAsc(team.getId()).size();
        int openSpots = rosterSize - drafted;
        if (openSpots <= 0) {
            return 0;
        }
        return Math.max(0, remainingBudget(team) - (openSpots - 1) * settings.getMinBid());
    }
}
