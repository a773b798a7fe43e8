package com.tony.auctionDraft.service;

import com.tony.auctionDraft.config.LeagueSettings;
import com.tony.auctionDraft.config.ReplacementMode;
import com.tony.auctionDraft.exception.DraftTransactionConflictException;
import com.tony.auctionDraft.model.*;
import com.tony.auctionDraft.model.valuation.CategoryDispersion;
import com.tony.auctionDraft.model.valuation.PlayerValuation;
import com.tony.auctionDraft.model.valuation.ValuationEpoch;
import com.tony.auctionDraft.repository.DraftPickRepository;
import com.tony.auctionDraft.repository.DraftStateRepository;
import com.tony.auctionDraft.repository.PlayerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.tony.auctionDraft.PlayerFixtures.hitter;
import static com.tony.auctionDraft.PlayerFixtures.pitcher;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecalculationCoordinatorTest {

    @Mock
    private PlayerRepository playerRepository;

    @Mock
    private DraftPickRepository draftPickRepository;

    @Mock
    private DraftStateRepository draftStateRepository;

    private LeagueSettings settings;
    private SgpEngine sgpEngine;
    private RecalculationCoordinator coordinator;

    private List<Player> hitters;

    @BeforeEach
    void setUp() {
        settings = new LeagueSettings();
        sgpEngine = new SgpEngine();
        PositionEligibility eligibility = new PositionEligibility();
        coordinator = new RecalculationCoordinator(settings, playerRepository, draftPickRepository, draftStateRepository,
                new ReplacementLevelResolver(settings, sgpEngine, eligibility), sgpEngine,
                new DollarConverter(), new RosterSlotAssigner(eligibility));

        hitters = List.of(
                hitter(1, "Catcher A", "C", 30),
                hitter(2, "Catcher B", "C", 20),
                hitter(3, "Catcher C", "C", 10),
                hitter(4, "Outfielder A", "OF", 40),
                hitter(5, "Outfielder B", "OF", 28),
                hitter(6, "Outfielder C", "OF", 18),
                hitter(7, "Outfielder D", "OF", 8)
        );
    }

    @Test
    @DisplayName("Conservation : la somme des valeurs positives égale le sous-budget")
    void positiveValuesSumToSubBudget() {
        settings.setMinBid(0);
        LeagueBudget budget = new LeagueBudget(500.0, 200.0);

        ValuationEpoch epoch = coordinator.compute(hitters, demand(1, 2), budget, ReplacementMode.POSITIONAL, 1L);

        double total = epoch.getValuations().values().stream().mapToDouble(PlayerValuation::dollarValue).sum();
        assertThat(total).isCloseTo(500.0, within(1e-6));
        assertThat(epoch.size()).isEqualTo(hitters.size());
    }

    @Test
    @DisplayName("Aucune valeur sous l'enchère minimum")
    void everyValueIsAtLeastMinimumBid() {
        ValuationEpoch epoch = coordinator.compute(hitters, demand(1, 2), new LeagueBudget(500.0, 200.0),
                ReplacementMode.POSITIONAL, 1L);

        assertThat(epoch.getValuations().values())
                .allSatisfy(v -> assertThat(v.dollarValue()).isGreaterThanOrEqualTo(settings.getMinBid()));
    }

    @Test
    @DisplayName("Deux slots C au lieu d'un : le meilleur catcher vaut plus")
    void deeperCatcherDemandRaisesCatcherValue() {
        LeagueBudget budget = new LeagueBudget(500.0, 200.0);

        ValuationEpoch oneCatcher = coordinator.compute(hitters, demand(1, 2), budget, ReplacementMode.POSITIONAL, 1L);
        ValuationEpoch twoCatchers = coordinator.compute(hitters, demand(2, 2), budget, ReplacementMode.POSITIONAL, 1L);

        PlayerValuation before = oneCatcher.valuationOf(1L).orElseThrow();
        PlayerValuation after = twoCatchers.valuationOf(1L).orElseThrow();

        assertThat(before.sgp()).isCloseTo(0.0, within(1e-9));
        assertThat(after.sgp()).isGreaterThan(before.sgp());
        assertThat(after.dollarValue()).isGreaterThan(before.dollarValue());
        assertThat(after.valuedPosition()).isEqualTo("C");
    }

    @Test
    @DisplayName("Idempotence : deux passes sur le même état donnent les mêmes valeurs")
    void recomputationIsIdempotent() {
        LeagueBudget budget = new LeagueBudget(500.0, 200.0);

        ValuationEpoch first = coordinator.compute(hitters, demand(1, 2), budget, ReplacementMode.POSITIONAL, 3L);
        ValuationEpoch second = coordinator.compute(new ArrayList<>(hitters), demand(1, 2), budget, ReplacementMode.POSITIONAL, 3L);

        assertThat(second.getValuations()).isEqualTo(first.getValuations());
    }

    @Test
    @DisplayName("Après le départ du meilleur joueur : ordre conservé et budget restant entièrement distribué")
    void removingTopPlayerKeepsOrderAndConservation() {
        settings.setMinBid(0);
        LeagueBudget budget = new LeagueBudget(500.0, 200.0);
        ValuationEpoch before = coordinator.compute(hitters, demand(1, 2), budget, ReplacementMode.GLOBAL, 1L);

        // Le meilleur frappeur part à $60 : un slot OF et $60 de moins
        List<Player> remaining = hitters.stream().filter(p -> p.getId() != 4L).toList();
        LeagueBudget afterBudget = budget.minusSpent(60.0, 0.0);
        ValuationEpoch after = coordinator.compute(remaining, demand(1, 1), afterBudget, ReplacementMode.GLOBAL, 2L);

        Comparator<Player> byValueBefore = Comparator.comparingDouble(p -> -before.valuationOf(p.getId()).orElseThrow().sgp());
        Comparator<Player> byValueAfter = Comparator.comparingDouble(p -> -after.valuationOf(p.getId()).orElseThrow().sgp());
        assertThat(remaining.stream().sorted(byValueAfter).toList())
                .isEqualTo(remaining.stream().sorted(byValueBefore).toList());

        double total = after.getValuations().values().stream().mapToDouble(PlayerValuation::dollarValue).sum();
        assertThat(total).isCloseTo(440.0, within(1e-6));

        // Les joueurs restants se partagent exactement ce que le drafté valait au-delà de son prix
        double freed = before.valuationOf(4L).orElseThrow().dollarValue() - 60.0;
        double gained = 0.0;
        for (Player p : remaining) {
            double delta = after.valuationOf(p.getId()).orElseThrow().dollarValue()
                    - before.valuationOf(p.getId()).orElseThrow().dollarValue();
            assertThat(delta).isGreaterThanOrEqualTo(-1e-9).isLessThanOrEqualTo(freed + 1e-9);
            gained += delta;
        }
        assertThat(gained).isCloseTo(freed, within(1e-6));
    }

    @Test
    @DisplayName("Joueur multi-positions : valorisé contre la ligne de sa position la plus favorable")
    void multiPositionPlayerIsValuedAtMostFavourablePosition() {
        // ARRANGE
        Player flexible = hitter(15, "Flexible", "C,1B", 25);
        List<Player> pool = List.of(
                hitter(11, "Catcher A", "C", 30),
                hitter(12, "Catcher B", "C", 10),
                hitter(13, "First A", "1B", 40),
                hitter(14, "First B", "1B", 35),
                flexible);
        RosterDemand demand = new RosterDemand(Map.of(RosterSlot.C, 3, RosterSlot.FIRST_BASE, 2));

        // ACT
        ValuationEpoch epoch = coordinator.compute(pool, demand, new LeagueBudget(500.0, 200.0),
                ReplacementMode.POSITIONAL, 1L);

        // ASSERT
        PlayerValuation valuation = epoch.valuationOf(15L).orElseThrow();
        StatLine catcherBaseline = epoch.getBaselines().positional(RosterSlot.C).orElseThrow();
        StatLine firstBaseBaseline = epoch.getBaselines().positional(RosterSlot.FIRST_BASE).orElseThrow();
        assertThat(catcherBaseline.get("hr")).isEqualTo(10.0);
        assertThat(firstBaseBaseline.get("hr")).isEqualTo(35.0);

        CategoryDispersion dispersion = sgpEngine.dispersion(
                pool.stream().map(Player::getStatLine).toList(), settings.getHittingCategories());
        double againstFirstBase = sgpEngine.score(flexible.getStatLine(), firstBaseBaseline, dispersion,
                settings.getHittingCategories()).total();
        double againstCatcher = sgpEngine.score(flexible.getStatLine(), catcherBaseline, dispersion,
                settings.getHittingCategories()).total();

        assertThat(valuation.valuedPosition()).isEqualTo("C");
        assertThat(valuation.sgp()).isPositive();
        assertThat(valuation.sgp()).isCloseTo(againstCatcher, within(1e-9));
        assertThat(valuation.sgp()).isGreaterThan(againstFirstBase);
        assertThat(valuation.dollarValue()).isGreaterThan(settings.getMinBid());
    }

    @Test
    @DisplayName("Plus aucun slot lanceur : SGP nul et enchère minimum")
    void typeWithoutRemainingSlotsGetsMinimumBid() {
        List<Player> pool = new ArrayList<>(hitters);
        pool.add(pitcher(20, "Starter A", "SP", 220));
        pool.add(pitcher(21, "Starter B", "SP", 150));

        ValuationEpoch epoch = coordinator.compute(pool, demand(1, 2), new LeagueBudget(500.0, 200.0),
                ReplacementMode.POSITIONAL, 1L);

        PlayerValuation ace = epoch.valuationOf(20L).orElseThrow();
        assertThat(ace.sgp()).isZero();
        assertThat(ace.dollarValue()).isEqualTo(1.0);
        assertThat(ace.valuedPosition()).isNull();
    }

    @Test
    @DisplayName("Besoin restant : affectation gloutonne des picks de chaque équipe")
    void remainingDemandSubtractsAssignedSlots() {
        FantasyTeam team = team(10L);
        List<DraftPick> picks = List.of(
                new DraftPick(team, hitter(1, "Catcher A", "C", 30), 20, 1),
                new DraftPick(team, hitter(2, "Catcher B", "C", 20), 5, 2),
                new DraftPick(team, hitter(3, "Catcher C", "C", 10), 1, 3));

        RosterDemand remaining = coordinator.remainingDemand(picks);

        assertThat(remaining.count(RosterSlot.C)).isEqualTo(11);
        assertThat(remaining.count(RosterSlot.UTILITY)).isEqualTo(11);
        assertThat(remaining.count(RosterSlot.OUTFIELD)).isEqualTo(36);
        assertThat(remaining.total()).isEqualTo(15 * 12 - 2); // le troisième catcher est au banc
    }

    @Test
    @DisplayName("Budget restant : chaque sous-budget perd ce qui a été dépensé sur son type")
    void remainingBudgetIsSplitByPlayerType() {
        FantasyTeam team = team(10L);
        List<DraftPick> picks = List.of(
                new DraftPick(team, hitter(1, "Catcher A", "C", 30), 30, 1),
                new DraftPick(team, pitcher(20, "Starter A", "SP", 220), 10, 2));

        LeagueBudget remaining = coordinator.remainingBudget(picks);

        assertThat(remaining.hitterBudget()).isCloseTo(3120 * 0.68 - 30, within(1e-9));
        assertThat(remaining.pitcherBudget()).isCloseTo(3120 * 0.32 - 10, within(1e-9));
    }

    @Test
    @DisplayName("Transaction attendue dépassée : conflit, rien n'est écrit")
    void staleExpectedSequenceRaisesConflict() {
        DraftState state = new DraftState("Test League", 12, 260);
        state.setTransactionSeq(3L);
        when(draftStateRepository.findFirstByOrderByIdAsc()).thenReturn(Optional.of(state));

        assertThatThrownBy(() -> coordinator.recalculate(2L))
                .isInstanceOf(DraftTransactionConflictException.class);

        verify(playerRepository, never()).saveAll(any());
        verify(draftStateRepository, never()).save(any());
    }

    @Test
    @DisplayName("Les joueurs draftés gardent leur dernière valeur")
    void draftedPlayersKeepTheirValue() {
        Player drafted = hitter(4, "Outfielder A", "OF", 40);
        drafted.setDrafted(true);
        drafted.setDollarValue(42.0);
        drafted.setValuationEpoch(1L);

        List<Player> undrafted = new ArrayList<>(hitters.subList(0, 3));

        DraftState state = new DraftState("Test League", 12, 260);
        state.setTransactionSeq(2L);
        state.setValuationEpoch(1L);

        when(draftStateRepository.findFirstByOrderByIdAsc()).thenReturn(Optional.of(state));
        when(playerRepository.findByDraftedFalse()).thenReturn(undrafted);
        when(draftPickRepository.findAllByOrderByPickNumberAsc())
                .thenReturn(List.of(new DraftPick(team(10L), drafted, 42, 1)));

        ValuationEpoch epoch = coordinator.recalculate(2L);

        assertThat(epoch.valuationOf(4L)).isEmpty();
        assertThat(drafted.getDollarValue()).isEqualTo(42.0);
        assertThat(drafted.getValuationEpoch()).isEqualTo(1L);
        assertThat(hitters.subList(0, 3)).allSatisfy(p -> assertThat(p.getValuationEpoch()).isEqualTo(2L));
        assertThat(state.getValuationEpoch()).isEqualTo(2L);
        assertThat(state.valuesStale()).isFalse();
        verify(playerRepository, times(1)).saveAll(any());
    }

    @Test
    @DisplayName("Pick puis undo : les valeurs reviennent exactement à l'état d'avant le pick")
    void pickThenUndoRestoresPreviousValues() {
        // ARRANGE
        DraftState state = new DraftState("Test League", 12, 260);
        Player top = hitters.get(3);
        List<Player> withoutTop = hitters.stream().filter(p -> p != top).toList();
        DraftPick pick = new DraftPick(team(10L), top, 45, 1);

        when(draftStateRepository.findFirstByOrderByIdAsc()).thenReturn(Optional.of(state));
        when(playerRepository.findByDraftedFalse()).thenReturn(hitters, withoutTop, hitters);
        when(draftPickRepository.findAllByOrderByPickNumberAsc()).thenReturn(List.of(), List.of(pick), List.of());

        // ACT
        ValuationEpoch beforePick = coordinator.recalculate(0L);
        state.nextTransaction();
        ValuationEpoch afterPick = coordinator.recalculate(1L);
        state.nextTransaction();
        ValuationEpoch afterUndo = coordinator.recalculate(2L);

        // ASSERT
        assertThat(afterPick.valuationOf(top.getId())).isEmpty();
        assertThat(afterUndo.getValuations()).isEqualTo(beforePick.getValuations());
        assertThat(top.getValuationEpoch()).isEqualTo(2L);
        verify(playerRepository, times(3)).saveAll(any());
    }

    private static RosterDemand demand(int catchers, int outfielders) {
        return new RosterDemand(Map.of(RosterSlot.C, catchers, RosterSlot.OUTFIELD, outfielders));
    }

    private static FantasyTeam team(Long id) {
        FantasyTeam team = new FantasyTeam("Team " + id, 260, false);
        team.setId(id);
        return team;
    }
}
