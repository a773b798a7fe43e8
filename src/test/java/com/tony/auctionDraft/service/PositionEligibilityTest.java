package com.tony.auctionDraft.service;

import com.tony.auctionDraft.model.Player;
import com.tony.auctionDraft.model.RosterSlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.tony.auctionDraft.PlayerFixtures.hitter;
import static com.tony.auctionDraft.PlayerFixtures.pitcher;
import static org.assertj.core.api.Assertions.assertThat;

class PositionEligibilityTest {

    private PositionEligibility eligibility;

    @BeforeEach
    void setUp() {
        eligibility = new PositionEligibility();
    }

    @Test
    @DisplayName("Les tags multi-positions donnent chaque position de base")
    void shouldResolveEveryBasePosition() {
        Player player = hitter(1, "Utility Guy", "SS, 2B", 15);

        assertThat(eligibility.resolve(player))
                .containsExactlyInAnyOrder(RosterSlot.SHORTSTOP, RosterSlot.SECOND_BASE);
    }

    @Test
    @DisplayName("LF / CF / RF sont ramenés à OF")
    void shouldAliasOutfieldTags() {
        Player player = hitter(1, "Center Fielder", "LF/CF", 20);

        assertThat(eligibility.resolve(player)).containsExactly(RosterSlot.OUTFIELD);
        assertThat(eligibility.fills(player, "OF")).isTrue();
    }

    @Test
    @DisplayName("Un DH n'a aucune position de base mais reste éligible UTIL")
    void designatedHitterOnlyFillsUtility() {
        Player dh = hitter(1, "Designated", "DH", 35);

        assertThat(eligibility.resolve(dh)).isEmpty();
        assertThat(eligibility.fills(dh, RosterSlot.UTILITY)).isTrue();
        assertThat(eligibility.fills(dh, RosterSlot.C)).isFalse();
        assertThat(eligibility.eligibleSlots(dh)).containsExactly(RosterSlot.UTILITY);
    }

    @Test
    @DisplayName("CI accepte 1B et 3B, MI accepte 2B et SS")
    void compositeSlotsAcceptTheirConstituents() {
        Player firstBase = hitter(1, "First", "1B", 25);
        Player shortstop = hitter(2, "Short", "SS", 10);

        assertThat(eligibility.fills(firstBase, RosterSlot.CORNER_INFIELD)).isTrue();
        assertThat(eligibility.fills(firstBase, RosterSlot.MIDDLE_INFIELD)).isFalse();
        assertThat(eligibility.fills(shortstop, RosterSlot.MIDDLE_INFIELD)).isTrue();
        assertThat(eligibility.fills(shortstop, RosterSlot.CORNER_INFIELD)).isFalse();
    }

    @Test
    @DisplayName("Un lanceur remplit P mais jamais un slot de frappeur")
    void pitchersNeverFillHitterSlots() {
        Player starter = pitcher(1, "Ace", "SP", 220);

        assertThat(eligibility.fills(starter, RosterSlot.STARTER)).isTrue();
        assertThat(eligibility.fills(starter, RosterSlot.PITCHER)).isTrue();
        assertThat(eligibility.fills(starter, RosterSlot.RELIEVER)).isFalse();
        assertThat(eligibility.fills(starter, RosterSlot.UTILITY)).isFalse();
    }

    @Test
    @DisplayName("Les tags inconnus ou d'un autre type sont ignorés")
    void shouldIgnoreUnknownOrForeignTags() {
        Player twoWay = hitter(1, "Two Way", "SP,OF,XYZ", 30);

        assertThat(eligibility.resolve(twoWay)).containsExactly(RosterSlot.OUTFIELD);
        assertThat(eligibility.fills(twoWay, "XYZ")).isFalse();
    }
}
